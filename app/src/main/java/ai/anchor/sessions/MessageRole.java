package ai.anchor.sessions;

import java.util.Locale;
import java.util.Optional;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    TOOL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MessageRole> fromWire(String value) {
        for (var role : values()) {
            if (role.wireName().equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}

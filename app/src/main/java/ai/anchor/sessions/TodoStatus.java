package ai.anchor.sessions;

import java.util.Locale;
import java.util.Optional;

public enum TodoStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<TodoStatus> fromWire(String value) {
        for (var status : values()) {
            if (status.wireName().equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}

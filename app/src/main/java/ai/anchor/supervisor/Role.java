package ai.anchor.supervisor;

import java.util.Locale;

/**
 * Role of a supervised process within a session's process group.
 */
public enum Role {
    GROUP,
    COORDINATOR,
    STATE,
    AGENT;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

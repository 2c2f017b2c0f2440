package ai.anchor.supervisor;

import java.time.Duration;
import java.util.Objects;

/**
 * Allows at most {@code maxRestarts} group restarts within any {@code window}.
 */
public record RestartPolicy(int maxRestarts, Duration window) {
    public static final RestartPolicy DEFAULT = new RestartPolicy(3, Duration.ofSeconds(5));

    public RestartPolicy {
        Objects.requireNonNull(window, "window");
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative: " + maxRestarts);
        }
    }
}

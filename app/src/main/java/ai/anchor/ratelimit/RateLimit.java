package ai.anchor.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * At most {@code limit} attempts within a trailing {@code window}.
 */
public record RateLimit(int limit, Duration window) {
    public RateLimit {
        Objects.requireNonNull(window, "window");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
    }
}

package ai.anchor.ratelimit;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sliding-window throttle keyed by (operation, key).
 *
 * <p>{@link #check} only reads; callers commit a successful attempt with {@link #record}. Two concurrent checks
 * near the limit may therefore both pass, so the throttle is approximate.
 */
public final class RateLimiter {
    private static final Logger logger = LogManager.getLogger(RateLimiter.class);

    public static final String RESUME = "resume";
    public static final RateLimit DEFAULT_RESUME_LIMIT = new RateLimit(5, Duration.ofSeconds(60));
    public static final RateLimit DEFAULT_LIMIT = new RateLimit(10, Duration.ofSeconds(60));

    private final Map<String, RateLimit> limits;
    private final RateLimit defaultLimit;
    private final Clock clock;
    private final ConcurrentHashMap<WindowKey, Deque<Long>> windows = new ConcurrentHashMap<>();

    public RateLimiter() {
        this(Map.of(RESUME, DEFAULT_RESUME_LIMIT), DEFAULT_LIMIT, Clock.systemUTC());
    }

    public RateLimiter(Map<String, RateLimit> limits, RateLimit defaultLimit, Clock clock) {
        this.limits = Map.copyOf(limits);
        this.defaultLimit = Objects.requireNonNull(defaultLimit);
        this.clock = Objects.requireNonNull(clock);
    }

    /** Result of {@link #check}. {@code retryAfterSeconds} is 0 when allowed. */
    public record Decision(boolean allowed, long retryAfterSeconds) {
        static final Decision ALLOWED = new Decision(true, 0);
    }

    private record WindowKey(String operation, String key) {}

    public RateLimit limitFor(String operation) {
        return limits.getOrDefault(operation, defaultLimit);
    }

    /**
     * Whether another attempt is allowed right now. Does not record anything.
     */
    public Decision check(String operation, String key) {
        var limit = limitFor(operation);
        var windowMillis = limit.window().toMillis();
        long now = clock.millis();
        long cutoff = now - windowMillis;

        var timestamps = windows.get(new WindowKey(operation, key));
        if (timestamps == null) {
            return Decision.ALLOWED;
        }

        int inWindow = 0;
        long oldestInWindow = Long.MAX_VALUE;
        synchronized (timestamps) {
            for (long ts : timestamps) {
                if (ts > cutoff) {
                    inWindow++;
                    oldestInWindow = Math.min(oldestInWindow, ts);
                }
            }
        }

        if (inWindow < limit.limit()) {
            return Decision.ALLOWED;
        }
        long remainingMillis = oldestInWindow + windowMillis - now;
        long retryAfter = Math.max((remainingMillis + 999) / 1000, 1);
        return new Decision(false, retryAfter);
    }

    /**
     * Like {@link #check} but fails with {@code RATE_LIMIT_EXCEEDED} when blocked.
     */
    public void checkOrThrow(String operation, String key) throws SessionException {
        var decision = check(operation, key);
        if (!decision.allowed()) {
            logger.warn("Rate limit exceeded for {} on {}; retry after {}s", operation, key, decision.retryAfterSeconds());
            throw new SessionException(
                    SessionError.RATE_LIMIT_EXCEEDED,
                    "Rate limit exceeded for " + operation + "; retry after " + decision.retryAfterSeconds() + "s",
                    Map.of("operation", operation, "retryAfterSeconds", decision.retryAfterSeconds()));
        }
    }

    /**
     * Record an attempt. Entries outside the window are dropped and the list never grows past twice the limit.
     */
    public void record(String operation, String key) {
        var limit = limitFor(operation);
        long now = clock.millis();
        long cutoff = now - limit.window().toMillis();
        int cap = limit.limit() * 2;

        windows.compute(new WindowKey(operation, key), (k, existing) -> {
            var timestamps = existing != null ? existing : new ArrayDeque<Long>();
            synchronized (timestamps) {
                timestamps.addFirst(now);
                timestamps.removeIf(ts -> ts <= cutoff);
                while (timestamps.size() > cap) {
                    timestamps.removeLast();
                }
            }
            return timestamps;
        });
    }

    /** Forget all attempts for the key. Safe to call repeatedly. */
    public void reset(String operation, String key) {
        windows.remove(new WindowKey(operation, key));
    }

    /**
     * Drop windows whose attempts have all expired.
     *
     * @return number of windows removed
     */
    public int cleanupExpired() {
        long now = clock.millis();
        int removed = 0;
        for (var key : windows.keySet()) {
            long cutoff = now - limitFor(key.operation()).window().toMillis();
            var result = windows.computeIfPresent(key, (k, timestamps) -> {
                synchronized (timestamps) {
                    timestamps.removeIf(ts -> ts <= cutoff);
                    return timestamps.isEmpty() ? null : timestamps;
                }
            });
            if (result == null) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Rate limiter cleanup removed {} expired windows", removed);
        }
        return removed;
    }

    /** Number of tracked (operation, key) windows. */
    public int trackedKeys() {
        return windows.size();
    }

    /** Stored attempt count for the key, in or out of the window. */
    public int attemptCount(String operation, String key) {
        var timestamps = windows.get(new WindowKey(operation, key));
        if (timestamps == null) {
            return 0;
        }
        synchronized (timestamps) {
            return timestamps.size();
        }
    }
}

package ai.anchor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Checked failure of a session lifecycle or persistence operation.
 *
 * <p>The {@link #error()} kind is the stable, machine-readable part. The message is meant for logs;
 * use {@link ErrorSanitizer} for text shown to users.
 */
public class SessionException extends Exception {
    private final SessionError error;
    private final Map<String, Object> details;

    public SessionException(SessionError error, String message) {
        this(error, message, Map.of(), null);
    }

    public SessionException(SessionError error, String message, @Nullable Throwable cause) {
        this(error, message, Map.of(), cause);
    }

    public SessionException(SessionError error, String message, Map<String, ?> details) {
        this(error, message, details, null);
    }

    public SessionException(SessionError error, String message, Map<String, ?> details, @Nullable Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public SessionError error() {
        return error;
    }

    /** True when the same call may succeed if tried again later. */
    public boolean isRetryable() {
        return error.isRetryable();
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Seconds until a rate-limited operation may be retried, or 0 when not applicable.
     */
    public long retryAfterSeconds() {
        var value = details.get("retryAfterSeconds");
        return value instanceof Number n ? n.longValue() : 0L;
    }

    public static SessionException notFound(String sessionId) {
        return new SessionException(SessionError.NOT_FOUND, "Session not found: " + sessionId, Map.of("id", sessionId));
    }

    public static SessionException invalidField(String field, String message) {
        return new SessionException(SessionError.INVALID_FIELD, message, Map.of("field", field));
    }
}

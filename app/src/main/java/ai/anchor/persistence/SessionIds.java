package ai.anchor.persistence;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import java.util.Map;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Syntax check for session ids before they become part of a file name.
 */
public final class SessionIds {
    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private SessionIds() {}

    public static boolean isValid(@Nullable String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }

    public static String requireValid(@Nullable String id) throws SessionException {
        if (!isValid(id)) {
            throw new SessionException(
                    SessionError.INVALID_SESSION_ID,
                    "Invalid session id: " + id,
                    Map.of("id", String.valueOf(id)));
        }
        return id;
    }
}

package ai.anchor;

import java.util.EnumMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns {@link SessionException}s into messages that are safe to show in the UI.
 *
 * <p>User-facing text never contains file paths, ids or exception details; those go to the log.
 */
public final class ErrorSanitizer {
    private static final Logger logger = LogManager.getLogger(ErrorSanitizer.class);

    private static final String GENERIC = "Operation failed.";
    private static final Map<SessionError, String> MESSAGES = new EnumMap<>(SessionError.class);

    static {
        MESSAGES.put(SessionError.SESSION_EXISTS, "Session already exists.");
        MESSAGES.put(SessionError.PROJECT_ALREADY_OPEN, "Project is already open in another session.");
        MESSAGES.put(SessionError.SESSION_LIMIT_REACHED, "Maximum sessions reached.");
        MESSAGES.put(SessionError.PERSISTED_LIMIT_REACHED, "Maximum saved sessions reached.");
        MESSAGES.put(SessionError.PATH_NOT_FOUND, "Path does not exist.");
        MESSAGES.put(SessionError.PATH_NOT_DIRECTORY, "Path is not a directory.");
        MESSAGES.put(SessionError.PATH_OUTSIDE_PROJECT, "Path is outside the project.");
        MESSAGES.put(SessionError.PROJECT_PATH_NOT_FOUND, "Project path no longer exists.");
        MESSAGES.put(SessionError.PROJECT_PATH_NOT_DIRECTORY, "Project path is no longer a directory.");
        MESSAGES.put(SessionError.PROJECT_PATH_CHANGED, "Project path properties changed unexpectedly.");
        MESSAGES.put(SessionError.IO_ERROR, "File operation failed.");
        MESSAGES.put(SessionError.INVALID_SESSION_ID, "Invalid session identifier.");
        MESSAGES.put(SessionError.INVALID_JSON, "Session file is corrupted.");
        MESSAGES.put(SessionError.NOT_AN_OBJECT, "Session file is corrupted.");
        MESSAGES.put(SessionError.MISSING_FIELDS, "Session file is incomplete.");
        MESSAGES.put(SessionError.INVALID_FIELD, "Session file contains invalid data.");
        MESSAGES.put(SessionError.INVALID_VERSION, "Session file contains invalid data.");
        MESSAGES.put(SessionError.UNSUPPORTED_VERSION, "Session file was written by a newer version.");
        MESSAGES.put(SessionError.UNKNOWN_ROLE, "Session file contains invalid data.");
        MESSAGES.put(SessionError.UNKNOWN_STATUS, "Session file contains invalid data.");
        MESSAGES.put(SessionError.INVALID_TIMESTAMP, "Session file contains invalid data.");
        MESSAGES.put(SessionError.FILE_TOO_LARGE, "Session file is too large.");
        MESSAGES.put(SessionError.SIGNATURE_VERIFICATION_FAILED, "Data integrity check failed.");
        MESSAGES.put(SessionError.SAVE_IN_PROGRESS, "Save operation already in progress.");
        MESSAGES.put(SessionError.RATE_LIMIT_EXCEEDED, "Too many attempts. Please wait and try again.");
        MESSAGES.put(SessionError.TIMEOUT, "Operation timed out.");
        MESSAGES.put(SessionError.NOT_FOUND, "Session not found.");
        MESSAGES.put(SessionError.GROUP_START_FAILED, "Failed to start session.");
        MESSAGES.put(SessionError.PROCESS_CRASHED, "Session process failed.");
    }

    private ErrorSanitizer() {}

    public static String userMessage(SessionError error) {
        return MESSAGES.getOrDefault(error, GENERIC);
    }

    /**
     * Logs the full failure and returns the sanitized text for display.
     */
    public static String userMessage(SessionException e) {
        logger.warn("Session operation failed ({}): {}", e.error(), e.getMessage(), e);
        if (e.error() == SessionError.RATE_LIMIT_EXCEEDED && e.retryAfterSeconds() > 0) {
            return "Too many attempts. Try again in " + e.retryAfterSeconds() + " seconds.";
        }
        return userMessage(e.error());
    }
}

package ai.anchor;

/**
 * Error kinds reported through {@link SessionException}.
 */
public enum SessionError {
    // Invariant violations
    SESSION_EXISTS(Category.INVARIANT),
    PROJECT_ALREADY_OPEN(Category.INVARIANT),
    SESSION_LIMIT_REACHED(Category.INVARIANT),
    PERSISTED_LIMIT_REACHED(Category.INVARIANT),

    // Environment
    PATH_NOT_FOUND(Category.ENVIRONMENT),
    PATH_NOT_DIRECTORY(Category.ENVIRONMENT),
    PATH_OUTSIDE_PROJECT(Category.ENVIRONMENT),
    PROJECT_PATH_NOT_FOUND(Category.ENVIRONMENT),
    PROJECT_PATH_NOT_DIRECTORY(Category.ENVIRONMENT),
    PROJECT_PATH_CHANGED(Category.ENVIRONMENT),
    IO_ERROR(Category.ENVIRONMENT),

    // Integrity
    INVALID_SESSION_ID(Category.INTEGRITY),
    INVALID_JSON(Category.INTEGRITY),
    NOT_AN_OBJECT(Category.INTEGRITY),
    MISSING_FIELDS(Category.INTEGRITY),
    INVALID_FIELD(Category.INTEGRITY),
    INVALID_VERSION(Category.INTEGRITY),
    UNSUPPORTED_VERSION(Category.INTEGRITY),
    UNKNOWN_ROLE(Category.INTEGRITY),
    UNKNOWN_STATUS(Category.INTEGRITY),
    INVALID_TIMESTAMP(Category.INTEGRITY),
    FILE_TOO_LARGE(Category.INTEGRITY),
    SIGNATURE_VERIFICATION_FAILED(Category.INTEGRITY),

    // Transient
    SAVE_IN_PROGRESS(Category.TRANSIENT),
    RATE_LIMIT_EXCEEDED(Category.TRANSIENT),
    TIMEOUT(Category.TRANSIENT),

    // Lifecycle
    NOT_FOUND(Category.LIFECYCLE),
    GROUP_START_FAILED(Category.LIFECYCLE),
    PROCESS_CRASHED(Category.LIFECYCLE);

    public enum Category {
        INVARIANT,
        ENVIRONMENT,
        INTEGRITY,
        TRANSIENT,
        LIFECYCLE
    }

    private final Category category;

    SessionError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    /** Whether a caller may retry the same operation later and expect it to succeed. */
    public boolean isRetryable() {
        return category == Category.TRANSIENT;
    }
}

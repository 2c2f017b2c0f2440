package ai.anchor.persistence;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * Listing entry for a persisted session, read without full validation.
 */
public record PersistedSessionInfo(String id, String name, String projectPath, @Nullable Instant closedAt) {}

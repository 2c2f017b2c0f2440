package ai.anchor.sessions;

import com.github.f4b6a3.uuid.UuidCreator;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Identity and settings of one session. Instances are immutable; rename and config changes produce copies
 * with a fresh {@code updatedAt}.
 *
 * @param id          time-ordered UUID string
 * @param name        display name
 * @param projectPath absolute, normalized project directory
 */
public record Session(
        String id, String name, Path projectPath, LlmConfig config, Instant createdAt, Instant updatedAt) {
    public static final int MAX_NAME_LENGTH = 50;

    public Session {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(projectPath, "projectPath");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (!projectPath.isAbsolute()) {
            throw new IllegalArgumentException("projectPath must be absolute: " + projectPath);
        }
        name = normalizeName(name);
    }

    /**
     * Build a new session with a generated id. A null name defaults to the directory's last segment.
     */
    public static Session create(Path projectPath, @Nullable String name, @Nullable LlmConfig config) {
        var path = projectPath.toAbsolutePath().normalize();
        var now = Instant.now();
        var effectiveName = name != null ? name : defaultName(path);
        return new Session(
                UuidCreator.getTimeOrderedEpoch().toString(),
                effectiveName,
                path,
                config != null ? config : LlmConfig.defaults(),
                now,
                now);
    }

    public Session withName(String newName) {
        return new Session(id, newName, projectPath, config, createdAt, Instant.now());
    }

    public Session withConfig(LlmConfig newConfig) {
        return new Session(id, name, projectPath, newConfig, createdAt, Instant.now());
    }

    /** Path key used for uniqueness checks. */
    public String pathKey() {
        return projectPath.toString();
    }

    /** Directory name, cut to {@link #MAX_NAME_LENGTH}. Explicit names are never cut. */
    private static String defaultName(Path path) {
        var fileName = path.getFileName();
        var name = fileName == null ? "" : fileName.toString().strip();
        if (name.isEmpty()) {
            name = path.toString();
        }
        return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH).strip() : name;
    }

    private static String normalizeName(@Nullable String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        var trimmed = name.strip();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }
}

package ai.anchor;

import ai.anchor.ratelimit.RateLimit;
import ai.anchor.util.AnchorPaths;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.NullMarked;

/**
 * Tunables for the session core.
 *
 * <p>{@link #load()} layers, lowest precedence first: built-in defaults, the classpath
 * {@code anchor.properties}, {@code <base-dir>/anchor.properties}, and {@code anchor.*} system properties.
 */
@NullMarked
public record AnchorConfig(
        AnchorPaths paths,
        int maxSessions,
        Duration callTimeout,
        int maxRestarts,
        Duration restartWindow,
        RateLimit resumeLimit,
        RateLimit defaultLimit,
        long maxFileBytes,
        int maxPersistedSessions,
        boolean autoCleanupOnLimit,
        boolean acceptUnsigned,
        int cleanupMaxAgeDays,
        Duration autoSaveInterval) {
    private static final Logger logger = LogManager.getLogger(AnchorConfig.class);

    public static final String PREFIX = "anchor.";
    static final String RESOURCE = "anchor.properties";

    public AnchorConfig {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
        }
        if (maxPersistedSessions <= 0) {
            throw new IllegalArgumentException("maxPersistedSessions must be positive: " + maxPersistedSessions);
        }
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive: " + maxFileBytes);
        }
        if (cleanupMaxAgeDays <= 0) {
            throw new IllegalArgumentException("cleanupMaxAgeDays must be positive: " + cleanupMaxAgeDays);
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative: " + maxRestarts);
        }
    }

    /** Built-in defaults rooted at the given base directory. */
    public static AnchorConfig defaults(Path baseDir) {
        return fromProperties(AnchorPaths.forBaseDir(baseDir), new Properties());
    }

    public static AnchorConfig load() {
        var props = new Properties();
        try (InputStream in = AnchorConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read classpath {}: {}", RESOURCE, e.getMessage());
        }

        var baseDirOverride = System.getProperty(PREFIX + "base-dir", props.getProperty(PREFIX + "base-dir"));
        var paths = baseDirOverride == null || baseDirOverride.isBlank()
                ? AnchorPaths.defaults()
                : AnchorPaths.forBaseDir(Path.of(baseDirOverride));

        var userFile = paths.getConfigFilePath();
        if (Files.isRegularFile(userFile)) {
            try (Reader reader = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Failed to read {}: {}", userFile, e.getMessage());
            }
        }

        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(paths, props);
    }

    static AnchorConfig fromProperties(AnchorPaths paths, Properties props) {
        return new AnchorConfig(
                paths,
                intValue(props, "max-sessions", 10, 1),
                Duration.ofMillis(intValue(props, "call-timeout-ms", 5000, 1)),
                intValue(props, "supervisor.max-restarts", 3, 0),
                Duration.ofMillis(intValue(props, "supervisor.restart-window-ms", 5000, 1)),
                new RateLimit(
                        intValue(props, "rate-limit.resume.limit", 5, 1),
                        Duration.ofSeconds(intValue(props, "rate-limit.resume.window-seconds", 60, 1))),
                new RateLimit(
                        intValue(props, "rate-limit.default.limit", 10, 1),
                        Duration.ofSeconds(intValue(props, "rate-limit.default.window-seconds", 60, 1))),
                longValue(props, "persistence.max-file-bytes", 10L * 1024 * 1024, 1, Long.MAX_VALUE),
                intValue(props, "persistence.max-sessions", 100, 1),
                boolValue(props, "persistence.auto-cleanup-on-limit", false),
                boolValue(props, "persistence.accept-unsigned", true),
                intValue(props, "persistence.cleanup-max-age-days", 30, 1),
                Duration.ofSeconds(intValue(props, "auto-save-interval-seconds", 0, 0)));
    }

    public AnchorConfig withMaxSessions(int value) {
        return new AnchorConfig(paths, value, callTimeout, maxRestarts, restartWindow, resumeLimit, defaultLimit,
                maxFileBytes, maxPersistedSessions, autoCleanupOnLimit, acceptUnsigned, cleanupMaxAgeDays,
                autoSaveInterval);
    }

    public AnchorConfig withResumeLimit(RateLimit value) {
        return new AnchorConfig(paths, maxSessions, callTimeout, maxRestarts, restartWindow, value, defaultLimit,
                maxFileBytes, maxPersistedSessions, autoCleanupOnLimit, acceptUnsigned, cleanupMaxAgeDays,
                autoSaveInterval);
    }

    public AnchorConfig withRestartPolicy(int restarts, Duration window) {
        return new AnchorConfig(paths, maxSessions, callTimeout, restarts, window, resumeLimit, defaultLimit,
                maxFileBytes, maxPersistedSessions, autoCleanupOnLimit, acceptUnsigned, cleanupMaxAgeDays,
                autoSaveInterval);
    }

    public AnchorConfig withPersistedLimit(int value, boolean autoCleanup) {
        return new AnchorConfig(paths, maxSessions, callTimeout, maxRestarts, restartWindow, resumeLimit,
                defaultLimit, maxFileBytes, value, autoCleanup, acceptUnsigned, cleanupMaxAgeDays, autoSaveInterval);
    }

    public AnchorConfig withAcceptUnsigned(boolean value) {
        return new AnchorConfig(paths, maxSessions, callTimeout, maxRestarts, restartWindow, resumeLimit,
                defaultLimit, maxFileBytes, maxPersistedSessions, autoCleanupOnLimit, value, cleanupMaxAgeDays,
                autoSaveInterval);
    }

    public AnchorConfig withMaxFileBytes(long value) {
        return new AnchorConfig(paths, maxSessions, callTimeout, maxRestarts, restartWindow, resumeLimit,
                defaultLimit, value, maxPersistedSessions, autoCleanupOnLimit, acceptUnsigned, cleanupMaxAgeDays,
                autoSaveInterval);
    }

    private static int intValue(Properties props, String key, int defaultValue, int min) {
        return (int) longValue(props, key, defaultValue, min, Integer.MAX_VALUE);
    }

    /** Parsed value of {@code anchor.<key>}, or the default when it is missing, malformed or out of range. */
    private static long longValue(Properties props, String key, long defaultValue, long min, long max) {
        var raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}{}: '{}'", PREFIX, key, raw);
            return defaultValue;
        }
        if (value < min || value > max) {
            logger.warn("Ignoring out-of-range value for {}{}: {} (allowed {}..{})", PREFIX, key, value, min, max);
            return defaultValue;
        }
        return value;
    }

    private static boolean boolValue(Properties props, String key, boolean defaultValue) {
        var raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(raw.trim());
    }
}

package ai.anchor.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Resolves per-user Anchor storage locations:
 * - persisted session files
 * - the machine secret used for signing
 * - the optional user configuration file
 *
 * The default base directory is {@code ~/.anchor}. For tests and overrides use {@link #forBaseDir(Path)}.
 */
public final class AnchorPaths {
    private static final String SESSIONS_DIR = "sessions";
    private static final String MACHINE_SECRET_FILE = ".machine_secret";
    private static final String CONFIG_FILE = "anchor.properties";

    private final Path baseDir;

    private AnchorPaths(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir).toAbsolutePath().normalize();
    }

    public static AnchorPaths defaults() {
        return new AnchorPaths(Paths.get(System.getProperty("user.home")).resolve(".anchor"));
    }

    public static AnchorPaths forBaseDir(Path baseDir) {
        return new AnchorPaths(baseDir);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * Directory holding one {@code <session-id>.json} file per closed session.
     */
    public Path getSessionsDir() {
        return baseDir.resolve(SESSIONS_DIR);
    }

    public Path getMachineSecretPath() {
        return baseDir.resolve(MACHINE_SECRET_FILE);
    }

    public Path getConfigFilePath() {
        return baseDir.resolve(CONFIG_FILE);
    }

    @Override
    public String toString() {
        return "AnchorPaths{" + baseDir + "}";
    }
}

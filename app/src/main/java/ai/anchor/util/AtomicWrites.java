package ai.anchor.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * File writes that never leave a partially written target behind.
 */
public final class AtomicWrites {
    private static final Logger logger = LogManager.getLogger(AtomicWrites.class);

    public static final String TEMP_SUFFIX = ".tmp";

    private AtomicWrites() {}

    /**
     * Write {@code content} to a temp file next to {@code target}, then move it over the target.
     *
     * <p>A crash before the move leaves the previous target (or none) in place; the temp file is deleted when the
     * write or the move fails.
     */
    public static void atomicOverwrite(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }

        Path temp = Files.createTempFile(dir != null ? dir : Path.of("."), target.getFileName() + ".", TEMP_SUFFIX);
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                logger.warn("Failed to delete temp file {}: {}", temp, cleanup.getMessage());
            }
            throw e;
        }
    }

    /**
     * Try to set POSIX owner-only permissions (rw-------). Non-POSIX file systems are left as they are.
     */
    public static void applyOwnerOnlyPermissions(Path path) {
        try {
            Files.setPosixFilePermissions(
                    path, EnumSet.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
        } catch (UnsupportedOperationException | IOException e) {
            logger.debug("Could not restrict permissions on {}: {}", path, e.getMessage());
        }
    }
}

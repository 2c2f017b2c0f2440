package ai.anchor.persistence;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Identity of a project directory at the moment it was validated.
 *
 * <p>Comparing a later {@link #capture} against this one detects a directory that was deleted, replaced, or had
 * its ownership or permissions changed in between. Owner, group and permissions are only compared on POSIX file
 * systems; the file key is compared wherever the platform provides one.
 */
public record ProjectPathSnapshot(
        Path path,
        @Nullable Object fileKey,
        @Nullable String owner,
        @Nullable String group,
        @Nullable Set<PosixFilePermission> permissions) {

    /**
     * Check that {@code path} is an existing directory and record its identity.
     *
     * @throws SessionException {@code PROJECT_PATH_NOT_FOUND} or {@code PROJECT_PATH_NOT_DIRECTORY}
     */
    public static ProjectPathSnapshot capture(Path path) throws SessionException {
        if (!Files.exists(path)) {
            throw new SessionException(
                    SessionError.PROJECT_PATH_NOT_FOUND,
                    "Project path no longer exists: " + path,
                    Map.of("path", path.toString()));
        }
        if (!Files.isDirectory(path)) {
            throw new SessionException(
                    SessionError.PROJECT_PATH_NOT_DIRECTORY,
                    "Project path is not a directory: " + path,
                    Map.of("path", path.toString()));
        }
        try {
            var basic = Files.readAttributes(path, BasicFileAttributes.class);
            PosixFileAttributes posix = null;
            try {
                posix = Files.readAttributes(path, PosixFileAttributes.class);
            } catch (UnsupportedOperationException e) {
                // not a POSIX file system; identity falls back to the file key
                posix = null;
            }
            return new ProjectPathSnapshot(
                    path,
                    basic.fileKey(),
                    posix != null ? posix.owner().getName() : null,
                    posix != null ? posix.group().getName() : null,
                    posix != null ? Set.copyOf(posix.permissions()) : null);
        } catch (IOException e) {
            throw new SessionException(
                    SessionError.PROJECT_PATH_NOT_FOUND,
                    "Cannot read attributes of project path " + path + ": " + e.getMessage(),
                    Map.of("path", path.toString()),
                    e);
        }
    }

    /**
     * Capture the path again and compare.
     *
     * @throws SessionException {@code PROJECT_PATH_CHANGED} if the directory is no longer the one captured here
     */
    public void revalidate() throws SessionException {
        var current = capture(path);
        if (!Objects.equals(fileKey, current.fileKey)
                || !Objects.equals(owner, current.owner)
                || !Objects.equals(group, current.group)
                || !Objects.equals(permissions, current.permissions)) {
            throw new SessionException(
                    SessionError.PROJECT_PATH_CHANGED,
                    "Project path changed since it was validated: " + path,
                    Map.of("path", path.toString()));
        }
    }
}

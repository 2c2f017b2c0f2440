package ai.anchor.supervisor;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import ai.anchor.sessions.Session;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Group member that owns the session's identity and project-root boundary.
 */
public final class Coordinator extends SessionWorker {
    private final Path projectRoot;
    private @Nullable Path realRoot;

    public Coordinator(Session session) {
        super(Role.COORDINATOR, session.id());
        this.projectRoot = session.projectPath();
    }

    @Override
    protected void onStart() throws SessionException {
        if (!Files.exists(projectRoot)) {
            throw new SessionException(
                    SessionError.PATH_NOT_FOUND, "Project root does not exist: " + projectRoot, Map.of("path", projectRoot.toString()));
        }
        if (!Files.isDirectory(projectRoot)) {
            throw new SessionException(
                    SessionError.PATH_NOT_DIRECTORY,
                    "Project root is not a directory: " + projectRoot,
                    Map.of("path", projectRoot.toString()));
        }
        try {
            realRoot = projectRoot.toRealPath();
        } catch (IOException e) {
            throw new SessionException(SessionError.IO_ERROR, "Cannot resolve project root " + projectRoot, e);
        }
    }

    Path projectRoot() {
        return projectRoot;
    }

    /**
     * Resolve {@code candidate} against the project root and make sure it stays inside it, following symlinks for
     * paths that already exist.
     */
    Path resolveWithinRoot(String candidate) throws SessionException {
        Path resolved;
        try {
            resolved = projectRoot.resolve(candidate).normalize();
        } catch (InvalidPathException e) {
            throw new SessionException(SessionError.PATH_OUTSIDE_PROJECT, "Invalid path: " + candidate, e);
        }
        if (!resolved.startsWith(projectRoot)) {
            throw outside(candidate);
        }
        if (Files.exists(resolved, LinkOption.NOFOLLOW_LINKS)) {
            try {
                var real = resolved.toRealPath();
                var root = realRoot != null ? realRoot : projectRoot.toRealPath();
                if (!real.startsWith(root)) {
                    throw outside(candidate);
                }
            } catch (IOException e) {
                throw new SessionException(SessionError.IO_ERROR, "Cannot resolve " + candidate, e);
            }
        }
        return resolved;
    }

    private SessionException outside(String candidate) {
        return new SessionException(
                SessionError.PATH_OUTSIDE_PROJECT,
                "Path escapes project root " + projectRoot + ": " + candidate,
                Map.of("path", candidate));
    }
}

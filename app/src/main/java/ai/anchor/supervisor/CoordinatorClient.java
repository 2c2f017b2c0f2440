package ai.anchor.supervisor;

import ai.anchor.SessionException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Path checks against a live session's project root, addressed by session id.
 */
public final class CoordinatorClient {
    private final ProcessRegistry processes;
    private final Duration timeout;

    public CoordinatorClient(ProcessRegistry processes, Duration timeout) {
        this.processes = Objects.requireNonNull(processes);
        this.timeout = Objects.requireNonNull(timeout);
    }

    public Path projectRoot(String sessionId) throws SessionException {
        var coordinator = coordinator(sessionId);
        return coordinator.call(coordinator::projectRoot, timeout);
    }

    /**
     * Resolve a path relative to the project root.
     *
     * @throws SessionException {@code PATH_OUTSIDE_PROJECT} if the path leaves the root, directly or via a symlink
     */
    public Path validatePath(String sessionId, String path) throws SessionException {
        var coordinator = coordinator(sessionId);
        return coordinator.call(() -> coordinator.resolveWithinRoot(path), timeout);
    }

    private Coordinator coordinator(String sessionId) throws SessionException {
        return processes.lookup(Role.COORDINATOR, sessionId, Coordinator.class)
                .orElseThrow(() -> SessionException.notFound(sessionId));
    }
}

package ai.anchor.supervisor;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import ai.anchor.sessions.LlmConfig;
import ai.anchor.sessions.Session;
import ai.anchor.sessions.SessionRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns the process groups of all live sessions and keeps them in step with the {@link SessionRegistry}.
 *
 * <p>A session is registered before its group starts and unregistered if the start fails, so the registry never
 * holds an entry without a live group for longer than a start attempt.
 */
public final class SessionSupervisor {
    private static final Logger logger = LogManager.getLogger(SessionSupervisor.class);

    private final SessionRegistry registry;
    private final ProcessRegistry processes;
    private final RestartPolicy restartPolicy;
    private final @Nullable AgentFactory agentFactory;
    private final SessionStateClient stateClient;
    private final CoordinatorClient coordinatorClient;
    private final ConcurrentMap<String, SessionGroup> groups = new ConcurrentHashMap<>();
    private volatile SessionSnapshotter snapshotter = SessionSnapshotter.NONE;

    public SessionSupervisor(SessionRegistry registry, ProcessRegistry processes, RestartPolicy restartPolicy,
                             Duration callTimeout, @Nullable AgentFactory agentFactory) {
        this.registry = Objects.requireNonNull(registry);
        this.processes = Objects.requireNonNull(processes);
        this.restartPolicy = Objects.requireNonNull(restartPolicy);
        this.agentFactory = agentFactory;
        this.stateClient = new SessionStateClient(processes, callTimeout);
        this.coordinatorClient = new CoordinatorClient(processes, callTimeout);
    }

    public void setSnapshotter(SessionSnapshotter snapshotter) {
        this.snapshotter = Objects.requireNonNull(snapshotter);
    }

    public SessionRegistry registry() {
        return registry;
    }

    public ProcessRegistry processes() {
        return processes;
    }

    public SessionStateClient stateClient() {
        return stateClient;
    }

    public CoordinatorClient coordinatorClient() {
        return coordinatorClient;
    }

    /**
     * Create and start a session for an existing project directory.
     *
     * @param name   display name, or null for the directory name
     * @param config provider settings, or null for the defaults
     */
    public Session createSession(Path projectPath, @Nullable String name, @Nullable LlmConfig config)
            throws SessionException {
        var path = projectPath.toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new SessionException(
                    SessionError.PATH_NOT_FOUND, "Project path does not exist: " + path, Map.of("path", path.toString()));
        }
        if (!Files.isDirectory(path)) {
            throw new SessionException(
                    SessionError.PATH_NOT_DIRECTORY, "Project path is not a directory: " + path, Map.of("path", path.toString()));
        }
        Session session;
        try {
            session = Session.create(path, name, config);
        } catch (IllegalArgumentException e) {
            throw SessionException.invalidField("name", e.getMessage());
        }
        return startSession(session);
    }

    /**
     * Register the session, then start its process group. The registration is undone if the group fails to start.
     */
    public Session startSession(Session session) throws SessionException {
        registry.register(session);
        var group = new SessionGroup(session, processes, restartPolicy, agentFactory, this::onGroupFailed);
        try {
            group.start();
        } catch (SessionException e) {
            registry.unregister(session.id());
            logger.error("Failed to start session {}: {}", session.id(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            registry.unregister(session.id());
            logger.error("Failed to start session {}", session.id(), e);
            throw new SessionException(
                    SessionError.GROUP_START_FAILED, "Failed to start session " + session.id() + ": " + e, e);
        }
        groups.put(session.id(), group);
        if (!group.isAlive()) {
            // gave up before it was published
            onGroupFailed(group);
        }
        logger.info("Session {} started for {}", session.id(), session.projectPath());
        return session;
    }

    /**
     * Save the session (best effort), stop its group and unregister it.
     *
     * @throws SessionException {@code NOT_FOUND} if the session is not running
     */
    public void stopSession(String sessionId) throws SessionException {
        if (!groups.containsKey(sessionId)) {
            throw SessionException.notFound(sessionId);
        }
        try {
            snapshotter.snapshot(sessionId);
        } catch (SessionException e) {
            logger.warn("Failed to save session {} before stopping: {}", sessionId, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error saving session {} before stopping", sessionId, e);
        }
        terminateSession(sessionId);
    }

    /**
     * Stop the session's group and unregister it without saving.
     */
    public void terminateSession(String sessionId) throws SessionException {
        var group = groups.remove(sessionId);
        if (group == null) {
            throw SessionException.notFound(sessionId);
        }
        try {
            group.stop();
        } finally {
            registry.unregister(sessionId);
        }
        logger.info("Session {} stopped", sessionId);
    }

    /** Stop every live session, saving each one first. */
    public void stopAll() {
        var ids = List.copyOf(groups.keySet());
        logger.info("Stopping all sessions (count={})", ids.size());
        for (var id : ids) {
            try {
                stopSession(id);
            } catch (SessionException e) {
                logger.debug("Session {} already gone: {}", id, e.getMessage());
            }
        }
    }

    public Session renameSession(String sessionId, String newName) throws SessionException {
        var current = registry.lookup(sessionId).orElseThrow(() -> SessionException.notFound(sessionId));
        Session renamed;
        try {
            renamed = current.withName(newName);
        } catch (IllegalArgumentException e) {
            throw SessionException.invalidField("name", e.getMessage());
        }
        return publish(renamed);
    }

    public Session updateConfig(String sessionId, LlmConfig config) throws SessionException {
        var current = registry.lookup(sessionId).orElseThrow(() -> SessionException.notFound(sessionId));
        return publish(current.withConfig(config));
    }

    public boolean isRunning(String sessionId) {
        var group = groups.get(sessionId);
        return group != null && group.isAlive();
    }

    public Optional<SessionGroup> group(String sessionId) {
        return Optional.ofNullable(groups.get(sessionId));
    }

    public int runningCount() {
        return groups.size();
    }

    private Session publish(Session updated) throws SessionException {
        registry.update(updated);
        var group = groups.get(updated.id());
        if (group != null) {
            group.updateSession(updated);
        }
        stateClient.updateSession(updated.id(), updated);
        return updated;
    }

    private void onGroupFailed(SessionGroup group) {
        if (groups.remove(group.sessionId(), group)) {
            registry.unregister(group.sessionId());
            logger.error("Session {} removed after its process group gave up", group.sessionId());
        }
    }
}

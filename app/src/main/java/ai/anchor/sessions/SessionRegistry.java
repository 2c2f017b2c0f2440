package ai.anchor.sessions;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Thread-safe in-memory registry of live sessions.
 *
 * <p>Reads go straight to concurrent maps and never block each other. Mutations take a single writer lock so
 * the capacity check, the duplicate checks and the insert happen as one step.
 */
public class SessionRegistry {
    private static final Logger logger = LogManager.getLogger(SessionRegistry.class);

    public static final int DEFAULT_MAX_SESSIONS = 10;

    private static final Comparator<Session> BY_CREATION =
            Comparator.comparing(Session::createdAt).thenComparing(Session::id);

    private final int maxSessions;
    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> idsByPath = new ConcurrentHashMap<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public SessionRegistry() {
        this(DEFAULT_MAX_SESSIONS);
    }

    public SessionRegistry(int maxSessions) {
        if (maxSessions <= 0) {
            throw new IllegalArgumentException("maxSessions must be positive: " + maxSessions);
        }
        this.maxSessions = maxSessions;
    }

    /**
     * Add a session. Checks run in a fixed order: capacity, then id, then project path.
     *
     * @throws SessionException {@code SESSION_LIMIT_REACHED}, {@code SESSION_EXISTS} or {@code PROJECT_ALREADY_OPEN}
     */
    public void register(Session session) throws SessionException {
        writeLock.lock();
        try {
            int current = sessions.size();
            if (current >= maxSessions) {
                throw new SessionException(
                        SessionError.SESSION_LIMIT_REACHED,
                        "Session limit reached (" + current + "/" + maxSessions + ")",
                        Map.of("current", current, "max", maxSessions));
            }
            if (sessions.containsKey(session.id())) {
                throw new SessionException(
                        SessionError.SESSION_EXISTS, "Session already registered: " + session.id(), Map.of("id", session.id()));
            }
            var existing = idsByPath.get(session.pathKey());
            if (existing != null) {
                throw new SessionException(
                        SessionError.PROJECT_ALREADY_OPEN,
                        "Project already open in session " + existing,
                        Map.of("id", existing, "path", session.pathKey()));
            }
            idsByPath.put(session.pathKey(), session.id());
            sessions.put(session.id(), session);
        } finally {
            writeLock.unlock();
        }
        logger.debug("Registered session {} ({})", session.id(), session.projectPath());
    }

    /**
     * Remove a session. Removing an unknown id is a no-op.
     */
    public void unregister(String id) {
        writeLock.lock();
        try {
            var removed = sessions.remove(id);
            if (removed != null) {
                idsByPath.remove(removed.pathKey(), id);
                logger.debug("Unregistered session {}", id);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replace the stored session with the same id. The project path must not change.
     */
    public Session update(Session session) throws SessionException {
        writeLock.lock();
        try {
            var current = sessions.get(session.id());
            if (current == null) {
                throw SessionException.notFound(session.id());
            }
            if (!current.pathKey().equals(session.pathKey())) {
                throw new IllegalArgumentException("update must not change the project path of session " + session.id());
            }
            sessions.put(session.id(), session);
            return session;
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<Session> lookup(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public Optional<Session> lookupByPath(Path path) {
        var id = idsByPath.get(path.toAbsolutePath().normalize().toString());
        return id == null ? Optional.empty() : lookup(id);
    }

    /**
     * Exact-match name lookup. When several sessions share a name, the earliest created wins.
     */
    public Optional<Session> lookupByName(String name) {
        return sessions.values().stream().filter(s -> s.name().equals(name)).min(BY_CREATION);
    }

    /** All live sessions, oldest first. */
    public List<Session> listAll() {
        return sessions.values().stream().sorted(BY_CREATION).toList();
    }

    public List<String> listIds() {
        return listAll().stream().map(Session::id).toList();
    }

    public int count() {
        return sessions.size();
    }

    public boolean isFull() {
        return sessions.size() >= maxSessions;
    }

    public int maxSessions() {
        return maxSessions;
    }
}

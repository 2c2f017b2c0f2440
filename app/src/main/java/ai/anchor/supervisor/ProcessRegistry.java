package ai.anchor.supervisor;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Index of live session processes keyed by (role, session id).
 *
 * <p>Entries are added when a process starts and removed from the process's own exit path, so lookups never
 * return a process that has already terminated for good.
 */
public final class ProcessRegistry {
    public record Key(Role role, String sessionId) {}

    private final ConcurrentMap<Key, SupervisedProcess> processes = new ConcurrentHashMap<>();

    /**
     * @return false if another process already holds the same key
     */
    boolean register(SupervisedProcess process) {
        return processes.putIfAbsent(keyOf(process), process) == null;
    }

    /** Removes the entry only if it still points at this process. */
    void unregister(SupervisedProcess process) {
        processes.remove(keyOf(process), process);
    }

    public Optional<SupervisedProcess> lookup(Role role, String sessionId) {
        return Optional.ofNullable(processes.get(new Key(role, sessionId)));
    }

    public <T extends SupervisedProcess> Optional<T> lookup(Role role, String sessionId, Class<T> type) {
        return lookup(role, sessionId).filter(type::isInstance).map(type::cast);
    }

    public List<Key> keysFor(String sessionId) {
        return processes.keySet().stream()
                .filter(k -> k.sessionId().equals(sessionId))
                .toList();
    }

    public int size() {
        return processes.size();
    }

    private static Key keyOf(SupervisedProcess process) {
        return new Key(process.role(), process.sessionId());
    }
}

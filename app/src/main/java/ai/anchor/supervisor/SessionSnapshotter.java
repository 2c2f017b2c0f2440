package ai.anchor.supervisor;

import ai.anchor.SessionException;

/**
 * Writes a live session to durable storage before it is stopped.
 */
@FunctionalInterface
public interface SessionSnapshotter {
    SessionSnapshotter NONE = sessionId -> {};

    void snapshot(String sessionId) throws SessionException;
}

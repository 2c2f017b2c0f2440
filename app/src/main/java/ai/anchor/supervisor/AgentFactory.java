package ai.anchor.supervisor;

import ai.anchor.sessions.Session;

/**
 * Creates the optional agent worker of a session group. Called again with the current session on every
 * group restart, so each call must return a fresh worker with role {@link Role#AGENT}.
 */
@FunctionalInterface
public interface AgentFactory {
    SessionWorker create(Session session);
}

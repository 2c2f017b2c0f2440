package ai.anchor.supervisor;

import ai.anchor.SessionException;
import ai.anchor.sessions.Message;
import ai.anchor.sessions.Session;
import ai.anchor.sessions.Todo;
import ai.anchor.sessions.TokenUsage;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Queries and mutations of a live session's state, addressed by session id.
 *
 * <p>Each call is routed through {@link ProcessRegistry} to the current state holder, so it keeps working across
 * group restarts. Calls wait at most the configured timeout.
 */
public final class SessionStateClient {
    private final ProcessRegistry processes;
    private final Duration timeout;

    public SessionStateClient(ProcessRegistry processes, Duration timeout) {
        this.processes = Objects.requireNonNull(processes);
        this.timeout = Objects.requireNonNull(timeout);
    }

    public SessionState getState(String sessionId) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(holder::snapshot, timeout);
    }

    public List<Message> getMessages(String sessionId) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(holder::messages, timeout);
    }

    public List<Todo> getTodos(String sessionId) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(holder::todos, timeout);
    }

    public Message appendMessage(String sessionId, Message message) throws SessionException {
        Objects.requireNonNull(message);
        var holder = holder(sessionId);
        return holder.call(() -> holder.appendMessage(message), timeout);
    }

    public List<Todo> updateTodos(String sessionId, List<Todo> todos) throws SessionException {
        var copy = List.copyOf(todos);
        var holder = holder(sessionId);
        return holder.call(() -> holder.updateTodos(copy), timeout);
    }

    public Session updateSession(String sessionId, Session session) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(() -> holder.updateSession(session), timeout);
    }

    /** @return false if a stream was already in progress */
    public boolean startStreaming(String sessionId) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(holder::startStreaming, timeout);
    }

    /** @return false if no stream is in progress; the chunk is dropped */
    public boolean appendStreamingChunk(String sessionId, String chunk) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(() -> holder.appendStreamingChunk(chunk), timeout);
    }

    public Optional<Message> endStreaming(String sessionId, @Nullable TokenUsage usage) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(() -> holder.endStreaming(usage), timeout);
    }

    /** @return number of messages removed */
    public int clearConversation(String sessionId) throws SessionException {
        var holder = holder(sessionId);
        return holder.call(holder::clearConversation, timeout);
    }

    private SessionStateHolder holder(String sessionId) throws SessionException {
        return processes.lookup(Role.STATE, sessionId, SessionStateHolder.class)
                .orElseThrow(() -> SessionException.notFound(sessionId));
    }
}

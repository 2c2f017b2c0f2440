package ai.anchor.supervisor;

import ai.anchor.sessions.Message;
import ai.anchor.sessions.MessageRole;
import ai.anchor.sessions.Session;
import ai.anchor.sessions.Todo;
import ai.anchor.sessions.TokenUsage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * Group member holding the conversation, the task list and streaming flags.
 *
 * <p>Fields are only touched from handlers, which all run on this worker's thread. Use
 * {@link SessionStateClient} rather than calling the package-private operations directly.
 */
public final class SessionStateHolder extends SessionWorker {
    private Session session;
    private final List<Message> messages = new ArrayList<>();
    private List<Todo> todos = List.of();
    private @Nullable StringBuilder streamingMessage;

    public SessionStateHolder(Session session) {
        super(Role.STATE, session.id());
        this.session = session;
    }

    SessionState snapshot() {
        return new SessionState(
                session, messages, todos, streamingMessage == null ? null : streamingMessage.toString(),
                streamingMessage != null);
    }

    List<Message> messages() {
        return List.copyOf(messages);
    }

    List<Todo> todos() {
        return todos;
    }

    Message appendMessage(Message message) {
        messages.add(message);
        return message;
    }

    List<Todo> updateTodos(List<Todo> newTodos) {
        todos = List.copyOf(newTodos);
        return todos;
    }

    Session updateSession(Session updated) {
        session = updated;
        return session;
    }

    boolean startStreaming() {
        if (streamingMessage != null) {
            return false;
        }
        streamingMessage = new StringBuilder();
        return true;
    }

    boolean appendStreamingChunk(String chunk) {
        if (streamingMessage == null) {
            return false;
        }
        streamingMessage.append(chunk);
        return true;
    }

    /**
     * Finish the current stream, turning the accumulated text into an assistant message.
     */
    Optional<Message> endStreaming(@Nullable TokenUsage usage) {
        if (streamingMessage == null) {
            return Optional.empty();
        }
        var message = new Message(
                UUID.randomUUID().toString(), MessageRole.ASSISTANT, streamingMessage.toString(), Instant.now(), usage);
        streamingMessage = null;
        messages.add(message);
        return Optional.of(message);
    }

    int clearConversation() {
        int cleared = messages.size();
        messages.clear();
        streamingMessage = null;
        return cleared;
    }
}

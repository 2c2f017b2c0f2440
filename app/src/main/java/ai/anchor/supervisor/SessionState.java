package ai.anchor.supervisor;

import ai.anchor.sessions.Message;
import ai.anchor.sessions.Session;
import ai.anchor.sessions.Todo;
import ai.anchor.sessions.TokenUsage;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Point-in-time copy of a session's mutable state.
 */
public record SessionState(
        Session session,
        List<Message> messages,
        List<Todo> todos,
        @Nullable String streamingMessage,
        boolean streaming) {
    public SessionState {
        messages = List.copyOf(messages);
        todos = List.copyOf(todos);
    }

    public TokenUsage cumulativeUsage() {
        return TokenUsage.sum(messages);
    }
}

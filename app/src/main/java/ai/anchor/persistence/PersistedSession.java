package ai.anchor.persistence;

import ai.anchor.sessions.Message;
import ai.anchor.sessions.Session;
import ai.anchor.sessions.Todo;
import ai.anchor.sessions.TokenUsage;
import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A validated session record read from disk.
 *
 * @param closedAt null when the stored value could not be parsed
 */
public record PersistedSession(
        int version,
        Session session,
        @Nullable Instant closedAt,
        List<Message> messages,
        List<Todo> todos,
        @Nullable TokenUsage cumulativeUsage) {
    public PersistedSession {
        messages = List.copyOf(messages);
        todos = List.copyOf(todos);
    }

    public String id() {
        return session.id();
    }
}

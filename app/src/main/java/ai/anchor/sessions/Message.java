package ai.anchor.sessions;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.jetbrains.annotations.Nullable;

public record Message(String id, MessageRole role, String content, Instant timestamp, @Nullable TokenUsage usage) {
    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public Message(String id, MessageRole role, String content, Instant timestamp) {
        this(id, role, content, timestamp, null);
    }

    public static Message of(MessageRole role, String content) {
        return new Message(UUID.randomUUID().toString(), role, content, Instant.now(), null);
    }
}

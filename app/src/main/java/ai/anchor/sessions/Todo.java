package ai.anchor.sessions;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * One task-list entry. {@code activeForm} is the present-continuous label shown while the task runs.
 */
public record Todo(String content, TodoStatus status, String activeForm) {
    public Todo {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(activeForm, "activeForm");
    }

    public static Todo of(String content, TodoStatus status, @Nullable String activeForm) {
        return new Todo(content, status, activeForm != null ? activeForm : content);
    }
}

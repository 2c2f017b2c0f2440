package ai.anchor.persistence;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import ai.anchor.sessions.LlmConfig;
import ai.anchor.sessions.Message;
import ai.anchor.sessions.MessageRole;
import ai.anchor.sessions.Session;
import ai.anchor.sessions.Todo;
import ai.anchor.sessions.TodoStatus;
import ai.anchor.sessions.TokenUsage;
import ai.anchor.supervisor.SessionState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Converts between live session state and the versioned on-disk record.
 *
 * <p>Record layout (version {@value #SCHEMA_VERSION}):
 * <pre>
 * version, id, name, project_path, config{provider, model, temperature, max_tokens},
 * created_at, updated_at, closed_at,
 * conversation[{id, role, content, timestamp, usage?}], todos[{content, status, active_form}],
 * cumulative_usage?, signature
 * </pre>
 */
public final class SessionSerializer {
    private static final Logger logger = LogManager.getLogger(SessionSerializer.class);

    public static final int SCHEMA_VERSION = 1;

    static final List<String> REQUIRED_FIELDS = List.of(
            "version", "id", "name", "project_path", "config", "created_at", "updated_at", "closed_at",
            "conversation", "todos");
    private static final List<String> MESSAGE_FIELDS = List.of("id", "role", "content", "timestamp");
    private static final List<String> TODO_FIELDS = List.of("content", "status");

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ObjectNode serialize(SessionState state, Instant closedAt) {
        var session = state.session();
        var record = nodes.objectNode();
        record.put("version", SCHEMA_VERSION);
        record.put("id", session.id());
        record.put("name", session.name());
        record.put("project_path", session.projectPath().toString());
        var config = record.putObject("config");
        session.config().toStringMap().forEach(config::put);
        record.put("created_at", formatTimestamp(session.createdAt()));
        record.put("updated_at", formatTimestamp(session.updatedAt()));
        record.put("closed_at", formatTimestamp(closedAt));

        var conversation = record.putArray("conversation");
        for (var message : state.messages()) {
            var node = conversation.addObject();
            node.put("id", message.id());
            node.put("role", message.role().wireName());
            node.put("content", message.content());
            node.put("timestamp", formatTimestamp(message.timestamp()));
            if (message.usage() != null) {
                node.set("usage", usageNode(message.usage()));
            }
        }

        var todos = record.putArray("todos");
        for (var todo : state.todos()) {
            var node = todos.addObject();
            node.put("content", todo.content());
            node.put("status", todo.status().wireName());
            node.put("active_form", todo.activeForm());
        }

        var usage = state.cumulativeUsage();
        if (!usage.equals(TokenUsage.ZERO)) {
            record.set("cumulative_usage", usageNode(usage));
        }
        return record;
    }

    /**
     * Validate and convert a decoded record.
     *
     * @throws SessionException an integrity error naming what is wrong
     */
    public PersistedSession deserialize(JsonNode record) throws SessionException {
        if (!record.isObject()) {
            throw new SessionException(SessionError.NOT_AN_OBJECT, "Session record is not a JSON object");
        }
        requireFields(record, REQUIRED_FIELDS, "");

        var versionNode = record.get("version");
        if (!versionNode.isIntegralNumber() || versionNode.bigIntegerValue().signum() <= 0) {
            throw new SessionException(SessionError.INVALID_VERSION, "Invalid schema version: " + versionNode);
        }
        var id = requireText(record, "id");
        var name = requireText(record, "name");
        var projectPath = requireText(record, "project_path");
        if (!record.get("config").isObject()) {
            throw SessionException.invalidField("config", "config must be an object");
        }
        if (!record.get("conversation").isArray()) {
            throw SessionException.invalidField("conversation", "conversation must be an array");
        }
        if (!record.get("todos").isArray()) {
            throw SessionException.invalidField("todos", "todos must be an array");
        }

        if (!versionNode.canConvertToInt() || versionNode.intValue() > SCHEMA_VERSION) {
            throw new SessionException(
                    SessionError.UNSUPPORTED_VERSION,
                    "Schema version " + versionNode.asText() + " is newer than supported version " + SCHEMA_VERSION,
                    Map.of("version", versionNode.asText(), "supported", SCHEMA_VERSION));
        }
        int version = versionNode.intValue();

        var createdAt = parseTimestamp(record.get("created_at"), "created_at");
        var updatedAt = parseTimestamp(record.get("updated_at"), "updated_at");
        var closedAt = parseOptionalTimestamp(record.get("closed_at"));
        var config = deserializeConfig(record.get("config"));

        Session session;
        try {
            session = new Session(id, name, Path.of(projectPath), config, createdAt, updatedAt);
        } catch (InvalidPathException e) {
            throw SessionException.invalidField("project_path", "Invalid project path: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            var field = e.getMessage() != null && e.getMessage().contains("projectPath") ? "project_path" : "name";
            throw SessionException.invalidField(field, e.getMessage());
        }

        var messages = new ArrayList<Message>();
        int index = 0;
        for (var node : record.get("conversation")) {
            messages.add(deserializeMessage(node, index++));
        }
        var todos = new ArrayList<Todo>();
        index = 0;
        for (var node : record.get("todos")) {
            todos.add(deserializeTodo(node, index++));
        }

        var cumulative = record.get("cumulative_usage");
        var cumulativeUsage = cumulative != null && cumulative.isObject() ? deserializeUsage(cumulative) : null;

        return new PersistedSession(version, session, closedAt, messages, todos, cumulativeUsage);
    }

    /**
     * Parse the timestamp or return null when it is missing or malformed. Used by listing and cleanup, which must
     * tolerate bad records.
     */
    static @Nullable Instant parseOptionalTimestamp(@Nullable JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable timestamp '{}'", node.asText());
            return null;
        }
    }

    static String formatTimestamp(Instant instant) {
        return instant.toString();
    }

    private Message deserializeMessage(JsonNode node, int index) throws SessionException {
        var prefix = "conversation[" + index + "].";
        if (!node.isObject()) {
            throw SessionException.invalidField(prefix.substring(0, prefix.length() - 1), "message must be an object");
        }
        requireFields(node, MESSAGE_FIELDS, prefix);
        var id = requireText(node, "id", prefix);
        var roleName = requireText(node, "role", prefix);
        var role = MessageRole.fromWire(roleName).orElse(null);
        if (role == null) {
            throw new SessionException(
                    SessionError.UNKNOWN_ROLE, "Unknown message role: " + roleName, Map.of("role", roleName));
        }
        var content = requireText(node, "content", prefix);
        var timestamp = parseTimestamp(node.get("timestamp"), prefix + "timestamp");
        var usageNode = node.get("usage");
        var usage = usageNode != null && usageNode.isObject() ? deserializeUsage(usageNode) : null;
        return new Message(id, role, content, timestamp, usage);
    }

    private Todo deserializeTodo(JsonNode node, int index) throws SessionException {
        var prefix = "todos[" + index + "].";
        if (!node.isObject()) {
            throw SessionException.invalidField(prefix.substring(0, prefix.length() - 1), "todo must be an object");
        }
        requireFields(node, TODO_FIELDS, prefix);
        var content = requireText(node, "content", prefix);
        var statusName = requireText(node, "status", prefix);
        var status = TodoStatus.fromWire(statusName).orElse(null);
        if (status == null) {
            throw new SessionException(
                    SessionError.UNKNOWN_STATUS, "Unknown todo status: " + statusName, Map.of("status", statusName));
        }
        var activeForm = node.get("active_form");
        return Todo.of(content, status, activeForm != null && activeForm.isTextual() ? activeForm.asText() : null);
    }

    private LlmConfig deserializeConfig(JsonNode config) throws SessionException {
        try {
            return new LlmConfig(
                    textOr(config, "provider", LlmConfig.DEFAULT_PROVIDER),
                    textOr(config, "model", LlmConfig.DEFAULT_MODEL),
                    Double.parseDouble(textOr(config, "temperature", Double.toString(LlmConfig.DEFAULT_TEMPERATURE))),
                    Integer.parseInt(textOr(config, "max_tokens", Integer.toString(LlmConfig.DEFAULT_MAX_TOKENS))));
        } catch (IllegalArgumentException e) {
            throw SessionException.invalidField("config", "Invalid config: " + e.getMessage());
        }
    }

    private ObjectNode usageNode(TokenUsage usage) {
        var node = nodes.objectNode();
        node.put("input_tokens", usage.inputTokens());
        node.put("output_tokens", usage.outputTokens());
        node.put("total_cost", usage.totalCost());
        return node;
    }

    private static TokenUsage deserializeUsage(JsonNode node) throws SessionException {
        try {
            return new TokenUsage(
                    numberOr(node, "input_tokens", 0).longValue(),
                    numberOr(node, "output_tokens", 0).longValue(),
                    numberOr(node, "total_cost", 0.0).doubleValue());
        } catch (IllegalArgumentException e) {
            throw SessionException.invalidField("usage", e.getMessage());
        }
    }

    private static Number numberOr(JsonNode node, String field, Number defaultValue) {
        var value = node.get(field);
        return value != null && value.isNumber() ? value.numberValue() : defaultValue;
    }

    /** Config values are stored as strings; numbers written by hand are accepted too. */
    private static String textOr(JsonNode node, String field, String defaultValue) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.isValueNode() ? value.asText() : defaultValue;
    }

    private static void requireFields(JsonNode node, List<String> fields, String prefix) throws SessionException {
        var missing = new ArrayList<String>();
        for (var field : fields) {
            var value = node.get(field);
            if (value == null || value.isNull()) {
                missing.add(prefix + field);
            }
        }
        if (!missing.isEmpty()) {
            throw new SessionException(
                    SessionError.MISSING_FIELDS, "Missing fields: " + missing, Map.of("fields", List.copyOf(missing)));
        }
    }

    private static String requireText(JsonNode node, String field) throws SessionException {
        return requireText(node, field, "");
    }

    private static String requireText(JsonNode node, String field, String prefix) throws SessionException {
        var value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw SessionException.invalidField(prefix + field, prefix + field + " must be a string");
        }
        return value.asText();
    }

    private static Instant parseTimestamp(JsonNode node, String field) throws SessionException {
        if (!node.isTextual()) {
            throw new SessionException(
                    SessionError.INVALID_TIMESTAMP, field + " must be an ISO-8601 string", Map.of("field", field));
        }
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            throw new SessionException(
                    SessionError.INVALID_TIMESTAMP,
                    "Invalid timestamp in " + field + ": " + node.asText(),
                    Map.of("field", field),
                    e);
        }
    }
}

package ai.anchor.persistence;

import static org.junit.jupiter.api.Assertions.*;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SessionSerializerTest {

    private final SessionSerializer serializer = new SessionSerializer();

    static SessionState sampleState() {
        var created = Instant.parse("2024-03-01T10:00:00.123Z");
        var session = new Session(
                UUID.randomUUID().toString(),
                "Sample",
                Path.of("/tmp/anchor-sample").toAbsolutePath(),
                new LlmConfig("openai", "gpt-4o", 0.3, 2048),
                created,
                created.plusSeconds(90));
        var messages = List.of(
                new Message("m1", MessageRole.USER, "Fix the build", created.plusSeconds(1)),
                new Message("m2", MessageRole.ASSISTANT, "Done. ✓ \"quoted\"\nnewline", created.plusSeconds(2),
                        new TokenUsage(120, 40, 0.0031)),
                new Message("m3", MessageRole.SYSTEM, "note", created.plusSeconds(3)),
                new Message("m4", MessageRole.TOOL, "{\"ok\":true}", created.plusSeconds(4)));
        var todos = List.of(
                Todo.of("Write tests", TodoStatus.COMPLETED, "Writing tests"),
                Todo.of("Ship it", TodoStatus.IN_PROGRESS, null),
                Todo.of("Celebrate", TodoStatus.PENDING, "Celebrating"));
        return new SessionState(session, messages, todos, null, false);
    }

    @Test
    void testRoundTrip() throws SessionException {
        var state = sampleState();
        var closedAt = Instant.parse("2024-03-01T11:00:00Z");

        var restored = serializer.deserialize(serializer.serialize(state, closedAt));

        assertEquals(SessionSerializer.SCHEMA_VERSION, restored.version());
        assertEquals(state.session().id(), restored.session().id());
        assertEquals(state.session().name(), restored.session().name());
        assertEquals(state.session().projectPath(), restored.session().projectPath());
        assertEquals(state.session().config(), restored.session().config());
        assertEquals(
                state.session().createdAt().truncatedTo(ChronoUnit.SECONDS),
                restored.session().createdAt().truncatedTo(ChronoUnit.SECONDS));
        assertEquals(closedAt, restored.closedAt());

        assertEquals(state.messages().size(), restored.messages().size());
        for (int i = 0; i < state.messages().size(); i++) {
            var original = state.messages().get(i);
            var copy = restored.messages().get(i);
            assertEquals(original.id(), copy.id());
            assertEquals(original.role(), copy.role());
            assertEquals(original.content(), copy.content());
            assertEquals(
                    original.timestamp().truncatedTo(ChronoUnit.SECONDS), copy.timestamp().truncatedTo(ChronoUnit.SECONDS));
            assertEquals(original.usage(), copy.usage());
        }
        assertEquals(state.todos(), restored.todos());
        assertEquals(new TokenUsage(120, 40, 0.0031), restored.cumulativeUsage());
    }

    @Test
    void testRecordLayout() {
        var record = serializer.serialize(sampleState(), Instant.parse("2024-03-01T11:00:00Z"));

        for (var field : SessionSerializer.REQUIRED_FIELDS) {
            assertTrue(record.has(field), field);
        }
        assertEquals("0.3", record.get("config").get("temperature").asText());
        assertTrue(record.get("config").get("max_tokens").isTextual());
        assertEquals("in_progress", record.get("todos").get(1).get("status").asText());
        assertEquals("Ship it", record.get("todos").get(1).get("active_form").asText());
        assertEquals("tool", record.get("conversation").get(3).get("role").asText());
        assertFalse(record.get("conversation").get(0).has("usage"));
        assertEquals(120, record.get("cumulative_usage").get("input_tokens").asInt());
    }

    @Test
    void testNoCumulativeUsageWithoutUsageData() {
        var state = sampleState();
        var plain = new SessionState(state.session(), List.of(Message.of(MessageRole.USER, "hi")), List.of(), null, false);
        assertFalse(serializer.serialize(plain, Instant.now()).has("cumulative_usage"));
    }

    @Test
    void testCanonicalEncodingIsStable() throws Exception {
        var record = serializer.serialize(sampleState(), Instant.now());
        var first = CanonicalJson.encode(record);
        var reparsed = CanonicalJson.MAPPER.readTree(first);

        assertArrayEquals(first, CanonicalJson.encode(reparsed));
        var text = new String(first, StandardCharsets.UTF_8);
        assertTrue(text.indexOf("\"closed_at\"") < text.indexOf("\"config\""));
        assertTrue(text.indexOf("\"config\"") < text.indexOf("\"conversation\""));
    }

    @Test
    void testMissingFields() {
        var record = serializer.serialize(sampleState(), Instant.now());
        record.remove("name");
        record.remove("todos");

        var e = assertThrows(SessionException.class, () -> serializer.deserialize(record));
        assertEquals(SessionError.MISSING_FIELDS, e.error());
        assertEquals(List.of("name", "todos"), e.details().get("fields"));
    }

    @Test
    void testNotAnObject() {
        var e = assertThrows(
                SessionException.class, () -> serializer.deserialize(CanonicalJson.MAPPER.createArrayNode()));
        assertEquals(SessionError.NOT_AN_OBJECT, e.error());
    }

    @Test
    void testVersionChecks() {
        var future = serializer.serialize(sampleState(), Instant.now());
        future.put("version", SessionSerializer.SCHEMA_VERSION + 1);
        var e = assertThrows(SessionException.class, () -> serializer.deserialize(future));
        assertEquals(SessionError.UNSUPPORTED_VERSION, e.error());

        var zero = serializer.serialize(sampleState(), Instant.now());
        zero.put("version", 0);
        e = assertThrows(SessionException.class, () -> serializer.deserialize(zero));
        assertEquals(SessionError.INVALID_VERSION, e.error());

        var text = serializer.serialize(sampleState(), Instant.now());
        text.put("version", "1");
        e = assertThrows(SessionException.class, () -> serializer.deserialize(text));
        assertEquals(SessionError.INVALID_VERSION, e.error());
    }

    @Test
    void testVeryLargeVersionIsUnsupported() {
        var large = serializer.serialize(sampleState(), Instant.now());
        large.put("version", 99_999_999_999L);
        var e = assertThrows(SessionException.class, () -> serializer.deserialize(large));
        assertEquals(SessionError.UNSUPPORTED_VERSION, e.error());

        var huge = serializer.serialize(sampleState(), Instant.now());
        huge.put("version", new BigInteger("123456789012345678901234567890"));
        e = assertThrows(SessionException.class, () -> serializer.deserialize(huge));
        assertEquals(SessionError.UNSUPPORTED_VERSION, e.error());

        var negative = serializer.serialize(sampleState(), Instant.now());
        negative.put("version", -99_999_999_999L);
        e = assertThrows(SessionException.class, () -> serializer.deserialize(negative));
        assertEquals(SessionError.INVALID_VERSION, e.error());
    }

    @Test
    void testFieldTypeErrors() {
        var record = serializer.serialize(sampleState(), Instant.now());
        record.put("config", "not-a-map");
        var e = assertThrows(SessionException.class, () -> serializer.deserialize(record));
        assertEquals(SessionError.INVALID_FIELD, e.error());
        assertEquals("config", e.details().get("field"));

        var relative = serializer.serialize(sampleState(), Instant.now());
        relative.put("project_path", "relative/path");
        e = assertThrows(SessionException.class, () -> serializer.deserialize(relative));
        assertEquals(SessionError.INVALID_FIELD, e.error());
        assertEquals("project_path", e.details().get("field"));

        var numericName = serializer.serialize(sampleState(), Instant.now());
        numericName.put("name", 42);
        e = assertThrows(SessionException.class, () -> serializer.deserialize(numericName));
        assertEquals("name", e.details().get("field"));
    }

    @Test
    void testUnknownRoleAndStatus() {
        var badRole = serializer.serialize(sampleState(), Instant.now());
        ((ObjectNode) badRole.get("conversation").get(0)).put("role", "wizard");
        var e = assertThrows(SessionException.class, () -> serializer.deserialize(badRole));
        assertEquals(SessionError.UNKNOWN_ROLE, e.error());

        var badStatus = serializer.serialize(sampleState(), Instant.now());
        ((ObjectNode) badStatus.get("todos").get(0)).put("status", "someday");
        e = assertThrows(SessionException.class, () -> serializer.deserialize(badStatus));
        assertEquals(SessionError.UNKNOWN_STATUS, e.error());
    }

    @Test
    void testInvalidTimestamp() {
        var record = serializer.serialize(sampleState(), Instant.now());
        ((ObjectNode) record.get("conversation").get(1)).put("timestamp", "yesterday");
        var e = assertThrows(SessionException.class, () -> serializer.deserialize(record));
        assertEquals(SessionError.INVALID_TIMESTAMP, e.error());

        var created = serializer.serialize(sampleState(), Instant.now());
        created.put("created_at", "2024-13-45");
        e = assertThrows(SessionException.class, () -> serializer.deserialize(created));
        assertEquals(SessionError.INVALID_TIMESTAMP, e.error());
    }

    @Test
    void testUnreadableClosedAtIsTolerated() throws SessionException {
        var record = serializer.serialize(sampleState(), Instant.now());
        record.put("closed_at", "not-a-date");

        var restored = serializer.deserialize(record);
        assertNull(restored.closedAt());
    }

    @Test
    void testDefaultsForSparseConfigAndTodos() throws SessionException {
        var record = serializer.serialize(sampleState(), Instant.now());
        record.putObject("config").put("temperature", 1.2);
        ((ObjectNode) record.get("todos").get(0)).remove("active_form");

        var restored = serializer.deserialize(record);
        assertEquals(LlmConfig.DEFAULT_PROVIDER, restored.session().config().provider());
        assertEquals(LlmConfig.DEFAULT_MODEL, restored.session().config().model());
        assertEquals(1.2, restored.session().config().temperature());
        assertEquals(LlmConfig.DEFAULT_MAX_TOKENS, restored.session().config().maxTokens());
        assertEquals("Write tests", restored.todos().get(0).activeForm());
    }

    @Test
    void testOffsetTimestampsAccepted() throws SessionException {
        var record = serializer.serialize(sampleState(), Instant.now());
        record.put("created_at", "2024-03-01T12:00:00+02:00");

        var restored = serializer.deserialize(record);
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), restored.session().createdAt());
    }
}

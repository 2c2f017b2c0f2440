package ai.anchor.persistence;

import static org.junit.jupiter.api.Assertions.*;

import ai.anchor.AnchorConfig;
import ai.anchor.SessionError;
import ai.anchor.SessionException;
import ai.anchor.SessionRuntime;
import ai.anchor.sessions.LlmConfig;
import ai.anchor.sessions.Message;
import ai.anchor.sessions.MessageRole;
import ai.anchor.sessions.Session;
import ai.anchor.sessions.Todo;
import ai.anchor.sessions.TodoStatus;
import ai.anchor.supervisor.Role;
import ai.anchor.supervisor.SessionState;
import ai.anchor.supervisor.SessionStateHolder;
import ai.anchor.util.AtomicWrites;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionPersistenceTest {

    @TempDir
    Path tempDir;

    private SessionRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    private SessionPersistence persistence(AnchorConfig config) {
        if (runtime != null) {
            runtime.close();
        }
        runtime = new SessionRuntime(config);
        return runtime.persistence();
    }

    private SessionPersistence persistence() {
        return persistence(AnchorConfig.defaults(tempDir.resolve("anchor")));
    }

    private Path project(String name) throws Exception {
        return Files.createDirectories(tempDir.resolve("projects").resolve(name));
    }

    private ObjectNode record(String id, Instant closedAt) {
        var now = Instant.now();
        var session = new Session(
                id, "Closed " + id.substring(0, 8), tempDir.resolve("projects/" + id), LlmConfig.defaults(), now, now);
        var state = new SessionState(
                session,
                List.of(Message.of(MessageRole.USER, "hello")),
                List.of(Todo.of("Review", TodoStatus.PENDING, null)),
                null,
                false);
        return new SessionSerializer().serialize(state, closedAt);
    }

    private String writeClosed(SessionPersistence persistence, Instant closedAt) throws SessionException {
        var id = UUID.randomUUID().toString();
        persistence.writeSessionFile(id, record(id, closedAt));
        return id;
    }

    private List<Path> tempFiles(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(AtomicWrites.TEMP_SUFFIX)).toList();
        }
    }

    @Test
    void testSaveAndLoad() throws Exception {
        var persistence = persistence();
        var supervisor = runtime.supervisor();
        var session = supervisor.createSession(project("alpha"), "Alpha", null);
        supervisor.stateClient().appendMessage(session.id(), Message.of(MessageRole.USER, "first"));
        supervisor.stateClient().appendMessage(session.id(), Message.of(MessageRole.ASSISTANT, "second"));
        supervisor.stateClient().updateTodos(session.id(), List.of(Todo.of("Plan", TodoStatus.IN_PROGRESS, null)));

        var file = persistence.save(session.id());

        assertEquals(persistence.sessionFile(session.id()), file);
        assertTrue(Files.isRegularFile(file));
        assertTrue(tempFiles(persistence.sessionsDir()).isEmpty());
        assertTrue(Files.readString(file).contains("\"signature\""));

        var loaded = persistence.load(session.id());
        assertEquals(session.id(), loaded.id());
        assertEquals("Alpha", loaded.session().name());
        assertEquals(session.projectPath(), loaded.session().projectPath());
        assertEquals(List.of("first", "second"), loaded.messages().stream().map(Message::content).toList());
        assertEquals(List.of(Todo.of("Plan", TodoStatus.IN_PROGRESS, null)), loaded.todos());
        assertNotNull(loaded.closedAt());
    }

    @Test
    void testSaveOverwritesPreviousFile() throws Exception {
        var persistence = persistence();
        var supervisor = runtime.supervisor();
        var session = supervisor.createSession(project("beta"), null, null);
        persistence.save(session.id());

        supervisor.stateClient().appendMessage(session.id(), Message.of(MessageRole.USER, "later"));
        persistence.save(session.id());

        assertEquals(1, persistence.load(session.id()).messages().size());
        assertEquals(1, persistence.listPersisted().size());
        assertTrue(tempFiles(persistence.sessionsDir()).isEmpty());
    }

    @Test
    void testConcurrentSaveOfSameSessionRejected() throws Exception {
        var persistence = persistence();
        var supervisor = runtime.supervisor();
        var session = supervisor.createSession(project("gamma"), null, null);
        var holder = supervisor.processes().lookup(Role.STATE, session.id(), SessionStateHolder.class).orElseThrow();

        var release = new CountDownLatch(1);
        holder.send(() -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        });

        var executor = Executors.newFixedThreadPool(2);
        try {
            Future<Path> first = executor.submit(() -> persistence.save(session.id()));
            Future<Path> second = executor.submit(() -> persistence.save(session.id()));

            // one save holds the lock while waiting on the blocked state holder; the other is turned away
            var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!first.isDone() && !second.isDone() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            release.countDown();

            int saved = 0;
            int rejected = 0;
            for (var future : List.of(first, second)) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    saved++;
                } catch (ExecutionException e) {
                    var cause = assertInstanceOf(SessionException.class, e.getCause());
                    assertEquals(SessionError.SAVE_IN_PROGRESS, cause.error());
                    assertTrue(cause.isRetryable());
                    rejected++;
                }
            }
            assertEquals(1, saved);
            assertEquals(1, rejected);
        } finally {
            executor.shutdownNow();
        }

        // the lock is released afterwards
        persistence.save(session.id());
    }

    @Test
    void testSaveLockSurvivesEarlierSaves() throws Exception {
        var persistence = persistence();
        var supervisor = runtime.supervisor();
        var session = supervisor.createSession(project("delta"), null, null);
        var holder = supervisor.processes().lookup(Role.STATE, session.id(), SessionStateHolder.class).orElseThrow();

        // a lock handle taken before any save must still be the one guarding later saves
        var earlyHandle = persistence.saveLock(session.id());
        persistence.save(session.id());
        assertSame(earlyHandle, persistence.saveLock(session.id()));

        var release = new CountDownLatch(1);
        holder.send(() -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        });

        var executor = Executors.newSingleThreadExecutor();
        try {
            Future<Path> inFlight = executor.submit(() -> persistence.save(session.id()));
            var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!earlyHandle.isLocked() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertTrue(earlyHandle.isLocked());

            var e = assertThrows(SessionException.class, () -> persistence.save(session.id()));
            assertEquals(SessionError.SAVE_IN_PROGRESS, e.error());

            release.countDown();
            assertEquals(persistence.sessionFile(session.id()), inFlight.get(10, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertFalse(earlyHandle.isLocked());
    }

    @Test
    void testLoadMissingSession() throws Exception {
        var persistence = persistence();

        var e = assertThrows(SessionException.class, () -> persistence.load(UUID.randomUUID().toString()));

        assertEquals(SessionError.NOT_FOUND, e.error());
    }

    @Test
    void testInvalidSessionIdRejected() {
        var persistence = persistence();

        for (var bad : List.of("../../etc/passwd", "abc", "", "not-a-uuid-at-all-0000-000000000000")) {
            var e = assertThrows(SessionException.class, () -> persistence.load(bad), bad);
            assertEquals(SessionError.INVALID_SESSION_ID, e.error());
            e = assertThrows(SessionException.class, () -> persistence.deletePersisted(bad), bad);
            assertEquals(SessionError.INVALID_SESSION_ID, e.error());
        }
    }

    @Test
    void testLoadRejectsCorruptFiles() throws Exception {
        var persistence = persistence();
        Files.createDirectories(persistence.sessionsDir());

        var garbage = UUID.randomUUID().toString();
        Files.writeString(persistence.sessionFile(garbage), "{not json");
        assertEquals(
                SessionError.INVALID_JSON,
                assertThrows(SessionException.class, () -> persistence.load(garbage)).error());

        var array = UUID.randomUUID().toString();
        Files.writeString(persistence.sessionFile(array), "[1, 2, 3]");
        assertEquals(
                SessionError.NOT_AN_OBJECT,
                assertThrows(SessionException.class, () -> persistence.load(array)).error());
    }

    @Test
    void testOversizedFileRejected() throws Exception {
        var persistence = persistence(AnchorConfig.defaults(tempDir.resolve("anchor")).withMaxFileBytes(256));
        var id = UUID.randomUUID().toString();
        Files.createDirectories(persistence.sessionsDir());
        Files.writeString(persistence.sessionFile(id), "{\"padding\":\"" + "x".repeat(1024) + "\"}");

        var e = assertThrows(SessionException.class, () -> persistence.load(id));

        assertEquals(SessionError.FILE_TOO_LARGE, e.error());
    }

    @Test
    void testUnsupportedVersionRejected() throws Exception {
        var persistence = persistence();
        var id = UUID.randomUUID().toString();
        var record = record(id, Instant.now());
        record.put("version", 99);
        persistence.writeSessionFile(id, record);

        var e = assertThrows(SessionException.class, () -> persistence.load(id));

        assertEquals(SessionError.UNSUPPORTED_VERSION, e.error());
    }

    @Test
    void testTamperedFileRejected() throws Exception {
        var persistence = persistence();
        var id = writeClosed(persistence, Instant.now());
        var file = persistence.sessionFile(id);
        Files.writeString(file, Files.readString(file).replace("hello", "HELLO"));

        var e = assertThrows(SessionException.class, () -> persistence.load(id));

        assertEquals(SessionError.SIGNATURE_VERIFICATION_FAILED, e.error());
    }

    @Test
    void testWriteSessionFileRequiresMatchingId() {
        var persistence = persistence();
        var record = record(UUID.randomUUID().toString(), Instant.now());

        var e = assertThrows(
                SessionException.class, () -> persistence.writeSessionFile(UUID.randomUUID().toString(), record));

        assertEquals(SessionError.INVALID_FIELD, e.error());
    }

    @Test
    void testUnsignedLegacyFileAcceptedAndSignedOnNextSave() throws Exception {
        var persistence = persistence();
        var id = UUID.randomUUID().toString();
        project(id);
        Files.createDirectories(persistence.sessionsDir());
        Files.write(persistence.sessionFile(id), CanonicalJson.encode(record(id, Instant.now())));

        var loaded = persistence.load(id);
        assertEquals(1, loaded.messages().size());

        persistence.resume(id);
        persistence.save(id);
        assertTrue(Files.readString(persistence.sessionFile(id)).contains("\"signature\""));
        assertEquals(1, persistence.load(id).messages().size());
    }

    @Test
    void testUnsignedFileRejectedWhenConfigured() throws Exception {
        var persistence =
                persistence(AnchorConfig.defaults(tempDir.resolve("anchor")).withAcceptUnsigned(false));
        var id = UUID.randomUUID().toString();
        Files.createDirectories(persistence.sessionsDir());
        Files.write(persistence.sessionFile(id), CanonicalJson.encode(record(id, Instant.now())));

        var e = assertThrows(SessionException.class, () -> persistence.load(id));

        assertEquals(SessionError.SIGNATURE_VERIFICATION_FAILED, e.error());
    }

    @Test
    void testListPersistedSkipsBadFilesAndSortsNewestFirst() throws Exception {
        var persistence = persistence();
        var now = Instant.now();
        var oldest = writeClosed(persistence, now.minus(Duration.ofDays(3)));
        var newest = writeClosed(persistence, now.minus(Duration.ofHours(1)));
        var middle = writeClosed(persistence, now.minus(Duration.ofDays(1)));

        var dir = persistence.sessionsDir();
        Files.writeString(dir.resolve(UUID.randomUUID() + ".json"), "{broken");
        Files.writeString(dir.resolve("notes.json"), "{}");
        Files.writeString(dir.resolve(UUID.randomUUID() + ".json"), "{\"id\": 12}");
        var mismatched = UUID.randomUUID().toString();
        Files.write(dir.resolve(mismatched + ".json"), CanonicalJson.encode(record(UUID.randomUUID().toString(), now)));

        var listed = persistence.listPersisted();

        assertEquals(List.of(newest, middle, oldest), listed.stream().map(PersistedSessionInfo::id).toList());
        assertTrue(listed.get(0).name().startsWith("Closed "));
    }

    @Test
    void testListPersistedWithoutDirectory() {
        var persistence = persistence();

        assertFalse(Files.exists(persistence.sessionsDir()));
        assertTrue(persistence.listPersisted().isEmpty());
    }

    @Test
    void testListResumableExcludesLiveSessions() throws Exception {
        var persistence = persistence();
        var supervisor = runtime.supervisor();

        var live = supervisor.createSession(project("live"), null, null);
        persistence.save(live.id());
        var closed = writeClosed(persistence, Instant.now());

        // a persisted record whose project is open under another session
        var samePathId = UUID.randomUUID().toString();
        var samePath = record(samePathId, Instant.now());
        samePath.put("project_path", live.projectPath().toString());
        persistence.writeSessionFile(samePathId, samePath);

        var resumable = persistence.listResumable().stream().map(PersistedSessionInfo::id).toList();

        assertEquals(List.of(closed), resumable);
        assertEquals(3, persistence.listPersisted().size());
    }

    @Test
    void testCleanupDeletesOldSessions() throws Exception {
        var persistence = persistence();
        var now = Instant.now();
        var old = writeClosed(persistence, now.minus(Duration.ofDays(40)));
        var boundary = writeClosed(persistence, now.minus(Duration.ofDays(30)));
        var recent = writeClosed(persistence, now.minus(Duration.ofDays(10)));
        var future = writeClosed(persistence, now.plus(Duration.ofDays(2)));

        var unreadableId = UUID.randomUUID().toString();
        var unreadable = record(unreadableId, now);
        unreadable.put("closed_at", "last tuesday");
        persistence.writeSessionFile(unreadableId, unreadable);

        var result = persistence.cleanup(30);

        assertEquals(2, result.deleted());
        assertEquals(3, result.skipped());
        assertEquals(0, result.failed());
        assertTrue(result.errors().isEmpty());
        assertFalse(Files.exists(persistence.sessionFile(old)));
        assertFalse(Files.exists(persistence.sessionFile(boundary)));
        assertTrue(Files.exists(persistence.sessionFile(recent)));
        assertTrue(Files.exists(persistence.sessionFile(future)));
        assertTrue(Files.exists(persistence.sessionFile(unreadableId)));
    }

    @Test
    void testCleanupUsesConfiguredAge() throws Exception {
        var persistence = persistence();
        writeClosed(persistence, Instant.now().minus(Duration.ofDays(31)));

        assertEquals(1, persistence.cleanup().deleted());
        assertEquals(0, persistence.cleanup().deleted());
    }

    @Test
    void testCleanupRejectsNonPositiveAge() {
        var persistence = persistence();

        assertThrows(IllegalArgumentException.class, () -> persistence.cleanup(0));
        assertThrows(IllegalArgumentException.class, () -> persistence.cleanup(-5));
    }

    @Test
    void testDeletePersistedIsIdempotent() throws Exception {
        var persistence = persistence();
        var id = writeClosed(persistence, Instant.now());

        persistence.deletePersisted(id);
        persistence.deletePersisted(id);

        assertFalse(Files.exists(persistence.sessionFile(id)));
        assertEquals(SessionError.NOT_FOUND, assertThrows(SessionException.class, () -> persistence.load(id)).error());
    }

    @Test
    void testPersistedLimitRejectsNewSessions() throws Exception {
        var persistence =
                persistence(AnchorConfig.defaults(tempDir.resolve("anchor")).withPersistedLimit(2, false));
        var first = writeClosed(persistence, Instant.now().minus(Duration.ofDays(2)));
        writeClosed(persistence, Instant.now().minus(Duration.ofDays(1)));

        var e = assertThrows(SessionException.class, () -> writeClosed(persistence, Instant.now()));
        assertEquals(SessionError.PERSISTED_LIMIT_REACHED, e.error());

        // rewriting an existing file is not a new session
        persistence.writeSessionFile(first, record(first, Instant.now()));
        assertEquals(2, persistence.listPersisted().size());
    }

    @Test
    void testPersistedLimitEvictsOldest() throws Exception {
        var persistence =
                persistence(AnchorConfig.defaults(tempDir.resolve("anchor")).withPersistedLimit(2, true));
        var oldest = writeClosed(persistence, Instant.now().minus(Duration.ofDays(2)));
        var older = writeClosed(persistence, Instant.now().minus(Duration.ofDays(1)));

        var newest = writeClosed(persistence, Instant.now());

        var ids = persistence.listPersisted().stream().map(PersistedSessionInfo::id).toList();
        assertEquals(List.of(newest, older), ids);
        assertFalse(Files.exists(persistence.sessionFile(oldest)));
    }

    @Test
    void testSaveAllWritesEveryLiveSession() throws Exception {
        var persistence = persistence();
        var supervisor = runtime.supervisor();
        var a = supervisor.createSession(project("a"), null, null);
        var b = supervisor.createSession(project("b"), null, null);

        assertEquals(2, persistence.saveAll());

        assertTrue(Files.exists(persistence.sessionFile(a.id())));
        assertTrue(Files.exists(persistence.sessionFile(b.id())));
    }
}

package ai.anchor.persistence;

import ai.anchor.AnchorConfig;
import ai.anchor.SessionError;
import ai.anchor.SessionException;
import ai.anchor.ratelimit.RateLimiter;
import ai.anchor.sessions.Session;
import ai.anchor.supervisor.SessionSupervisor;
import ai.anchor.util.AtomicWrites;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/**
 * Durable storage of closed sessions: one signed JSON file per session under the sessions directory.
 *
 * <p>Writes go through a temp file and an atomic rename, and at most one save per session id runs at a time.
 * Loads check size, syntax, signature and schema before anything is trusted.
 */
public final class SessionPersistence {
    private static final Logger logger = LogManager.getLogger(SessionPersistence.class);

    private static final String FILE_SUFFIX = ".json";
    private static final double LIMIT_WARNING_RATIO = 0.8;
    private static final Comparator<PersistedSessionInfo> NEWEST_FIRST = Comparator.comparing(
            PersistedSessionInfo::closedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final AnchorConfig config;
    private final Path sessionsDir;
    private final SessionSigner signer;
    private final SessionSerializer serializer = new SessionSerializer();
    private final SessionSupervisor supervisor;
    private final RateLimiter rateLimiter;
    private final ObjectWriter prettyWriter = CanonicalJson.MAPPER.writerWithDefaultPrettyPrinter();
    private final ConcurrentMap<String, ReentrantLock> saveLocks = new ConcurrentHashMap<>();

    public SessionPersistence(
            AnchorConfig config, SessionSigner signer, SessionSupervisor supervisor, RateLimiter rateLimiter) {
        this.config = Objects.requireNonNull(config);
        this.sessionsDir = config.paths().getSessionsDir();
        this.signer = Objects.requireNonNull(signer);
        this.supervisor = Objects.requireNonNull(supervisor);
        this.rateLimiter = Objects.requireNonNull(rateLimiter);
    }

    public Path sessionsDir() {
        return sessionsDir;
    }

    /**
     * File path for a session id. The id is checked before it touches the file system.
     */
    public Path sessionFile(String sessionId) throws SessionException {
        return sessionsDir.resolve(SessionIds.requireValid(sessionId) + FILE_SUFFIX);
    }

    // ---------------------------------------------------------------------
    // Save
    // ---------------------------------------------------------------------

    /**
     * Snapshot a live session and write it to disk.
     *
     * @return the written file
     * @throws SessionException {@code SAVE_IN_PROGRESS} if another save of the same session is running
     */
    @Blocking
    public Path save(String sessionId) throws SessionException {
        var file = sessionFile(sessionId);
        var lock = acquireSaveLock(sessionId);
        try {
            var state = supervisor.stateClient().getState(sessionId);
            var record = serializer.serialize(state, Instant.now());
            writeSigned(file, record);
            logger.info("Saved session {} ({} messages, {} todos)", sessionId, state.messages().size(),
                    state.todos().size());
            return file;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sign and write an already built record, as done by {@link #save}. The record's {@code id} must match.
     */
    @Blocking
    public Path writeSessionFile(String sessionId, ObjectNode record) throws SessionException {
        var file = sessionFile(sessionId);
        var recordId = record.path("id").asText(null);
        if (!sessionId.equals(recordId)) {
            throw SessionException.invalidField("id", "Record id " + recordId + " does not match " + sessionId);
        }
        var lock = acquireSaveLock(sessionId);
        try {
            writeSigned(file, record);
            return file;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Save every live session, skipping ones already being saved. Failures are logged.
     *
     * @return number of sessions written
     */
    public int saveAll() {
        int saved = 0;
        for (var id : supervisor.registry().listIds()) {
            try {
                save(id);
                saved++;
            } catch (SessionException e) {
                if (e.error() == SessionError.SAVE_IN_PROGRESS) {
                    logger.debug("Skipping save of session {}: save already in progress", id);
                } else {
                    logger.warn("Periodic save of session {} failed: {}", id, e.getMessage());
                }
            }
        }
        return saved;
    }

    /** The save lock of a session id. Entries live as long as this object so every saver sees the same lock. */
    ReentrantLock saveLock(String sessionId) {
        return saveLocks.computeIfAbsent(sessionId, k -> new ReentrantLock());
    }

    private ReentrantLock acquireSaveLock(String sessionId) throws SessionException {
        var lock = saveLock(sessionId);
        if (!lock.tryLock()) {
            throw new SessionException(
                    SessionError.SAVE_IN_PROGRESS, "Save already in progress for session " + sessionId,
                    Map.of("id", sessionId));
        }
        return lock;
    }

    private void writeSigned(Path file, ObjectNode record) throws SessionException {
        try {
            if (!Files.exists(file)) {
                enforcePersistedLimit();
            }
            var signed = CanonicalJson.sorted(signer.sign(record));
            AtomicWrites.atomicOverwrite(file, prettyWriter.writeValueAsBytes(signed));
            AtomicWrites.applyOwnerOnlyPermissions(file);
        } catch (JsonProcessingException e) {
            throw new SessionException(SessionError.IO_ERROR, "Failed to encode session record", e);
        } catch (IOException e) {
            throw new SessionException(SessionError.IO_ERROR, "Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    private void enforcePersistedLimit() throws SessionException, IOException {
        int max = config.maxPersistedSessions();
        int current = countSessionFiles();
        if (current >= max) {
            if (!config.autoCleanupOnLimit()) {
                throw new SessionException(
                        SessionError.PERSISTED_LIMIT_REACHED,
                        "Persisted session limit reached (" + current + "/" + max + ")",
                        Map.of("current", current, "max", max));
            }
            var all = listPersisted();
            int excess = current - max + 1;
            for (int i = 0; i < excess && i < all.size(); i++) {
                var oldest = all.get(all.size() - 1 - i);
                logger.info("Persisted session limit reached; removing oldest session {}", oldest.id());
                Files.deleteIfExists(sessionFile(oldest.id()));
            }
        } else if (current + 1 >= max * LIMIT_WARNING_RATIO) {
            logger.warn("Persisted sessions at {}/{}; consider running cleanup", current + 1, max);
        }
    }

    private int countSessionFiles() throws IOException {
        if (!Files.isDirectory(sessionsDir)) {
            return 0;
        }
        int count = 0;
        try (var stream = Files.newDirectoryStream(sessionsDir, "*" + FILE_SUFFIX)) {
            for (var ignored : stream) {
                count++;
            }
        }
        return count;
    }

    // ---------------------------------------------------------------------
    // Load
    // ---------------------------------------------------------------------

    /**
     * Read, verify and validate a persisted session.
     *
     * @throws SessionException {@code NOT_FOUND}, an integrity error, or {@code IO_ERROR}
     */
    @Blocking
    public PersistedSession load(String sessionId) throws SessionException {
        var file = sessionFile(sessionId);
        if (!Files.exists(file)) {
            throw SessionException.notFound(sessionId);
        }
        var record = readRecord(file);
        if (signer.verify(record) == SessionSigner.Verification.UNSIGNED) {
            if (!config.acceptUnsigned()) {
                throw new SessionException(
                        SessionError.SIGNATURE_VERIFICATION_FAILED, "Session " + sessionId + " is not signed");
            }
            logger.warn("Loading unsigned session {}; it will be signed on the next save", sessionId);
        }
        var persisted = serializer.deserialize(record);
        if (!persisted.id().equals(sessionId)) {
            throw SessionException.invalidField("id", "File " + file.getFileName() + " holds session " + persisted.id());
        }
        return persisted;
    }

    private ObjectNode readRecord(Path file) throws SessionException {
        long maxBytes = config.maxFileBytes();
        byte[] bytes;
        try {
            long size = Files.size(file);
            if (size > maxBytes) {
                throw tooLarge(file, size, maxBytes);
            }
            try (InputStream in = Files.newInputStream(file)) {
                bytes = in.readNBytes((int) Math.min(maxBytes + 1, Integer.MAX_VALUE));
            }
        } catch (IOException e) {
            throw new SessionException(SessionError.IO_ERROR, "Failed to read " + file + ": " + e.getMessage(), e);
        }
        if (bytes.length > maxBytes) {
            throw tooLarge(file, bytes.length, maxBytes);
        }

        JsonNode node;
        try {
            node = CanonicalJson.MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new SessionException(SessionError.INVALID_JSON, "Invalid JSON in " + file.getFileName(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new SessionException(SessionError.INVALID_JSON, "Empty session file " + file.getFileName());
        }
        if (!node.isObject()) {
            throw new SessionException(SessionError.NOT_AN_OBJECT, "Session file " + file.getFileName() + " is not an object");
        }
        return (ObjectNode) node;
    }

    private static SessionException tooLarge(Path file, long size, long maxBytes) {
        return new SessionException(
                SessionError.FILE_TOO_LARGE,
                "Session file " + file.getFileName() + " is " + size + " bytes (max " + maxBytes + ")",
                Map.of("size", size, "max", maxBytes));
    }

    // ---------------------------------------------------------------------
    // Listing, cleanup, delete
    // ---------------------------------------------------------------------

    /**
     * All readable persisted sessions, most recently closed first. Files that cannot be read are skipped.
     */
    public List<PersistedSessionInfo> listPersisted() {
        if (!Files.isDirectory(sessionsDir)) {
            return List.of();
        }
        var infos = new ArrayList<PersistedSessionInfo>();
        try (var stream = Files.newDirectoryStream(sessionsDir, "*" + FILE_SUFFIX)) {
            for (var file : stream) {
                readInfo(file).ifPresent(infos::add);
            }
        } catch (IOException e) {
            logger.error("Failed to list sessions in {}: {}", sessionsDir, e.getMessage());
        }
        infos.sort(NEWEST_FIRST);
        return infos;
    }

    /**
     * Persisted sessions that could be resumed now: neither their id nor their project path is live.
     */
    public List<PersistedSessionInfo> listResumable() {
        var live = supervisor.registry().listAll();
        var liveIds = new HashSet<String>();
        var livePaths = new HashSet<String>();
        for (var session : live) {
            liveIds.add(session.id());
            livePaths.add(session.pathKey());
        }
        return listPersisted().stream()
                .filter(info -> !liveIds.contains(info.id()) && !livePaths.contains(info.projectPath()))
                .toList();
    }

    private Optional<PersistedSessionInfo> readInfo(Path file) {
        var fileName = file.getFileName().toString();
        var id = fileName.substring(0, fileName.length() - FILE_SUFFIX.length());
        if (!SessionIds.isValid(id)) {
            logger.warn("Skipping session file with invalid name: {}", fileName);
            return Optional.empty();
        }
        try {
            var node = readRecord(file);
            var name = node.get("name");
            var projectPath = node.get("project_path");
            var recordId = node.get("id");
            if (recordId == null || !recordId.isTextual() || name == null || !name.isTextual()
                    || projectPath == null || !projectPath.isTextual()) {
                logger.warn("Skipping session file {}: missing id, name or project_path", fileName);
                return Optional.empty();
            }
            if (!id.equals(recordId.asText())) {
                logger.warn("Skipping session file {}: it holds session {}", fileName, recordId.asText());
                return Optional.empty();
            }
            return Optional.of(new PersistedSessionInfo(
                    id, name.asText(), projectPath.asText(), SessionSerializer.parseOptionalTimestamp(node.get("closed_at"))));
        } catch (SessionException e) {
            logger.warn("Skipping unreadable session file {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }

    public CleanupResult cleanup() {
        return cleanup(config.cleanupMaxAgeDays());
    }

    /**
     * Delete persisted sessions closed at least {@code maxAgeDays} ago. Sessions with unreadable timestamps are
     * skipped; a failed delete is counted and the rest continue.
     */
    public CleanupResult cleanup(int maxAgeDays) {
        if (maxAgeDays <= 0) {
            throw new IllegalArgumentException("maxAgeDays must be positive: " + maxAgeDays);
        }
        var cutoff = Instant.now().minus(Duration.ofDays(maxAgeDays));
        int deleted = 0;
        int skipped = 0;
        var failures = new ArrayList<CleanupResult.Failure>();

        for (var info : listPersisted()) {
            if (info.closedAt() == null) {
                logger.debug("Cleanup skipping session {}: unreadable closed_at", info.id());
                skipped++;
                continue;
            }
            if (info.closedAt().isAfter(cutoff)) {
                skipped++;
                continue;
            }
            try {
                if (Files.deleteIfExists(sessionFile(info.id()))) {
                    deleted++;
                }
            } catch (IOException | SessionException e) {
                logger.warn("Cleanup failed to delete session {}: {}", info.id(), e.getMessage());
                failures.add(new CleanupResult.Failure(info.id(), e.getMessage()));
            }
        }

        logger.info("Session cleanup: {} deleted, {} skipped, {} failed", deleted, skipped, failures.size());
        return new CleanupResult(deleted, skipped, failures.size(), failures);
    }

    /**
     * Delete a persisted session. Deleting a missing file is not an error.
     */
    public void deletePersisted(String sessionId) throws SessionException {
        var file = sessionFile(sessionId);
        try {
            if (Files.deleteIfExists(file)) {
                logger.info("Deleted persisted session {}", sessionId);
            }
        } catch (IOException e) {
            throw new SessionException(SessionError.IO_ERROR, "Failed to delete " + file + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Resume
    // ---------------------------------------------------------------------

    /**
     * Bring a persisted session back as a live session.
     *
     * <p>The file is deleted only after the live session holds all of its messages and todos. Any failure after
     * the process group started tears that group down again.
     */
    @Blocking
    public Session resume(String sessionId) throws SessionException {
        SessionIds.requireValid(sessionId);
        rateLimiter.checkOrThrow(RateLimiter.RESUME, sessionId);

        var persisted = load(sessionId);
        var session = persisted.session();
        var pathSnapshot = ProjectPathSnapshot.capture(session.projectPath());

        supervisor.startSession(session);
        try {
            pathSnapshot.revalidate();
            var stateClient = supervisor.stateClient();
            for (var message : persisted.messages()) {
                stateClient.appendMessage(sessionId, message);
            }
            stateClient.updateTodos(sessionId, persisted.todos());
        } catch (SessionException | RuntimeException e) {
            logger.warn("Resume of session {} failed after start, rolling back: {}", sessionId, e.getMessage());
            try {
                supervisor.terminateSession(sessionId);
            } catch (SessionException stopError) {
                logger.warn("Rollback of session {} found nothing to stop: {}", sessionId, stopError.getMessage());
            }
            throw e;
        }

        try {
            deletePersisted(sessionId);
        } catch (SessionException e) {
            logger.warn("Resumed session {} but could not delete its file: {}", sessionId, e.getMessage());
        }
        rateLimiter.record(RateLimiter.RESUME, sessionId);
        logger.info("Resumed session {} ({} messages, {} todos)", sessionId, persisted.messages().size(),
                persisted.todos().size());
        return session;
    }
}

package ai.anchor.supervisor;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * A single-threaded member of a session process group.
 *
 * <p>Each worker owns one daemon thread draining an inbound mailbox, so every handler runs on that thread and
 * state touched only from handlers needs no further locking. A handler that fails with a
 * {@link SessionException} reports to its caller and the worker carries on. Any other exception is reported
 * to the caller as well and then terminates the worker abnormally, which makes the owning group restart all
 * of its members.
 */
public abstract class SessionWorker implements SupervisedProcess {
    private static final Logger logger = LogManager.getLogger(SessionWorker.class);

    /** Work executed on the worker thread. */
    @FunctionalInterface
    public interface Handler<T> {
        T handle() throws SessionException;
    }

    private final Role role;
    private final String sessionId;
    private final BlockingQueue<Envelope<?>> mailbox = new LinkedBlockingQueue<>();
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile boolean accepting;
    private volatile @Nullable Thread thread;

    protected SessionWorker(Role role, String sessionId) {
        if (role == Role.GROUP) {
            throw new IllegalArgumentException("workers cannot take the group role");
        }
        this.role = Objects.requireNonNull(role);
        this.sessionId = Objects.requireNonNull(sessionId);
    }

    @Override
    public final Role role() {
        return role;
    }

    @Override
    public final String sessionId() {
        return sessionId;
    }

    @Override
    public boolean isAlive() {
        var t = thread;
        return t != null && t.isAlive() && exited.getCount() > 0;
    }

    /**
     * Runs on the starting thread before the worker is registered. Throwing here fails the group start.
     */
    protected void onStart() throws SessionException {}

    /** Runs on the worker thread after the last message, whatever the exit reason. */
    protected void onExit(@Nullable Throwable failure) {}

    final void start(ProcessRegistry processes, Consumer<WorkerExit> exitSink) throws SessionException {
        if (thread != null) {
            throw new IllegalStateException(role.label() + " worker for session " + sessionId + " already started");
        }
        onStart();
        if (!processes.register(this)) {
            throw new SessionException(
                    SessionError.GROUP_START_FAILED,
                    role.label() + " already running for session " + sessionId,
                    Map.of("id", sessionId, "role", role.label()));
        }
        accepting = true;
        var t = new Thread(() -> runLoop(processes, exitSink), threadName());
        t.setDaemon(true);
        thread = t;
        t.start();
        logger.debug("Started {} worker for session {}", role.label(), sessionId);
    }

    /**
     * Ask the worker to stop after the messages already queued, waiting up to {@code timeout} before
     * interrupting it.
     */
    final void stop(Duration timeout) {
        accepting = false;
        var t = thread;
        if (t == null) {
            return;
        }
        mailbox.offer(Envelope.stop());
        if (t == Thread.currentThread()) {
            return;
        }
        try {
            if (!exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("{} worker for session {} did not stop in {}ms, interrupting", role.label(), sessionId,
                        timeout.toMillis());
                t.interrupt();
                if (!exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.error("{} worker for session {} is still running after interrupt", role.label(), sessionId);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while stopping {} worker for session {}", role.label(), sessionId);
        }
    }

    /**
     * Queue a handler without waiting for it.
     */
    public <T> CompletableFuture<T> send(Handler<T> handler) {
        var envelope = new Envelope<>(handler);
        if (!accepting) {
            envelope.abort(notRunning());
            return envelope.reply;
        }
        mailbox.add(envelope);
        // the worker may have exited between the check and the add
        if (!accepting && mailbox.remove(envelope)) {
            envelope.abort(notRunning());
        }
        return envelope.reply;
    }

    /**
     * Run a handler on the worker thread and wait at most {@code timeout} for its result.
     *
     * @throws SessionException the handler's own failure, {@code TIMEOUT}, or {@code PROCESS_CRASHED}
     */
    public <T> T call(Handler<T> handler, Duration timeout) throws SessionException {
        var future = send(handler);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new SessionException(
                    SessionError.TIMEOUT,
                    role.label() + " worker for session " + sessionId + " did not reply within " + timeout.toMillis() + "ms",
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException(SessionError.TIMEOUT, "Interrupted waiting for " + role.label() + " worker", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof SessionException se) {
                throw se;
            }
            throw new SessionException(
                    SessionError.PROCESS_CRASHED,
                    role.label() + " worker for session " + sessionId + " failed: " + cause,
                    cause);
        }
    }

    private void runLoop(ProcessRegistry processes, Consumer<WorkerExit> exitSink) {
        Throwable failure = null;
        try {
            while (true) {
                var envelope = mailbox.take();
                if (envelope.isStop()) {
                    break;
                }
                envelope.run();
            }
        } catch (InterruptedException e) {
            logger.debug("{} worker for session {} interrupted", role.label(), sessionId);
        } catch (Throwable t) {
            failure = t instanceof HandlerCrash crash ? crash.getCause() : t;
            logger.error("{} worker for session {} crashed", role.label(), sessionId, failure);
        } finally {
            accepting = false;
            processes.unregister(this);
            abortPending(failure);
            try {
                onExit(failure);
            } catch (RuntimeException e) {
                logger.warn("Exit hook of {} worker for session {} failed", role.label(), sessionId, e);
            }
            exited.countDown();
            exitSink.accept(new WorkerExit(this, failure));
        }
    }

    private void abortPending(@Nullable Throwable failure) {
        var pending = new ArrayList<Envelope<?>>();
        mailbox.drainTo(pending);
        if (pending.isEmpty()) {
            return;
        }
        var reason = failure == null
                ? notRunning()
                : new SessionException(
                        SessionError.PROCESS_CRASHED,
                        role.label() + " worker for session " + sessionId + " crashed",
                        failure);
        for (var envelope : pending) {
            envelope.abort(reason);
        }
    }

    private SessionException notRunning() {
        return new SessionException(
                SessionError.NOT_FOUND,
                role.label() + " worker for session " + sessionId + " is not running",
                Map.of("id", sessionId, "role", role.label()));
    }

    private String threadName() {
        var prefix = sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
        return "anchor-" + role.label() + "-" + prefix;
    }

    /** Carries a handler's unchecked failure out of the loop after the caller has been told. */
    private static final class HandlerCrash extends RuntimeException {
        HandlerCrash(Throwable cause) {
            super(cause);
        }
    }

    private static final class Envelope<T> {
        private final @Nullable Handler<T> handler;
        final CompletableFuture<T> reply = new CompletableFuture<>();

        Envelope(@Nullable Handler<T> handler) {
            this.handler = handler;
        }

        static Envelope<Void> stop() {
            return new Envelope<>(null);
        }

        boolean isStop() {
            return handler == null;
        }

        void run() {
            try {
                reply.complete(Objects.requireNonNull(handler).handle());
            } catch (SessionException e) {
                reply.completeExceptionally(e);
            } catch (RuntimeException | Error e) {
                reply.completeExceptionally(e);
                throw new HandlerCrash(e);
            }
        }

        void abort(Throwable reason) {
            reply.completeExceptionally(reason);
        }
    }
}

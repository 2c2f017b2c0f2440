package ai.anchor.supervisor;

import ai.anchor.SessionError;
import ai.anchor.SessionException;
import ai.anchor.sessions.Session;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Supervises the workers of one session: coordinator, state holder and an optional agent.
 *
 * <p>Members share fate. When any of them exits unexpectedly the control loop stops every member and starts a
 * fresh set in the original order. More than {@link RestartPolicy#maxRestarts()} restarts inside the policy
 * window makes the group give up; it then stops for good and reports itself through the failure callback.
 */
public final class SessionGroup implements SupervisedProcess {
    private static final Logger logger = LogManager.getLogger(SessionGroup.class);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    public enum State {
        NEW,
        RUNNING,
        RESTARTING,
        STOPPED,
        FAILED
    }

    private final String sessionId;
    private final ProcessRegistry processes;
    private final RestartPolicy restartPolicy;
    private final @Nullable AgentFactory agentFactory;
    private final Consumer<SessionGroup> onFailure;
    private final BlockingQueue<WorkerExit> exits = new LinkedBlockingQueue<>();
    private final Deque<Long> restartTimes = new ArrayDeque<>();
    private final Object lifecycleLock = new Object();

    private volatile Session session;
    private volatile State state = State.NEW;
    private volatile List<SessionWorker> workers = List.of();
    private volatile int restartCount;
    private @Nullable Thread controlThread;

    public SessionGroup(
            Session session,
            ProcessRegistry processes,
            RestartPolicy restartPolicy,
            @Nullable AgentFactory agentFactory,
            Consumer<SessionGroup> onFailure) {
        this.session = Objects.requireNonNull(session);
        this.sessionId = session.id();
        this.processes = Objects.requireNonNull(processes);
        this.restartPolicy = Objects.requireNonNull(restartPolicy);
        this.agentFactory = agentFactory;
        this.onFailure = Objects.requireNonNull(onFailure);
    }

    @Override
    public Role role() {
        return Role.GROUP;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public boolean isAlive() {
        var s = state;
        return s == State.RUNNING || s == State.RESTARTING;
    }

    public State state() {
        return state;
    }

    public int restartCount() {
        return restartCount;
    }

    /** Session used for the next restart. */
    void updateSession(Session updated) {
        this.session = updated;
    }

    /**
     * Start all members. If any member fails to start, the ones already running are stopped again.
     */
    public void start() throws SessionException {
        synchronized (lifecycleLock) {
            if (state != State.NEW) {
                throw new IllegalStateException("Group for session " + sessionId + " already started");
            }
            if (!processes.register(this)) {
                throw new SessionException(
                        SessionError.GROUP_START_FAILED,
                        "A process group is already running for session " + sessionId,
                        Map.of("id", sessionId));
            }
            try {
                workers = launchMembers();
            } catch (SessionException e) {
                state = State.FAILED;
                processes.unregister(this);
                throw e;
            }
            state = State.RUNNING;
            var t = new Thread(this::controlLoop, "anchor-group-" + shortId());
            t.setDaemon(true);
            controlThread = t;
            t.start();
        }
        logger.info("Started process group for session {} ({} members)", sessionId, workers.size());
    }

    /**
     * Stop all members and the control loop. Safe to call more than once.
     */
    public void stop() {
        Thread loop;
        synchronized (lifecycleLock) {
            if (state == State.STOPPED || state == State.FAILED || state == State.NEW) {
                state = state == State.NEW ? State.STOPPED : state;
                return;
            }
            state = State.STOPPED;
            stopMembers(workers);
            workers = List.of();
            loop = controlThread;
        }
        processes.unregister(this);
        if (loop != null && loop != Thread.currentThread()) {
            loop.interrupt();
            try {
                loop.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for control loop of session {}", sessionId);
            }
        }
        logger.info("Stopped process group for session {}", sessionId);
    }

    List<SessionWorker> members() {
        return workers;
    }

    private void controlLoop() {
        try {
            while (true) {
                var exit = exits.take();
                if (state != State.RUNNING) {
                    if (state == State.STOPPED || state == State.FAILED) {
                        return;
                    }
                    continue;
                }
                if (!workers.contains(exit.worker())) {
                    // exit of a member replaced by an earlier restart
                    continue;
                }
                if (!handleMemberExit(exit)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            logger.debug("Control loop for session {} interrupted", sessionId);
        }
    }

    /**
     * @return false when the group gave up
     */
    private boolean handleMemberExit(WorkerExit exit) {
        var member = exit.worker().role().label();
        if (exit.abnormal()) {
            logger.warn("{} of session {} exited abnormally: {}; restarting group", member, sessionId,
                    String.valueOf(exit.failure()));
        } else {
            logger.warn("{} of session {} exited unexpectedly; restarting group", member, sessionId);
        }

        long now = System.nanoTime();
        long windowNanos = restartPolicy.window().toNanos();
        while (!restartTimes.isEmpty() && now - restartTimes.peekFirst() > windowNanos) {
            restartTimes.removeFirst();
        }
        if (restartTimes.size() >= restartPolicy.maxRestarts()) {
            logger.error("Session {} exceeded {} restarts in {}ms; shutting the group down", sessionId,
                    restartPolicy.maxRestarts(), restartPolicy.window().toMillis());
            fail();
            return false;
        }
        restartTimes.addLast(now);

        synchronized (lifecycleLock) {
            if (state != State.RUNNING) {
                return state != State.STOPPED;
            }
            state = State.RESTARTING;
            stopMembers(workers);
            try {
                workers = launchMembers();
            } catch (SessionException e) {
                logger.error("Restart of session {} failed: {}", sessionId, e.getMessage());
                workers = List.of();
                failLocked();
                return false;
            }
            restartCount++;
            state = State.RUNNING;
        }
        logger.info("Restarted process group for session {} (restart #{})", sessionId, restartCount);
        return true;
    }

    private void fail() {
        synchronized (lifecycleLock) {
            if (state != State.RUNNING && state != State.RESTARTING) {
                return;
            }
            stopMembers(workers);
            workers = List.of();
            failLocked();
        }
    }

    private void failLocked() {
        state = State.FAILED;
        processes.unregister(this);
        try {
            onFailure.accept(this);
        } catch (RuntimeException e) {
            logger.error("Failure callback for session {} threw", sessionId, e);
        }
    }

    private List<SessionWorker> launchMembers() throws SessionException {
        var current = session;
        var launched = new ArrayList<SessionWorker>();
        try {
            launch(new Coordinator(current), launched);
            launch(new SessionStateHolder(current), launched);
            if (agentFactory != null) {
                var agent = agentFactory.create(current);
                if (agent.role() != Role.AGENT) {
                    throw new IllegalStateException("agent factory returned a " + agent.role().label() + " worker");
                }
                launch(agent, launched);
            }
        } catch (SessionException e) {
            stopMembers(launched);
            throw new SessionException(
                    SessionError.GROUP_START_FAILED,
                    "Failed to start process group for session " + sessionId + ": " + e.getMessage(),
                    Map.of("id", sessionId, "reason", e.error().name()),
                    e);
        } catch (RuntimeException e) {
            stopMembers(launched);
            throw new SessionException(
                    SessionError.GROUP_START_FAILED,
                    "Failed to start process group for session " + sessionId + ": " + e,
                    Map.of("id", sessionId),
                    e);
        }
        return List.copyOf(launched);
    }

    private void launch(SessionWorker worker, List<SessionWorker> launched) throws SessionException {
        worker.start(processes, exits::offer);
        launched.add(worker);
    }

    private static void stopMembers(List<SessionWorker> members) {
        for (int i = members.size() - 1; i >= 0; i--) {
            members.get(i).stop(STOP_TIMEOUT);
        }
    }

    private String shortId() {
        return sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
    }
}

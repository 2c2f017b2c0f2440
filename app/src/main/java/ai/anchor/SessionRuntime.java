package ai.anchor;

import ai.anchor.persistence.SessionPersistence;
import ai.anchor.persistence.SessionSigner;
import ai.anchor.persistence.SigningKeys;
import ai.anchor.ratelimit.RateLimiter;
import ai.anchor.sessions.SessionRegistry;
import ai.anchor.supervisor.AgentFactory;
import ai.anchor.supervisor.ProcessRegistry;
import ai.anchor.supervisor.RestartPolicy;
import ai.anchor.supervisor.SessionSupervisor;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Wires the registry, rate limiter, supervisor and persistence together and runs their periodic jobs.
 *
 * <p>Closing the runtime saves and stops every live session, then stops the background jobs.
 */
public final class SessionRuntime implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SessionRuntime.class);
    private static final long RATE_LIMIT_CLEANUP_SECONDS = 60;

    private final AnchorConfig config;
    private final SessionRegistry registry;
    private final RateLimiter rateLimiter;
    private final SessionSupervisor supervisor;
    private final SessionPersistence persistence;
    private final ScheduledExecutorService scheduler;
    private boolean started;
    private boolean closed;

    public SessionRuntime(AnchorConfig config) {
        this(config, null);
    }

    public SessionRuntime(AnchorConfig config, @Nullable AgentFactory agentFactory) {
        this.config = Objects.requireNonNull(config);
        this.registry = new SessionRegistry(config.maxSessions());
        this.rateLimiter = new RateLimiter(
                Map.of(RateLimiter.RESUME, config.resumeLimit()), config.defaultLimit(), Clock.systemUTC());
        this.supervisor = new SessionSupervisor(
                registry,
                new ProcessRegistry(),
                new RestartPolicy(config.maxRestarts(), config.restartWindow()),
                config.callTimeout(),
                agentFactory);
        var signer = new SessionSigner(new SigningKeys(config.paths()));
        this.persistence = new SessionPersistence(config, signer, supervisor, rateLimiter);
        supervisor.setSnapshotter(persistence::save);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anchor-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule rate-limit cleanup and, when configured, periodic auto-save.
     */
    public synchronized SessionRuntime start() {
        if (started || closed) {
            return this;
        }
        started = true;
        scheduler.scheduleAtFixedRate(
                () -> {
                    try {
                        rateLimiter.cleanupExpired();
                    } catch (RuntimeException e) {
                        logger.error("Rate limiter cleanup failed", e);
                    }
                },
                RATE_LIMIT_CLEANUP_SECONDS,
                RATE_LIMIT_CLEANUP_SECONDS,
                TimeUnit.SECONDS);

        long autoSaveMs = config.autoSaveInterval().toMillis();
        if (autoSaveMs > 0) {
            scheduler.scheduleWithFixedDelay(
                    () -> {
                        try {
                            persistence.saveAll();
                        } catch (RuntimeException e) {
                            logger.error("Auto-save failed", e);
                        }
                    },
                    autoSaveMs,
                    autoSaveMs,
                    TimeUnit.MILLISECONDS);
        }
        logger.info("Session runtime started (base dir {}, max sessions {}, auto-save {})", config.paths().getBaseDir(),
                config.maxSessions(), autoSaveMs > 0 ? autoSaveMs + "ms" : "off");
        return this;
    }

    public AnchorConfig config() {
        return config;
    }

    public SessionRegistry registry() {
        return registry;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public SessionSupervisor supervisor() {
        return supervisor;
    }

    public SessionPersistence persistence() {
        return persistence;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        supervisor.stopAll();
        scheduler.shutdownNow();
        logger.info("Session runtime stopped");
    }
}

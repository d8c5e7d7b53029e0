package io.leasekeep.runtime;

import io.leasekeep.bus.Notifier;
import io.leasekeep.bus.SerializedWriteChannel;
import io.leasekeep.config.LeaseKeepConfig;
import io.leasekeep.config.LeaseSettings;
import io.leasekeep.lease.SessionLockManager;
import io.leasekeep.model.SessionId;
import io.leasekeep.observability.AuditLogger;
import io.leasekeep.observability.HealthMonitor;
import io.leasekeep.storage.Database;
import io.leasekeep.storage.RecordStore;
import io.leasekeep.storage.RemoteRecordGateway;
import io.leasekeep.storage.RetryPolicy;
import io.leasekeep.storage.SqliteRecordStore;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the lease stack for one process: audit log, health monitor, write channel, gateway, lock
 * manager and auto-save, all driven by a single tick.
 *
 * <p>{@link #init()} opens the SQLite database; {@link #start()} begins ticking every
 * {@code tickMillis}. {@link #close()} stops new force loads, releases every lease, drains the channel
 * and shuts the executors down.
 */
public final class LeaseRuntime implements AutoCloseable {
    private static final long EXECUTOR_SHUTDOWN_TIMEOUT_MS = 5_000L;

    private final LeaseKeepConfig config;
    private final LeaseSettings settings;
    private final Clock clock;
    private final SessionId sessionId;
    private final List<ExecutorService> ownedExecutors;
    private final AuditLogger auditLogger;
    private final HealthMonitor healthMonitor;
    private final SerializedWriteChannel channel;
    private final RemoteRecordGateway gateway;
    private final SessionLockManager manager;
    private final AutoSaveScheduler autoSave;
    private Database database;
    private ScheduledExecutorService ticker;
    private boolean closed;

    public LeaseRuntime(LeaseKeepConfig config) {
        this(config, LeaseSettings.load(config), Clock.systemUTC(), null, null, RemoteRecordGateway.Sleeper.THREAD);
    }

    public LeaseRuntime(
            LeaseKeepConfig config,
            LeaseSettings settings,
            Clock clock,
            Executor workExecutor,
            Executor dispatchExecutor,
            RemoteRecordGateway.Sleeper sleeper
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.sessionId = new SessionId(processId(), UUID.randomUUID().toString());
        this.ownedExecutors = new ArrayList<>();
        Executor work = workExecutor;
        if (work == null) {
            ExecutorService pool = Executors.newFixedThreadPool(4, daemonThreads("leasekeep-store"));
            ownedExecutors.add(pool);
            work = pool;
        }
        Executor dispatch = dispatchExecutor;
        if (dispatch == null) {
            ExecutorService single = Executors.newSingleThreadExecutor(daemonThreads("leasekeep-notify"));
            ownedExecutors.add(single);
            dispatch = single;
        }
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), clock);
        Notifier.ListenerFailureHandler failureHandler = this::reportListenerFailure;
        this.healthMonitor = new HealthMonitor(
                clock,
                settings.issueCountForCriticalState(),
                settings.issueWindowMs(),
                settings.criticalStateWindowMs(),
                auditLogger,
                dispatch,
                failureHandler
        );
        this.channel = new SerializedWriteChannel(clock, settings.writeCooldownMs(), work);
        this.gateway = new RemoteRecordGateway(
                channel,
                healthMonitor,
                new RetryPolicy(settings.retryMaxAttempts(), settings.retryBaseBackoffMs(), settings.retryMaxBackoffMs()),
                settings.payloadMaxBytes(),
                sleeper
        );
        this.manager = new SessionLockManager(gateway, sessionId, clock, settings, auditLogger, dispatch, failureHandler);
        this.autoSave = new AutoSaveScheduler(manager, clock, settings.autoSaveIntervalMs());
        manager.addLifecycleListener(autoSave);
    }

    public synchronized void init() {
        if (database == null) {
            database = new Database(config);
            database.init();
        }
        openStore(LeaseKeepConfig.DEFAULT_STORE);
    }

    public synchronized RecordStore openStore(String storeName) {
        if (database == null) {
            throw new IllegalStateException("Runtime is not initialized");
        }
        try {
            return gateway.store(storeName);
        } catch (IllegalArgumentException unknown) {
            RecordStore store = new SqliteRecordStore(database, storeName, clock);
            gateway.registerStore(store);
            return store;
        }
    }

    public void registerStore(RecordStore store) {
        gateway.registerStore(store);
    }

    public synchronized void start() {
        if (ticker != null || closed) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(daemonThreads("leasekeep-tick"));
        ticker.scheduleAtFixedRate(this::tick, settings.tickMillis(), settings.tickMillis(), TimeUnit.MILLISECONDS);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.start",
                sessionId.toString(),
                "runtime",
                "started",
                Map.of("tick_ms", settings.tickMillis())
        ));
    }

    public void tick() {
        try {
            channel.tick();
            manager.pollForceLoads();
            autoSave.tick();
            healthMonitor.tick();
        } catch (RuntimeException e) {
            reportListenerFailure("tick", e);
        }
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        CompletableFuture<Void> released = manager.releaseAll();
        long deadlineMs = System.currentTimeMillis() + drainTimeoutMs();
        try {
            awaitDrained(released, deadlineMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            shutdownExecutors();
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "runtime.stop",
                    sessionId.toString(),
                    "runtime",
                    released.isDone() ? "drained" : "timed_out",
                    Map.of()
            ));
        }
    }

    public LeaseKeepConfig config() {
        return config;
    }

    public LeaseSettings settings() {
        return settings;
    }

    public SessionId sessionId() {
        return sessionId;
    }

    public SessionLockManager manager() {
        return manager;
    }

    public RemoteRecordGateway gateway() {
        return gateway;
    }

    public SerializedWriteChannel channel() {
        return channel;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public AutoSaveScheduler autoSave() {
        return autoSave;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private void awaitDrained(CompletableFuture<Void> released, long deadlineMs) throws InterruptedException {
        boolean ticking;
        synchronized (this) {
            ticking = ticker != null;
        }
        while (System.currentTimeMillis() < deadlineMs) {
            if (!ticking) {
                tick();
            }
            try {
                released.get(settings.tickMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                continue;
            } catch (ExecutionException e) {
                reportListenerFailure("release", e.getCause());
            }
            long remainingMs = deadlineMs - System.currentTimeMillis();
            if (remainingMs <= 0L || channel.awaitIdle(Math.min(remainingMs, settings.tickMillis()))) {
                return;
            }
        }
    }

    private long drainTimeoutMs() {
        long retries = (long) settings.retryMaxAttempts() * settings.retryMaxBackoffMs();
        return 2L * settings.writeCooldownMs() + retries + EXECUTOR_SHUTDOWN_TIMEOUT_MS;
    }

    private void shutdownExecutors() {
        ScheduledExecutorService tickerToStop;
        synchronized (this) {
            tickerToStop = ticker;
            ticker = null;
        }
        List<ExecutorService> all = new ArrayList<>();
        if (tickerToStop != null) {
            all.add(tickerToStop);
        }
        all.addAll(ownedExecutors);
        for (ExecutorService executor : all) {
            executor.shutdown();
        }
        for (ExecutorService executor : all) {
            try {
                if (!executor.awaitTermination(EXECUTOR_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void reportListenerFailure(String source, Throwable failure) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "runtime.failure",
                    sessionId.toString(),
                    source,
                    "error",
                    Map.of("error", String.valueOf(failure))
            ));
        } catch (RuntimeException e) {
            System.err.println("leasekeep: " + source + " failed: " + failure + " (audit unavailable: " + e.getMessage() + ")");
        }
    }

    private static String processId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        return host + ":" + ProcessHandle.current().pid();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

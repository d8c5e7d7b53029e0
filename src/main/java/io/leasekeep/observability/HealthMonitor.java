package io.leasekeep.observability;

import io.leasekeep.bus.Notifier;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Counts store failures in a sliding window and raises an advisory critical state when they cluster.
 *
 * <p>Critical state starts when a reported issue brings the window to {@code issueCountForCriticalState}.
 * Every later issue that keeps the window at the threshold restarts the critical period. It ends on a
 * {@link #tick} once the window is below the threshold and {@code criticalStateWindowMs} has passed since
 * the period last restarted. Nothing here blocks store traffic.
 */
public final class HealthMonitor {
    private final Clock clock;
    private final int issueCountForCriticalState;
    private final long issueWindowMs;
    private final long criticalStateWindowMs;
    private final AuditLogger auditLogger;
    private final Notifier.ListenerFailureHandler failureHandler;
    private final Deque<Long> issueWindow;
    private final Notifier<IssueEvent> issueSignal;
    private final Notifier<Boolean> criticalStateSignal;
    private final Notifier<CorruptionEvent> corruptionSignal;
    private long criticalSinceMs;
    private long issueTotal;
    private long corruptionTotal;

    public HealthMonitor(
            Clock clock,
            int issueCountForCriticalState,
            long issueWindowMs,
            long criticalStateWindowMs,
            AuditLogger auditLogger,
            Executor dispatchExecutor,
            Notifier.ListenerFailureHandler failureHandler
    ) {
        this.clock = clock;
        this.issueCountForCriticalState = Math.max(1, issueCountForCriticalState);
        this.issueWindowMs = issueWindowMs;
        this.criticalStateWindowMs = criticalStateWindowMs;
        this.auditLogger = auditLogger;
        this.failureHandler = failureHandler;
        this.issueWindow = new ArrayDeque<>();
        this.issueSignal = new Notifier<>("health.issue", dispatchExecutor, failureHandler);
        this.criticalStateSignal = new Notifier<>("health.critical", dispatchExecutor, failureHandler);
        this.corruptionSignal = new Notifier<>("health.corruption", dispatchExecutor, failureHandler);
        this.criticalSinceMs = 0L;
    }

    public Notifier<IssueEvent> issueSignal() {
        return issueSignal;
    }

    public Notifier<Boolean> criticalStateSignal() {
        return criticalStateSignal;
    }

    public Notifier<CorruptionEvent> corruptionSignal() {
        return corruptionSignal;
    }

    public void reportIssue(String store, String key, String kind, String message) {
        long nowMs = clock.millis();
        boolean entered;
        synchronized (this) {
            issueTotal++;
            issueWindow.addLast(nowMs);
            prune(nowMs);
            entered = evaluate(nowMs);
        }
        issueSignal.fire(new IssueEvent(store, key, kind, message, nowMs));
        if (entered) {
            announce(true, nowMs);
        }
    }

    public void reportCorruption(String store, String key, String message) {
        synchronized (this) {
            corruptionTotal++;
        }
        reportIssue(store, key, "corruption", message);
        long nowMs = clock.millis();
        audit(AuditLogger.AuditEvent.of(
                "store.corruption",
                "health",
                store + "/" + key,
                "detected",
                Map.of("message", message == null ? "" : message)
        ));
        corruptionSignal.fire(new CorruptionEvent(store, key, nowMs));
    }

    public void tick() {
        long nowMs = clock.millis();
        boolean exited = false;
        synchronized (this) {
            prune(nowMs);
            if (criticalSinceMs != 0L
                    && issueWindow.size() < issueCountForCriticalState
                    && nowMs - criticalSinceMs >= criticalStateWindowMs) {
                criticalSinceMs = 0L;
                exited = true;
            }
        }
        if (exited) {
            announce(false, nowMs);
        }
    }

    public synchronized boolean isCritical() {
        return criticalSinceMs != 0L;
    }

    public synchronized Snapshot snapshot() {
        prune(clock.millis());
        return new Snapshot(issueWindow.size(), criticalSinceMs != 0L, criticalSinceMs, issueTotal, corruptionTotal);
    }

    private boolean evaluate(long nowMs) {
        if (issueWindow.size() < issueCountForCriticalState) {
            return false;
        }
        boolean entering = criticalSinceMs == 0L;
        criticalSinceMs = Math.max(1L, nowMs);
        return entering;
    }

    private void prune(long nowMs) {
        while (!issueWindow.isEmpty() && nowMs - issueWindow.peekFirst() > issueWindowMs) {
            issueWindow.pollFirst();
        }
    }

    private void announce(boolean critical, long nowMs) {
        audit(AuditLogger.AuditEvent.of(
                "health.critical_state",
                "health",
                "store/*",
                critical ? "entered" : "exited",
                Map.of("at_ms", nowMs)
        ));
        criticalStateSignal.fire(critical);
    }

    // Audit I/O failures must not abort the store call that reported the issue.
    private void audit(AuditLogger.AuditEvent event) {
        try {
            auditLogger.log(event);
        } catch (RuntimeException e) {
            failureHandler.onListenerFailure("audit", e);
        }
    }

    public record IssueEvent(String store, String key, String kind, String message, long atMs) {
    }

    public record CorruptionEvent(String store, String key, long atMs) {
    }

    public record Snapshot(int windowIssues, boolean critical, long criticalSinceMs, long issueTotal, long corruptionTotal) {
    }
}

package io.leasekeep.lease;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;

/**
 * A running force load. Steps are driven by {@link SessionLockManager#pollForceLoads()}; the result
 * completes once the lease is claimed, the attempt is superseded or cancelled, or the store fails.
 */
public final class ForceLoadHandle {
    private final String store;
    private final String key;
    private final ObjectNode template;
    private final SessionLockManager manager;
    private final CompletableFuture<ClaimResult> result;
    private int steps;
    private long lastStepDoneMs;
    private boolean stepInFlight;
    private boolean requested;
    private boolean cancelRequested;

    ForceLoadHandle(String store, String key, ObjectNode template, SessionLockManager manager) {
        this.store = store;
        this.key = key;
        this.template = template;
        this.manager = manager;
        this.result = new CompletableFuture<>();
    }

    public String store() {
        return store;
    }

    public String key() {
        return key;
    }

    public CompletableFuture<ClaimResult> result() {
        return result;
    }

    public synchronized int steps() {
        return steps;
    }

    public boolean isDone() {
        return result.isDone();
    }

    public boolean cancel() {
        return manager.cancelForceLoad(this);
    }

    ObjectNode template() {
        return template;
    }

    synchronized int beginStep(long nowMs, long stepMs, boolean first) {
        if (result.isDone() || stepInFlight || cancelRequested) {
            return 0;
        }
        if (!first && nowMs - lastStepDoneMs < stepMs) {
            return 0;
        }
        stepInFlight = true;
        steps++;
        return steps;
    }

    synchronized void stepDone(long nowMs, boolean wroteRequest) {
        stepInFlight = false;
        lastStepDoneMs = nowMs;
        requested = requested || wroteRequest;
    }

    synchronized boolean hasRequested() {
        return requested;
    }

    synchronized CancelDecision requestCancel() {
        if (result.isDone() || cancelRequested) {
            return CancelDecision.REJECTED;
        }
        cancelRequested = true;
        return stepInFlight ? CancelDecision.DEFERRED : CancelDecision.NOW;
    }

    synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    enum CancelDecision {
        NOW,
        DEFERRED,
        REJECTED
    }
}

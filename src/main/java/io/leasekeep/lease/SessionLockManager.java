package io.leasekeep.lease;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.leasekeep.bus.Notifier;
import io.leasekeep.config.LeaseSettings;
import io.leasekeep.model.LeaseState;
import io.leasekeep.model.ProfileRecord;
import io.leasekeep.model.RecordMetadata;
import io.leasekeep.model.SessionId;
import io.leasekeep.observability.AuditLogger;
import io.leasekeep.storage.PersistResult;
import io.leasekeep.storage.RemoteRecordGateway;
import io.leasekeep.util.Jsons;
import io.leasekeep.util.Templates;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Session-lease protocol over the record gateway.
 *
 * <p>A record is free when it has no active session, leased while its holder keeps stamping
 * {@code lastUpdate} within {@code deadLockAssumedAfter}, and adoptable by anyone afterwards. Every
 * decision is taken inside a single persist updater, so the check and the write are one atomic step
 * against the store and a refused claim writes nothing.
 */
public final class SessionLockManager {
    private final RemoteRecordGateway gateway;
    private final SessionId self;
    private final Clock clock;
    private final LeaseSettings settings;
    private final AuditLogger auditLogger;
    private final Executor dispatchExecutor;
    private final Notifier.ListenerFailureHandler failureHandler;
    private final Map<LeaseKey, Lease> leases;
    private final Set<LeaseKey> claiming;
    private final Map<LeaseKey, ForceLoadHandle> forceLoads;
    private final List<LeaseLifecycleListener> lifecycleListeners;
    private final Notifier<LeaseEnd> leaseLostSignal;

    public SessionLockManager(
            RemoteRecordGateway gateway,
            SessionId self,
            Clock clock,
            LeaseSettings settings,
            AuditLogger auditLogger,
            Executor dispatchExecutor,
            Notifier.ListenerFailureHandler failureHandler
    ) {
        this.gateway = gateway;
        this.self = self;
        this.clock = clock;
        this.settings = settings;
        this.auditLogger = auditLogger;
        this.dispatchExecutor = dispatchExecutor;
        this.failureHandler = failureHandler;
        this.leases = new LinkedHashMap<>();
        this.claiming = new HashSet<>();
        this.forceLoads = new LinkedHashMap<>();
        this.lifecycleListeners = new CopyOnWriteArrayList<>();
        this.leaseLostSignal = new Notifier<>("lease.lost", dispatchExecutor, failureHandler);
    }

    public SessionId self() {
        return self;
    }

    public Notifier<LeaseEnd> leaseLostSignal() {
        return leaseLostSignal;
    }

    public void addLifecycleListener(LeaseLifecycleListener listener) {
        lifecycleListeners.add(listener);
    }

    public synchronized Optional<Lease> lease(String store, String key) {
        return Optional.ofNullable(leases.get(new LeaseKey(store, key)));
    }

    public synchronized List<Lease> activeLeases() {
        return new ArrayList<>(leases.values());
    }

    public synchronized LeaseState state(String store, String key) {
        LeaseKey leaseKey = new LeaseKey(store, key);
        Lease lease = leases.get(leaseKey);
        if (lease != null) {
            return lease.state();
        }
        if (forceLoads.containsKey(leaseKey)) {
            return LeaseState.FORCE_LOADING;
        }
        return claiming.contains(leaseKey) ? LeaseState.CLAIMING : LeaseState.UNCLAIMED;
    }

    /**
     * Claims the record if it is free, abandoned, or already ours. A live foreign holder yields
     * {@link ClaimResult.Outcome#SESSION_LOCKED} and the record is left untouched.
     *
     * @throws IllegalStateException if this process already holds or is acquiring the key
     */
    public CompletableFuture<ClaimResult> claim(String store, String key, ObjectNode template) {
        return acquire(store, key, template, false, "lease.claim");
    }

    public CompletableFuture<ClaimResult> steal(String store, String key, ObjectNode template) {
        return acquire(store, key, template, true, "lease.steal");
    }

    /**
     * Starts a force load. The first step runs now; later steps run from {@link #pollForceLoads()} at most
     * once per {@code forceLoadStepSeconds}. The last allowed step claims unconditionally.
     */
    public ForceLoadHandle forceLoad(String store, String key, ObjectNode template) {
        LeaseKey leaseKey = reserve(store, key);
        ForceLoadHandle handle = new ForceLoadHandle(store, key, template, this);
        synchronized (this) {
            forceLoads.put(leaseKey, handle);
        }
        runForceStep(handle, true);
        return handle;
    }

    public void pollForceLoads() {
        List<ForceLoadHandle> running;
        synchronized (this) {
            running = new ArrayList<>(forceLoads.values());
        }
        for (ForceLoadHandle handle : running) {
            runForceStep(handle, false);
        }
    }

    public CompletableFuture<SaveOutcome> save(Lease lease) {
        Lease.Snapshot snapshot = lease.beginSave();
        if (snapshot == null) {
            return CompletableFuture.completedFuture(SaveOutcome.SKIPPED);
        }
        Decision decision = new Decision();
        return gateway.persist(lease.store(), lease.key(), current -> {
            long nowMs = clock.millis();
            if (!ownedBy(current, lease)) {
                decision.kind = DecisionKind.LOST;
                return null;
            }
            RecordMetadata next = current.metadata().withLastUpdate(nowMs);
            SessionId requester = next.forceLoadSession();
            if (requester != null && !requester.equals(self)) {
                decision.kind = DecisionKind.HAND_OVER;
                decision.holder = requester;
                next = next.withActiveSession(null);
            } else {
                decision.kind = DecisionKind.WRITE;
            }
            return new ProfileRecord(snapshot.data(), snapshot.metaTags(), next);
        }).handle((result, error) -> {
            long nowMs = clock.millis();
            if (error != null) {
                lease.saveFinished(snapshot, null, nowMs);
                return SaveOutcome.FAILED;
            }
            if (decision.kind == DecisionKind.WRITE) {
                lease.saveFinished(snapshot, storedMetadata(result), nowMs);
                return SaveOutcome.SAVED;
            }
            if (decision.kind == DecisionKind.HAND_OVER) {
                lease.saveFinished(snapshot, storedMetadata(result), nowMs);
                audit("lease.hand_over", lease.store(), lease.key(), "released",
                        Map.of("requester", decision.holder.toString()));
                endLease(lease, LeaseState.TERMINAL, LeaseEnd.Reason.FORCE_LOAD_REQUESTED, storedMetadata(result));
                return SaveOutcome.HANDED_OVER;
            }
            lease.saveFinished(snapshot, null, nowMs);
            audit("lease.save", lease.store(), lease.key(), "stolen", Map.of());
            endLease(lease, LeaseState.STOLEN, LeaseEnd.Reason.STOLEN, null);
            return SaveOutcome.STOLEN;
        });
    }

    public CompletableFuture<Void> release(Lease lease) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Lease.Snapshot snapshot = lease.beginRelease(future);
        if (snapshot == null) {
            CompletableFuture<Void> existing = lease.releaseFuture();
            return existing != null ? existing : CompletableFuture.completedFuture(null);
        }
        notifyDeactivated(lease);
        Decision decision = new Decision();
        gateway.persist(lease.store(), lease.key(), current -> {
            if (!ownedBy(current, lease)) {
                decision.kind = DecisionKind.LOST;
                return null;
            }
            decision.kind = DecisionKind.WRITE;
            RecordMetadata next = current.metadata()
                    .withActiveSession(null)
                    .withForceLoadSession(null)
                    .withLastUpdate(clock.millis());
            return new ProfileRecord(snapshot.data(), snapshot.metaTags(), next);
        }).whenComplete((result, error) -> {
            if (error != null) {
                audit("lease.release", lease.store(), lease.key(), "failed", Map.of("error", messageOf(error)));
                endLease(lease, LeaseState.TERMINAL, LeaseEnd.Reason.RELEASE_FAILED, null);
                future.completeExceptionally(unwrap(error));
            } else if (decision.kind == DecisionKind.LOST) {
                audit("lease.release", lease.store(), lease.key(), "stolen", Map.of());
                endLease(lease, LeaseState.STOLEN, LeaseEnd.Reason.STOLEN, null);
                future.complete(null);
            } else {
                audit("lease.release", lease.store(), lease.key(), "released", Map.of());
                endLease(lease, LeaseState.TERMINAL, LeaseEnd.Reason.RELEASED, storedMetadata(result));
                future.complete(null);
            }
        });
        return future;
    }

    public CompletableFuture<Void> releaseAll() {
        List<Lease> held;
        List<ForceLoadHandle> running;
        synchronized (this) {
            held = new ArrayList<>(leases.values());
            running = new ArrayList<>(forceLoads.values());
        }
        for (ForceLoadHandle handle : running) {
            handle.cancel();
        }
        List<CompletableFuture<?>> pending = new ArrayList<>();
        for (Lease lease : held) {
            pending.add(release(lease).handle((ignored, error) -> null));
        }
        // A step already in flight may still claim; that lease is released as well.
        for (ForceLoadHandle handle : running) {
            pending.add(handle.result().thenCompose(claim -> claim.isClaimed()
                    ? release(claim.lease()).handle((ignored, error) -> (Void) null)
                    : CompletableFuture.<Void>completedFuture(null)));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]));
    }

    public CompletableFuture<Optional<ProfileRecord>> view(String store, String key) {
        return gateway.fetch(store, key);
    }

    public CompletableFuture<Void> wipe(String store, String key) {
        synchronized (this) {
            LeaseKey leaseKey = new LeaseKey(store, key);
            if (leases.containsKey(leaseKey) || claiming.contains(leaseKey)) {
                throw new IllegalStateException("Cannot wipe " + store + "/" + key + " while it is leased by this process");
            }
        }
        return gateway.remove(store, key).whenComplete((ignored, error) ->
                audit("record.wipe", store, key, error == null ? "removed" : "failed",
                        error == null ? Map.of() : Map.of("error", messageOf(error))));
    }

    // Two cooldowns cover a save in flight ahead of the release; the rest covers its retries.
    long releaseWaitMs() {
        return 2L * settings.writeCooldownMs() + (long) settings.retryMaxAttempts() * settings.retryMaxBackoffMs();
    }

    boolean cancelForceLoad(ForceLoadHandle handle) {
        return switch (handle.requestCancel()) {
            case NOW -> {
                finishCancelled(handle);
                yield true;
            }
            case DEFERRED -> true;
            case REJECTED -> false;
        };
    }

    private CompletableFuture<ClaimResult> acquire(String store, String key, ObjectNode template, boolean unconditional, String action) {
        LeaseKey leaseKey = reserve(store, key);
        Decision decision = new Decision();
        return gateway.persist(store, key, current -> claimUpdate(current, template, unconditional, decision))
                .handle((result, error) -> {
                    ClaimResult claim;
                    if (error != null) {
                        audit(action, store, key, "failed", Map.of("error", messageOf(error)));
                        claim = ClaimResult.failed(unwrap(error), 1);
                    } else if (decision.kind == DecisionKind.WRITE) {
                        audit(action, store, key, "granted", claimDetails(result, decision));
                        claim = ClaimResult.claimed(activate(store, key, result.record().orElseThrow()), 1);
                    } else {
                        audit(action, store, key, "conflict", Map.of("holder", String.valueOf(decision.holder)));
                        claim = ClaimResult.locked(decision.holder);
                    }
                    synchronized (this) {
                        claiming.remove(leaseKey);
                    }
                    return claim;
                });
    }

    private ProfileRecord claimUpdate(ProfileRecord current, ObjectNode template, boolean unconditional, Decision decision) {
        long nowMs = clock.millis();
        if (current == null) {
            decision.kind = DecisionKind.WRITE;
            decision.holder = null;
            return new ProfileRecord(
                    Templates.copyOf(template),
                    Jsons.mapper().createObjectNode(),
                    RecordMetadata.fresh(nowMs).claimedBy(self, nowMs)
            );
        }
        RecordMetadata metadata = current.metadata();
        if (!unconditional && heldByOther(metadata, nowMs)) {
            decision.kind = DecisionKind.LOCKED;
            decision.holder = metadata.activeSession();
            return null;
        }
        decision.kind = DecisionKind.WRITE;
        decision.holder = metadata.activeSession();
        ObjectNode data = current.data().deepCopy();
        Templates.reconcile(data, template);
        return new ProfileRecord(data, current.metaTags().deepCopy(), metadata.claimedBy(self, nowMs));
    }

    private void runForceStep(ForceLoadHandle handle, boolean first) {
        int step = handle.beginStep(clock.millis(), settings.forceLoadStepMs(), first);
        if (step == 0) {
            return;
        }
        boolean takeover = step >= settings.forceLoadMaxSteps();
        Decision decision = new Decision();
        gateway.persist(handle.store(), handle.key(), current -> {
            if (current == null || takeover || !heldByOther(current.metadata(), clock.millis())) {
                return claimUpdate(current, handle.template(), true, decision);
            }
            RecordMetadata metadata = current.metadata();
            SessionId requester = metadata.forceLoadSession();
            decision.holder = metadata.activeSession();
            if (self.equals(requester)) {
                decision.kind = DecisionKind.WAIT;
                return null;
            }
            if (requester != null && handle.hasRequested()) {
                decision.kind = DecisionKind.SUPERSEDED;
                decision.holder = requester;
                return null;
            }
            decision.kind = DecisionKind.REQUEST;
            return current.withMetadata(metadata.withForceLoadSession(self));
        }).whenComplete((result, error) -> finishForceStep(handle, step, decision, result, error));
    }

    private void finishForceStep(ForceLoadHandle handle, int step, Decision decision, PersistResult result, Throwable error) {
        long nowMs = clock.millis();
        String store = handle.store();
        String key = handle.key();
        if (error != null) {
            handle.stepDone(nowMs, false);
            audit("lease.force_load", store, key, "failed", Map.of("step", step, "error", messageOf(error)));
            completeForceLoad(handle, ClaimResult.failed(unwrap(error), step));
            return;
        }
        switch (decision.kind) {
            case WRITE -> {
                handle.stepDone(nowMs, false);
                audit("lease.force_load", store, key, "granted", Map.of("step", step));
                completeForceLoad(handle, ClaimResult.claimed(activate(store, key, result.record().orElseThrow()), step));
            }
            case SUPERSEDED -> {
                handle.stepDone(nowMs, false);
                audit("lease.force_load", store, key, "superseded",
                        Map.of("step", step, "requester", decision.holder.toString()));
                completeForceLoad(handle, ClaimResult.superseded(decision.holder, step));
            }
            default -> {
                handle.stepDone(nowMs, decision.kind == DecisionKind.REQUEST && result.written());
                audit("lease.force_load", store, key, "waiting",
                        Map.of("step", step, "holder", String.valueOf(decision.holder)));
                if (handle.isCancelRequested()) {
                    finishCancelled(handle);
                }
            }
        }
    }

    private void finishCancelled(ForceLoadHandle handle) {
        int steps = handle.steps();
        audit("lease.force_load", handle.store(), handle.key(), "cancelled", Map.of("step", steps));
        if (!handle.hasRequested()) {
            completeForceLoad(handle, ClaimResult.cancelled(steps));
            return;
        }
        gateway.persist(handle.store(), handle.key(), current -> {
            if (current == null || !self.equals(current.metadata().forceLoadSession())) {
                return null;
            }
            return current.withMetadata(current.metadata().withForceLoadSession(null));
        }).whenComplete((ignored, error) -> completeForceLoad(handle, ClaimResult.cancelled(steps)));
    }

    private void completeForceLoad(ForceLoadHandle handle, ClaimResult claim) {
        LeaseKey leaseKey = new LeaseKey(handle.store(), handle.key());
        synchronized (this) {
            forceLoads.remove(leaseKey, handle);
            claiming.remove(leaseKey);
        }
        handle.result().complete(claim);
    }

    private Lease activate(String store, String key, ProfileRecord record) {
        Notifier<LeaseEnd> endSignal = new Notifier<>("lease." + store + "/" + key, dispatchExecutor, failureHandler);
        Lease lease = new Lease(store, key, record, clock.millis(), this, endSignal);
        synchronized (this) {
            leases.put(new LeaseKey(store, key), lease);
        }
        for (LeaseLifecycleListener listener : lifecycleListeners) {
            listener.onActivated(lease);
        }
        return lease;
    }

    private void endLease(Lease lease, LeaseState finalState, LeaseEnd.Reason reason, RecordMetadata stored) {
        if (!lease.end(finalState, stored)) {
            return;
        }
        synchronized (this) {
            leases.remove(new LeaseKey(lease.store(), lease.key()), lease);
        }
        notifyDeactivated(lease);
        LeaseEnd end = new LeaseEnd(lease.store(), lease.key(), reason, clock.millis());
        lease.endSignal().fire(end);
        if (reason.isLoss()) {
            leaseLostSignal.fire(end);
        }
    }

    private void notifyDeactivated(Lease lease) {
        for (LeaseLifecycleListener listener : lifecycleListeners) {
            listener.onDeactivated(lease);
        }
    }

    private LeaseKey reserve(String store, String key) {
        gateway.store(store);
        LeaseKey leaseKey = new LeaseKey(store, key);
        synchronized (this) {
            if (leases.containsKey(leaseKey) || claiming.contains(leaseKey)) {
                throw new IllegalStateException("Profile " + store + "/" + key + " is already held or being claimed by this process");
            }
            claiming.add(leaseKey);
        }
        return leaseKey;
    }

    private boolean heldByOther(RecordMetadata metadata, long nowMs) {
        return metadata.isLeaseAlive(nowMs, settings.deadLockAssumedAfterMs()) && !self.equals(metadata.activeSession());
    }

    private boolean ownedBy(ProfileRecord current, Lease lease) {
        return current != null
                && self.equals(current.metadata().activeSession())
                && current.metadata().sessionLoadCount() == lease.sessionLoadCount();
    }

    private Map<String, Object> claimDetails(PersistResult result, Decision decision) {
        Map<String, Object> details = new LinkedHashMap<>();
        result.record().ifPresent(r -> details.put("session_load_count", r.metadata().sessionLoadCount()));
        if (decision.holder != null && !decision.holder.equals(self)) {
            details.put("previous_holder", decision.holder.toString());
        }
        return details;
    }

    private void audit(String action, String store, String key, String result, Map<String, Object> details) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(action, self.toString(), store + "/" + key, result, details));
        } catch (RuntimeException e) {
            failureHandler.onListenerFailure("audit", e);
        }
    }

    private static RecordMetadata storedMetadata(PersistResult result) {
        return result.record().map(ProfileRecord::metadata).orElse(null);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        Throwable cause = unwrap(error);
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    private enum DecisionKind {
        WRITE,
        LOCKED,
        LOST,
        HAND_OVER,
        REQUEST,
        WAIT,
        SUPERSEDED
    }

    private static final class Decision {
        private DecisionKind kind;
        private SessionId holder;
    }

    private record LeaseKey(String store, String key) {
    }
}

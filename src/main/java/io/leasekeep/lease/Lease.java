package io.leasekeep.lease;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.leasekeep.bus.Notifier;
import io.leasekeep.model.LeaseState;
import io.leasekeep.model.ProfileRecord;
import io.leasekeep.model.RecordMetadata;
import io.leasekeep.util.Templates;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * This process's exclusive hold on one stored profile.
 *
 * <p>Mutations go through {@link #update} and are persisted by the next auto-save or by
 * {@link #release()}. Once the lease ends (released, stolen, or handed over to a force loader) the
 * payload is read-only; {@link #endSignal()} reports why.
 */
public final class Lease implements AutoCloseable {
    private final String store;
    private final String key;
    private final long sessionLoadCount;
    private final long loadedAtMs;
    private final SessionLockManager manager;
    private final Notifier<LeaseEnd> endSignal;
    private ObjectNode data;
    private ObjectNode metaTags;
    private RecordMetadata metadata;
    private LeaseState state;
    private long revision;
    private long savedRevision;
    private long lastSavedAtMs;
    private boolean saveInFlight;
    private CompletableFuture<Void> releaseFuture;

    Lease(String store, String key, ProfileRecord record, long nowMs, SessionLockManager manager, Notifier<LeaseEnd> endSignal) {
        this.store = store;
        this.key = key;
        this.sessionLoadCount = record.metadata().sessionLoadCount();
        this.loadedAtMs = nowMs;
        this.manager = manager;
        this.endSignal = endSignal;
        this.data = record.data().deepCopy();
        this.metaTags = record.metaTags().deepCopy();
        this.metadata = record.metadata();
        this.state = LeaseState.ACTIVE;
        this.lastSavedAtMs = nowMs;
    }

    public String store() {
        return store;
    }

    public String key() {
        return key;
    }

    public long sessionLoadCount() {
        return sessionLoadCount;
    }

    public long loadedAtMs() {
        return loadedAtMs;
    }

    public Notifier<LeaseEnd> endSignal() {
        return endSignal;
    }

    public synchronized LeaseState state() {
        return state;
    }

    public synchronized boolean isActive() {
        return state == LeaseState.ACTIVE;
    }

    public synchronized boolean isDirty() {
        return revision != savedRevision;
    }

    public synchronized RecordMetadata metadata() {
        return metadata;
    }

    public synchronized long lastSavedAtMs() {
        return lastSavedAtMs;
    }

    public synchronized boolean isSaveInFlight() {
        return saveInFlight;
    }

    public synchronized ObjectNode data() {
        return data.deepCopy();
    }

    public synchronized JsonNode metaTag(String name) {
        JsonNode value = metaTags.get(name);
        return value == null ? null : value.deepCopy();
    }

    public synchronized void update(Consumer<ObjectNode> mutation) {
        requireWritable();
        mutation.accept(data);
        revision++;
    }

    public synchronized void setMetaTag(String name, JsonNode value) {
        requireWritable();
        if (value == null) {
            metaTags.remove(name);
        } else {
            metaTags.set(name, value.deepCopy());
        }
        revision++;
    }

    public synchronized void reconcile(ObjectNode template) {
        requireWritable();
        Templates.reconcile(data, template);
        revision++;
    }

    public CompletableFuture<Void> release() {
        return manager.release(this);
    }

    /**
     * Releases and waits for the final write. The write runs on the next tick once the key's cooldown has
     * passed, so this fails with {@link IllegalStateException} when nothing ticks the runtime.
     */
    @Override
    public void close() {
        long waitMs = manager.releaseWaitMs();
        try {
            release().get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IllegalStateException(
                    "Release of " + store + "/" + key + " did not finish within " + waitMs + "ms; is the runtime ticking?", e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while releasing " + store + "/" + key, e);
        }
    }

    synchronized Snapshot beginSave() {
        if (state != LeaseState.ACTIVE || saveInFlight) {
            return null;
        }
        saveInFlight = true;
        return new Snapshot(data.deepCopy(), metaTags.deepCopy(), revision);
    }

    synchronized void saveFinished(Snapshot snapshot, RecordMetadata stored, long nowMs) {
        saveInFlight = false;
        if (stored != null) {
            metadata = stored;
            lastSavedAtMs = nowMs;
            savedRevision = Math.max(savedRevision, snapshot.revision());
        }
    }

    synchronized Snapshot beginRelease(CompletableFuture<Void> future) {
        if (state != LeaseState.ACTIVE) {
            return null;
        }
        state = LeaseState.RELEASING;
        releaseFuture = future;
        return new Snapshot(data.deepCopy(), metaTags.deepCopy(), revision);
    }

    synchronized CompletableFuture<Void> releaseFuture() {
        return releaseFuture;
    }

    synchronized boolean end(LeaseState finalState, RecordMetadata stored) {
        if (state.isFinal()) {
            return false;
        }
        state = finalState;
        if (stored != null) {
            metadata = stored;
        }
        return true;
    }

    private void requireWritable() {
        if (state != LeaseState.ACTIVE) {
            throw new LeaseStolenException("Lease on " + store + "/" + key + " is " + state);
        }
    }

    record Snapshot(ObjectNode data, ObjectNode metaTags, long revision) {
    }
}

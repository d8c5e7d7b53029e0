package io.leasekeep.storage;

import io.leasekeep.bus.SerializedWriteChannel;
import io.leasekeep.model.ProfileRecord;
import io.leasekeep.observability.HealthMonitor;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Retrying access to single records. Every call goes through the write channel for its key, so reads
 * and writes of one record are strictly ordered.
 *
 * <p>Transient failures are retried with capped exponential backoff; once attempts run out the call fails
 * with {@link StoreUnavailableException}. Oversized payloads and undecodable records fail at once. Every
 * failed attempt is reported to the health monitor; corruption is reported on its own signal as well.
 */
public final class RemoteRecordGateway {
    private final Map<String, RecordStore> stores;
    private final SerializedWriteChannel channel;
    private final HealthMonitor healthMonitor;
    private final RetryPolicy retryPolicy;
    private final long payloadMaxBytes;
    private final Sleeper sleeper;

    public RemoteRecordGateway(
            SerializedWriteChannel channel,
            HealthMonitor healthMonitor,
            RetryPolicy retryPolicy,
            long payloadMaxBytes,
            Sleeper sleeper
    ) {
        this.stores = new ConcurrentHashMap<>();
        this.channel = channel;
        this.healthMonitor = healthMonitor;
        this.retryPolicy = retryPolicy;
        this.payloadMaxBytes = payloadMaxBytes;
        this.sleeper = sleeper;
    }

    public void registerStore(RecordStore store) {
        stores.put(store.name(), store);
    }

    public RecordStore store(String storeName) {
        RecordStore store = stores.get(storeName);
        if (store == null) {
            throw new IllegalArgumentException("Unknown store: " + storeName);
        }
        return store;
    }

    public CompletableFuture<Optional<ProfileRecord>> fetch(String storeName, String key) {
        RecordStore store = store(storeName);
        return channel.submit(storeName, key, () -> withRetry(storeName, key, "get", () ->
                store.get(key).map(v -> ProfileCodec.decode(storeName, key, v.value()))
        ));
    }

    public CompletableFuture<PersistResult> persist(String storeName, String key, RecordUpdater updater) {
        RecordStore store = store(storeName);
        return channel.submit(storeName, key, () -> withRetry(storeName, key, "update", () -> {
            Attempt attempt = new Attempt();
            Optional<StoredValue> stored = store.update(key, raw -> {
                ProfileRecord current = raw == null ? null : ProfileCodec.decode(storeName, key, raw);
                ProfileRecord next = updater.apply(current);
                attempt.seen = current;
                attempt.next = next;
                if (next == null) {
                    return null;
                }
                String encoded = ProfileCodec.encode(next);
                long bytes = encoded.getBytes(StandardCharsets.UTF_8).length;
                if (bytes > payloadMaxBytes) {
                    throw new PayloadTooLargeException(storeName, key, bytes, payloadMaxBytes);
                }
                return encoded;
            });
            if (attempt.next != null && stored.isPresent()) {
                return new PersistResult(Optional.of(attempt.next), true);
            }
            return new PersistResult(Optional.ofNullable(attempt.seen), false);
        }));
    }

    public CompletableFuture<Void> remove(String storeName, String key) {
        RecordStore store = store(storeName);
        return channel.submit(storeName, key, () -> withRetry(storeName, key, "remove", () -> {
            store.remove(key);
            return null;
        }));
    }

    private <T> T withRetry(String storeName, String key, String op, Callable<T> call) throws Exception {
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (TransientStoreException e) {
                healthMonitor.reportIssue(storeName, key, e.reason().name().toLowerCase(), e.getMessage());
                if (attempt >= maxAttempts) {
                    throw new StoreUnavailableException(
                            "Store " + op + " failed for " + storeName + "/" + key + " after " + attempt + " attempts",
                            e
                    );
                }
                pause(storeName, key, retryPolicy.backoffMs(attempt));
            } catch (DataCorruptionException e) {
                healthMonitor.reportCorruption(storeName, key, e.getMessage());
                throw e;
            } catch (PayloadTooLargeException e) {
                healthMonitor.reportIssue(storeName, key, "payload_too_large", e.getMessage());
                throw e;
            } catch (StoreUnavailableException e) {
                healthMonitor.reportIssue(storeName, key, "unavailable", e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                healthMonitor.reportIssue(storeName, key, "error", String.valueOf(e.getMessage()));
                throw new StoreUnavailableException("Store " + op + " failed for " + storeName + "/" + key, e);
            }
        }
    }

    private void pause(String storeName, String key, long backoffMs) {
        try {
            sleeper.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while backing off on " + storeName + "/" + key, e);
        }
    }

    private static final class Attempt {
        private ProfileRecord seen;
        private ProfileRecord next;
    }

    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = Thread::sleep;

        void sleep(long millis) throws InterruptedException;
    }
}

package io.leasekeep.storage;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public final class InMemoryRecordStore implements RecordStore {
    private final String storeName;
    private final Clock clock;
    private final long perKeyCallSpacingMs;
    private final Map<String, StoredValue> values;
    private final Map<String, Long> lastCallMs;
    private final Map<String, Integer> callCounts;
    private final Deque<RuntimeException> injectedFailures;

    public InMemoryRecordStore(String storeName, Clock clock) {
        this(storeName, clock, 0L);
    }

    public InMemoryRecordStore(String storeName, Clock clock, long perKeyCallSpacingMs) {
        this.storeName = storeName;
        this.clock = clock;
        this.perKeyCallSpacingMs = Math.max(0L, perKeyCallSpacingMs);
        this.values = new HashMap<>();
        this.lastCallMs = new HashMap<>();
        this.callCounts = new HashMap<>();
        this.injectedFailures = new ArrayDeque<>();
    }

    @Override
    public String name() {
        return storeName;
    }

    @Override
    public synchronized Optional<StoredValue> get(String key) {
        admit(key);
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized Optional<StoredValue> update(String key, UnaryOperator<String> transform) {
        admit(key);
        StoredValue current = values.get(key);
        String next = transform.apply(current == null ? null : current.value());
        if (next == null) {
            return Optional.ofNullable(current);
        }
        StoredValue stored = new StoredValue(key, next, current == null ? 1L : current.version() + 1L, clock.millis());
        values.put(key, stored);
        return Optional.of(stored);
    }

    @Override
    public synchronized void remove(String key) {
        admit(key);
        values.remove(key);
    }

    public synchronized void failNext(RuntimeException failure) {
        injectedFailures.addLast(failure);
    }

    public synchronized void putRaw(String key, String value) {
        StoredValue current = values.get(key);
        values.put(key, new StoredValue(key, value, current == null ? 1L : current.version() + 1L, clock.millis()));
    }

    public synchronized Optional<String> rawValue(String key) {
        StoredValue current = values.get(key);
        return current == null ? Optional.empty() : Optional.of(current.value());
    }

    public synchronized int callCount(String key) {
        return callCounts.getOrDefault(key, 0);
    }

    private void admit(String key) {
        callCounts.merge(key, 1, Integer::sum);
        RuntimeException failure = injectedFailures.pollFirst();
        if (failure != null) {
            throw failure;
        }
        long nowMs = clock.millis();
        Long last = lastCallMs.get(key);
        if (perKeyCallSpacingMs > 0L && last != null && nowMs - last < perKeyCallSpacingMs) {
            throw new TransientStoreException(
                    TransientStoreException.Reason.RATE_LIMITED,
                    "Rate limited: " + storeName + "/" + key
            );
        }
        lastCallMs.put(key, nowMs);
    }
}

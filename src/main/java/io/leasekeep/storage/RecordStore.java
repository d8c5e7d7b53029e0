package io.leasekeep.storage;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Remote key-value store holding serialized profile records.
 *
 * <p>{@link #update} is an atomic read-modify-write: the transform receives the current raw value
 * (or {@code null} when the key is absent) and returns the value to store, or {@code null} to leave the
 * key untouched. Implementations may invoke the transform more than once when a concurrent writer wins
 * the optimistic version check.
 *
 * <p>Calls may fail with {@link TransientStoreException} (rate limiting, timeouts); callers retry those.
 */
public interface RecordStore {
    String name();

    Optional<StoredValue> get(String key);

    Optional<StoredValue> update(String key, UnaryOperator<String> transform);

    void remove(String key);
}

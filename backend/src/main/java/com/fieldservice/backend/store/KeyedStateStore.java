package com.fieldservice.backend.store;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

/**
 * Keyed storage for the mutable security state shared across requests:
 * login-attempt histories, rate-limit buckets and CSRF tokens.
 * <p>
 * Implementations must be thread-safe. {@link #update} is the only write path for
 * read-modify-write and must be atomic per key: two concurrent updates of the same
 * key never observe the same previous value. Values are expected to be immutable.
 * <p>
 * A remote implementation signals backend faults (timeouts, lost connections) with
 * {@link StateStoreException}; callers decide whether that fails open or closed.
 *
 * @param <V> immutable value type
 */
public interface KeyedStateStore<V> {

    /**
     * Returns the current value for a key.
     *
     * @param key state key
     * @return the value, or empty if none is stored
     */
    Optional<V> get(String key);

    /**
     * Atomically replaces the value for a key with {@code updater(current)}.
     * The updater receives {@code null} when no value exists; returning {@code null}
     * removes the entry.
     *
     * @param key     state key
     * @param updater pure function from the current value to the next one
     * @return the value now stored, or {@code null} if the entry was removed
     */
    V update(String key, UnaryOperator<V> updater);

    /**
     * Removes the value for a key. Removing an absent key is a no-op.
     *
     * @param key state key
     */
    void reset(String key);

    /**
     * Removes every entry matching the predicate.
     *
     * @param predicate test on key and value
     * @return number of entries removed
     */
    int evictIf(BiPredicate<String, V> predicate);

    /**
     * Point-in-time copy of all entries, for reporting.
     *
     * @return immutable snapshot
     */
    Map<String, V> snapshot();
}

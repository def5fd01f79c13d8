package com.fieldservice.backend.store;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

/**
 * Non-persistent {@link KeyedStateStore} backed by a {@link ConcurrentHashMap}.
 *
 * Per-key atomicity comes from {@link ConcurrentHashMap#compute}. State is lost on
 * restart and is not shared between instances.
 */
@Slf4j
public class InMemoryKeyedStateStore<V> implements KeyedStateStore<V> {

    private final String name;
    private final ConcurrentHashMap<String, V> store = new ConcurrentHashMap<>();

    public InMemoryKeyedStateStore(String name) {
        this.name = name;
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public V update(String key, UnaryOperator<V> updater) {
        return store.compute(key, (k, current) -> updater.apply(current));
    }

    @Override
    public void reset(String key) {
        store.remove(key);
    }

    @Override
    public int evictIf(BiPredicate<String, V> predicate) {
        int[] removed = {0};
        store.forEach((key, value) -> {
            // remove(key, value) skips entries that changed since we read them
            if (predicate.test(key, value) && store.remove(key, value)) {
                removed[0]++;
            }
        });
        if (removed[0] > 0) {
            log.debug("Evicted {} entr(ies) from {} store", removed[0], name);
        }
        return removed[0];
    }

    @Override
    public Map<String, V> snapshot() {
        return Map.copyOf(store);
    }

    public int size() {
        return store.size();
    }
}

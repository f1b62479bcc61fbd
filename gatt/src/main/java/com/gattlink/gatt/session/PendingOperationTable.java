package com.gattlink.gatt.session;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Correlates outstanding native operations with the futures handed to callers.
 *
 * <p>The native stack identifies a completion only by the characteristic it concerns,
 * so entries are keyed by that identity and at most one future is held per key. The
 * table never completes futures itself: every method hands displaced or removed futures
 * back to the caller, which completes them once it has released its lock.</p>
 *
 * <p>Not thread-safe. Instances are guarded by the lock of the owning session.</p>
 *
 * @param <K> correlation key, usually a characteristic uuid
 * @param <V> result type of the operation
 */
public class PendingOperationTable<K, V> {

    private final Map<K, CompletableFuture<V>> pending = new HashMap<>();

    /**
     * Record a future under a key.
     *
     * @return the future previously held under the key, or null
     */
    public CompletableFuture<V> put(K key, CompletableFuture<V> future) {
        return pending.put(key, future);
    }

    /**
     * Remove and return the future held under a key.
     *
     * @return the future, or null if nothing is pending for the key
     */
    public CompletableFuture<V> take(K key) {
        return pending.remove(key);
    }

    /**
     * Remove the entry only if it still holds the given future.
     *
     * @return true if the entry was removed
     */
    public boolean remove(K key, CompletableFuture<V> future) {
        return pending.remove(key, future);
    }

    /**
     * Remove every entry.
     *
     * @return the futures that were pending
     */
    public List<CompletableFuture<V>> drain() {
        List<CompletableFuture<V>> drained = new ArrayList<>(pending.values());
        pending.clear();
        return drained;
    }

    public boolean contains(K key) {
        return pending.containsKey(key);
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}

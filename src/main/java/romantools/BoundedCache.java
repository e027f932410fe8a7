package romantools;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Fixed-capacity memo map. Entries are never evicted; once {@code capacity} keys are held,
 * further results are computed but not stored.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class BoundedCache<K, V> {
    /**
     * Default capacity of the engine and converter caches.
     */
    public static final int DEFAULT_CAPACITY = 10_000;

    private final int capacity;
    private final ConcurrentMap<K, V> map = new ConcurrentHashMap<>();

    public BoundedCache() {
        this(DEFAULT_CAPACITY);
    }

    public BoundedCache(int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0: " + capacity);
        this.capacity = capacity;
    }

    public V get(K key) {
        return map.get(key);
    }

    /**
     * Returns the cached value of {@code key}, computing and (capacity permitting) storing it
     * when absent.
     */
    public V getOrCompute(K key, Function<? super K, ? extends V> compute) {
        V v = map.get(key);
        if (v != null) return v;
        V computed = compute.apply(key);
        if (computed != null && map.size() < capacity) {
            V prev = map.putIfAbsent(key, computed);
            if (prev != null) return prev;
        }
        return computed;
    }

    public boolean containsKey(K key) {
        return map.containsKey(key);
    }

    public int size() {
        return map.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        map.clear();
    }
}

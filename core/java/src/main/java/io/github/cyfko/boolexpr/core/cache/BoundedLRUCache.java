package io.github.cyfko.boolexpr.core.cache;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache for transformation results.
 * <p>
 * Entries live in an access-ordered {@link LinkedHashMap}; once the cache holds {@code maxSize} entries, inserting a
 * new one evicts the least recently used.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Lookups reorder the map, so {@link #get} and {@link #computeIfAbsent} take the write lock. Read-only queries
 * ({@link #size}, {@link #containsKey}, {@link #getStats}) share the read lock. No lock is held while a mapping
 * function runs: a slow computation never blocks other keys.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, String> cache = new BoundedLRUCache<>(1000);
 *
 * String dnf = cache.computeIfAbsent("DNF:[\"NOT\",\"x\"]", key -> service.compute(key));
 * cache.getStats(); // BoundedLRUCache[size=1, maxSize=1000, hits=0, misses=1, utilization=0.1%]
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @author cyfko
 * @since 1.0.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final Map<K, V> entries;
    private final ReadWriteLock lock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Creates a bounded LRU cache with the specified maximum size.
     *
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public BoundedLRUCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }

        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLRUCache.this.maxSize;
            }
        };
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * Retrieves a value and marks it as most recently used.
     *
     * @param key the key to look up
     * @return the cached value, or null if not present
     */
    public V get(K key) {
        lock.writeLock().lock();
        try {
            V value = entries.get(key);
            (value != null ? hits : misses).incrementAndGet();
            return value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a value, evicting the least recently used entry if the cache is full.
     *
     * @param key the key to store
     * @param value the value to store, must not be null
     */
    public void put(K key, V value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot cache a null value for key: " + key);
        }
        lock.writeLock().lock();
        try {
            entries.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cached value for {@code key}, computing and storing it on a miss.
     * <p>
     * The mapping function runs outside the lock. Concurrent callers missing the same key may each compute it; the
     * first stored value wins and is returned to all of them. A null result is returned but not cached. Exceptions
     * thrown by the function propagate and nothing is stored.
     * </p>
     *
     * @param key the key to compute for
     * @param mappingFunction the function to compute the value
     * @return the cached or newly computed value
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        lock.writeLock().lock();
        try {
            V cached = entries.get(key);
            if (cached != null) {
                hits.incrementAndGet();
                return cached;
            }
            misses.incrementAndGet();
        } finally {
            lock.writeLock().unlock();
        }

        V value = mappingFunction.apply(key);
        if (value == null) {
            return null;
        }

        lock.writeLock().lock();
        try {
            V existing = entries.putIfAbsent(key, value);
            return existing != null ? existing : value;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Checks presence without touching the access order or the hit counters.
     *
     * @param key the key to check
     * @return true if the key is present
     */
    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes all entries and resets the hit and miss counters.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            hits.set(0);
            misses.set(0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    /**
     * Returns cache statistics as a formatted string.
     *
     * @return statistics string
     */
    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format(Locale.ROOT,
                "BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d, utilization=%.1f%%]",
                entries.size(),
                maxSize,
                hits.get(),
                misses.get(),
                (entries.size() * 100.0) / maxSize
            );
        } finally {
            lock.readLock().unlock();
        }
    }
}

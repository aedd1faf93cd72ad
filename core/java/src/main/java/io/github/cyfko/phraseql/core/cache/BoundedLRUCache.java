package io.github.cyfko.phraseql.core.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * A bounded LRU (Least Recently Used) cache of compiled formulas.
 * <p>
 * Entries are kept in an access-ordered {@link LinkedHashMap}; once the cache holds more than
 * {@code maxSize} entries the least recently used one is evicted.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Guarded by a {@link ReadWriteLock}. Lookups reorder entries, so they take the write lock;
 * size queries and statistics only need the read lock.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * BoundedLRUCache<String, CompileResult> cache = new BoundedLRUCache<>(256);
 * CompileResult result = cache.computeIfAbsent(key, k -> compileUncached(text));
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @since 1.0
 */
public class BoundedLRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> entries;
    private final ReadWriteLock lock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
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
     * Stores a value, evicting the least recently used entry when the cache is full.
     */
    public void put(K key, V value) {
        lock.writeLock().lock();
        try {
            entries.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the cached value, computing and storing it first if absent.
     * <p>
     * The mapping function runs under the write lock, so concurrent callers asking for the same
     * key compute it only once. Null results are returned but not cached.
     * </p>
     */
    public V computeIfAbsent(K key, Function<K, V> mappingFunction) {
        lock.writeLock().lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                hits.incrementAndGet();
                return value;
            }
            misses.incrementAndGet();
            value = mappingFunction.apply(key);
            if (value != null) {
                entries.put(key, value);
            }
            return value;
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

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Checks presence without counting as an access.
     */
    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
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

    public String getStats() {
        lock.readLock().lock();
        try {
            return String.format("BoundedLRUCache[size=%d, maxSize=%d, hits=%d, misses=%d]",
                entries.size(), maxSize, hits.get(), misses.get());
        } finally {
            lock.readLock().unlock();
        }
    }
}

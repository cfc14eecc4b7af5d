package com.phillippitts.openmusic.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One cache class: a TTL-bounded, entry-capped map that shares a memory ceiling with the
 * other regions.
 *
 * <p>Concurrency: reads are lock-free; an expired entry found by a reader is removed with a
 * conditional remove so concurrent readers release its memory exactly once. Insertions and
 * evictions take the region lock, which keeps capacity decisions consistent without blocking
 * readers or other regions.
 *
 * <p>Eviction order is always TTL first, then recency. Insertion order alone never decides.
 *
 * @param <T> cached value type
 */
public final class CacheRegion<T> {

    private static final Logger LOG = LogManager.getLogger(CacheRegion.class);

    private final CacheClass cacheClass;
    private final Duration ttl;
    private final int maxEntries;
    private final MemoryAccount memory;
    private final SizeEstimator<T> sizeEstimator;
    private final Clock clock;

    private final Map<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Lock writeLock = new ReentrantLock();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    CacheRegion(CacheClass cacheClass, Duration ttl, int maxEntries, MemoryAccount memory,
                SizeEstimator<T> sizeEstimator, Clock clock) {
        this.cacheClass = Objects.requireNonNull(cacheClass, "cacheClass");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.memory = Objects.requireNonNull(memory, "memory");
        this.sizeEstimator = Objects.requireNonNull(sizeEstimator, "sizeEstimator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the cached value, or empty when absent or older than the region TTL (the expired
     * entry is removed).
     */
    public Optional<T> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isExpired(now, ttl)) {
            if (removeIfSame(key, entry)) {
                expirations.incrementAndGet();
            }
            misses.incrementAndGet();
            return Optional.empty();
        }
        entry.recordAccess(now, sequence.incrementAndGet());
        hits.incrementAndGet();
        return Optional.of(entry.getValue());
    }

    /**
     * Inserts or replaces a value, evicting entries of this region (expired ones first, then
     * least recently used) until both the entry cap and the shared memory ceiling admit it.
     *
     * @return false when the value could not be cached (the caller simply carries on uncached)
     */
    public boolean put(String key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long size = sizeEstimator.estimate(key, value);

        writeLock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry<T> previous = entries.remove(key);
            if (previous != null) {
                memory.release(previous.getEstimatedSize());
            }
            while (entries.size() >= maxEntries) {
                if (!evictOneLocked(now)) {
                    break;
                }
            }
            reserveEvictingLocked(size, now);
            entries.put(key, new CacheEntry<>(value, now, size, sequence.incrementAndGet()));
            return true;
        } catch (CacheCapacityExceededException e) {
            rejected.incrementAndGet();
            LOG.debug("Cache region '{}' skipped key of {}B: {}", cacheClass.tag(), size, e.getMessage());
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    private void reserveEvictingLocked(long size, Instant now) {
        while (true) {
            try {
                memory.reserve(size);
                return;
            } catch (CacheCapacityExceededException e) {
                // Only this region's entries may be evicted to make room
                if (!evictOneLocked(now)) {
                    throw e;
                }
            }
        }
    }

    /** Removes one entry: an expired one if any, otherwise the least recently used. */
    private boolean evictOneLocked(Instant now) {
        Map.Entry<String, CacheEntry<T>> victim = null;
        for (Map.Entry<String, CacheEntry<T>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now, ttl)) {
                if (removeIfSame(e.getKey(), e.getValue())) {
                    expirations.incrementAndGet();
                }
                return true;
            }
            if (victim == null || e.getValue().getAccessSequence() < victim.getValue().getAccessSequence()) {
                victim = e;
            }
        }
        if (victim == null) {
            return false;
        }
        if (removeIfSame(victim.getKey(), victim.getValue())) {
            evictions.incrementAndGet();
        }
        return true;
    }

    public void invalidate(String key) {
        if (key == null) {
            return;
        }
        CacheEntry<T> removed = entries.remove(key);
        if (removed != null) {
            memory.release(removed.getEstimatedSize());
        }
    }

    /**
     * Removes every entry older than the TTL.
     *
     * @return number of entries removed
     */
    public int removeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<T>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now, ttl) && removeIfSame(e.getKey(), e.getValue())) {
                expirations.incrementAndGet();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Evicts {@code count} entries, expired ones first, then least recently used.
     *
     * @return number of entries actually evicted
     */
    int evict(int count) {
        if (count <= 0) {
            return 0;
        }
        Instant now = clock.instant();
        writeLock.lock();
        try {
            List<Map.Entry<String, CacheEntry<T>>> ordered = new ArrayList<>(entries.entrySet());
            ordered.sort(Comparator
                    .comparing((Map.Entry<String, CacheEntry<T>> e) -> !e.getValue().isExpired(now, ttl))
                    .thenComparingLong(e -> e.getValue().getAccessSequence()));
            int evicted = 0;
            for (Map.Entry<String, CacheEntry<T>> e : ordered) {
                if (evicted >= count) {
                    break;
                }
                if (removeIfSame(e.getKey(), e.getValue())) {
                    evictions.incrementAndGet();
                    evicted++;
                }
            }
            return evicted;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Evicts a specific entry if it is still the one mapped to {@code key}.
     */
    boolean evictEntry(String key, CacheEntry<T> expected) {
        writeLock.lock();
        try {
            if (removeIfSame(key, expected)) {
                evictions.incrementAndGet();
                return true;
            }
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    /** Point-in-time copy of the entries, for cross-region eviction decisions. */
    Map<String, CacheEntry<T>> snapshot() {
        return Map.copyOf(entries);
    }

    public void clear() {
        writeLock.lock();
        try {
            for (Map.Entry<String, CacheEntry<T>> e : entries.entrySet()) {
                removeIfSame(e.getKey(), e.getValue());
            }
        } finally {
            writeLock.unlock();
        }
    }

    private boolean removeIfSame(String key, CacheEntry<T> entry) {
        if (entries.remove(key, entry)) {
            memory.release(entry.getEstimatedSize());
            return true;
        }
        return false;
    }

    public CacheClass getCacheClass() {
        return cacheClass;
    }

    public Duration getTtl() {
        return ttl;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public int size() {
        return entries.size();
    }

    public long memoryBytes() {
        long total = 0;
        for (CacheEntry<T> entry : entries.values()) {
            total += entry.getEstimatedSize();
        }
        return total;
    }

    RegionStatistics statistics() {
        return new RegionStatistics(cacheClass, entries.size(), maxEntries, memoryBytes(),
                hits.get(), misses.get(), evictions.get(), expirations.get(), rejected.get());
    }

    long hitCount() {
        return hits.get();
    }

    long missCount() {
        return misses.get();
    }

    long evictionCount() {
        return evictions.get();
    }
}

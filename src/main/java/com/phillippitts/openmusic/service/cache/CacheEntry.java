package com.phillippitts.openmusic.service.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One cached value plus the bookkeeping eviction decisions are based on.
 *
 * <p>The value and creation time are fixed; access statistics are updated without locking
 * by concurrent readers.
 *
 * @param <T> cached value type
 */
public final class CacheEntry<T> {

    private final T value;
    private final Instant createdAt;
    private final long estimatedSize;
    private final AtomicLong accessCount = new AtomicLong();
    private volatile Instant lastAccessed;
    private volatile long accessSequence;

    CacheEntry(T value, Instant createdAt, long estimatedSize, long sequence) {
        this.value = value;
        this.createdAt = createdAt;
        this.estimatedSize = estimatedSize;
        this.lastAccessed = createdAt;
        this.accessSequence = sequence;
    }

    public T getValue() {
        return value;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessed() {
        return lastAccessed;
    }

    public long getAccessCount() {
        return accessCount.get();
    }

    public long getEstimatedSize() {
        return estimatedSize;
    }

    /** Monotonic recency marker; a higher value means more recently touched. */
    long getAccessSequence() {
        return accessSequence;
    }

    void recordAccess(Instant now, long sequence) {
        accessCount.incrementAndGet();
        lastAccessed = now;
        accessSequence = sequence;
    }

    boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}

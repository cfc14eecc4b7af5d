package com.phillippitts.openmusic.service.cache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Aggregate memory accounting shared by all cache regions.
 */
final class MemoryAccount {

    private final long ceilingBytes;
    private final AtomicLong usedBytes = new AtomicLong();
    private final AtomicLong peakBytes = new AtomicLong();

    MemoryAccount(long ceilingBytes) {
        if (ceilingBytes <= 0) {
            throw new IllegalArgumentException("ceilingBytes must be positive: " + ceilingBytes);
        }
        this.ceilingBytes = ceilingBytes;
    }

    /**
     * Reserves {@code bytes} if they fit under the ceiling.
     *
     * @throws CacheCapacityExceededException when the reservation does not fit
     */
    void reserve(long bytes) {
        while (true) {
            long current = usedBytes.get();
            long next = current + bytes;
            if (next > ceilingBytes) {
                throw new CacheCapacityExceededException(bytes, ceilingBytes - current);
            }
            if (usedBytes.compareAndSet(current, next)) {
                peakBytes.accumulateAndGet(next, Math::max);
                return;
            }
        }
    }

    void release(long bytes) {
        usedBytes.addAndGet(-bytes);
    }

    long used() {
        return usedBytes.get();
    }

    long peak() {
        return peakBytes.get();
    }

    long ceiling() {
        return ceilingBytes;
    }
}

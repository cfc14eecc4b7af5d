package com.phillippitts.openmusic.service.cache;

import com.phillippitts.openmusic.exception.OpenMusicException;

/**
 * Raised inside the cache when an insertion cannot fit under the shared memory ceiling.
 * Always caught by {@link CacheRegion#put}; never seen by cache callers.
 */
class CacheCapacityExceededException extends OpenMusicException {

    private final long requestedBytes;
    private final long availableBytes;

    CacheCapacityExceededException(long requestedBytes, long availableBytes) {
        super("Cache memory ceiling exceeded: requested=" + requestedBytes + "B, available=" + availableBytes + "B");
        this.requestedBytes = requestedBytes;
        this.availableBytes = availableBytes;
    }

    long getRequestedBytes() {
        return requestedBytes;
    }

    long getAvailableBytes() {
        return availableBytes;
    }
}

package com.phillippitts.openmusic.service.cache;

/**
 * Source of memory-pressure observations for the cache optimization pass.
 */
public interface MemoryPressureMonitor {

    /** Current classification; implementations may serve a recently sampled value. */
    MemoryPressure currentPressure();
}

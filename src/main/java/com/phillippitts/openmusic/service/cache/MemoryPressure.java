package com.phillippitts.openmusic.service.cache;

/**
 * Graduated classification of memory usage driving how aggressively the cache evicts.
 */
public enum MemoryPressure {
    /** No action. */
    LOW,
    /** Evict a handful of the least frequently used entries. */
    MEDIUM,
    /** Evict 25% of all entries, proportionally per region. */
    HIGH,
    /** Evict 50% of all entries, proportionally per region. */
    CRITICAL;

    /**
     * Classifies a used-memory ratio against ascending thresholds. A ratio equal to a
     * threshold stays in the lower band.
     */
    public static MemoryPressure classify(double ratio, double medium, double high, double critical) {
        if (ratio > critical) {
            return CRITICAL;
        }
        if (ratio > high) {
            return HIGH;
        }
        if (ratio > medium) {
            return MEDIUM;
        }
        return LOW;
    }

    /** Share of all entries evicted proportionally, or 0 when the response is not proportional. */
    public int evictionPercent() {
        return switch (this) {
            case HIGH -> 25;
            case CRITICAL -> 50;
            case LOW, MEDIUM -> 0;
        };
    }
}

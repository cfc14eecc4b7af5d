package com.phillippitts.openmusic.service.cache;

/**
 * Counters for one cache region.
 */
public record RegionStatistics(
        CacheClass cacheClass,
        int entries,
        int maxEntries,
        long memoryBytes,
        long hits,
        long misses,
        long evictions,
        long expirations,
        long rejected
) {
    public double hitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}

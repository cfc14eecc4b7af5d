package com.phillippitts.openmusic.service.cache;

import java.util.List;

/**
 * Aggregate view over all regions plus the shared memory account.
 *
 * @param regions per-region counters, in {@link CacheClass} order
 * @param memoryUsedBytes bytes currently reserved across regions
 * @param memoryPeakBytes highest reservation observed since startup
 * @param memoryCeilingBytes configured ceiling
 * @param pressure last memory-pressure classification
 */
public record CacheStatistics(
        List<RegionStatistics> regions,
        long memoryUsedBytes,
        long memoryPeakBytes,
        long memoryCeilingBytes,
        MemoryPressure pressure
) {
    public CacheStatistics {
        regions = List.copyOf(regions);
    }

    public int totalEntries() {
        return regions.stream().mapToInt(RegionStatistics::entries).sum();
    }

    public long totalHits() {
        return regions.stream().mapToLong(RegionStatistics::hits).sum();
    }

    public long totalMisses() {
        return regions.stream().mapToLong(RegionStatistics::misses).sum();
    }

    public long totalEvictions() {
        return regions.stream().mapToLong(RegionStatistics::evictions).sum();
    }

    public double hitRatio() {
        long total = totalHits() + totalMisses();
        return total == 0 ? 0.0 : (double) totalHits() / total;
    }
}

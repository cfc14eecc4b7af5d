package com.phillippitts.openmusic.service.cache;

import com.phillippitts.openmusic.config.properties.CacheProperties;
import com.phillippitts.openmusic.domain.Item;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Memoization layer in front of the backend adapters, split into three regions sharing one
 * memory ceiling.
 *
 * <p>The cache is best-effort: no method throws because of capacity, and a value that cannot
 * be stored simply degrades to a miss on the next lookup.
 *
 * <p>Metrics: {@code openmusic.cache.entries} and {@code openmusic.cache.memory.bytes} gauges
 * and {@code openmusic.cache.hits|misses|evictions} counters, each tagged with the region.
 */
@Component
public class AdaptiveCache implements MeterBinder {

    private static final Logger LOG = LogManager.getLogger(AdaptiveCache.class);
    private static final String METRIC_PREFIX = "openmusic.cache";

    private final MemoryAccount memory;
    private final CacheRegion<String> streamUrls;
    private final CacheRegion<Item> metadata;
    private final CacheRegion<CachedSearch> searchResults;
    private final MemoryPressureMonitor pressureMonitor;
    private final int mediumEvictionCount;

    private volatile MemoryPressure lastPressure = MemoryPressure.LOW;

    public AdaptiveCache(CacheProperties properties, MemoryPressureMonitor pressureMonitor, Clock clock) {
        this.memory = new MemoryAccount(properties.getMaxMemoryBytes());
        this.streamUrls = new CacheRegion<>(CacheClass.STREAM_URL, properties.getStream().getTtl(),
                properties.getStream().getMaxEntries(), memory, SizeEstimator.forStrings(), clock);
        this.metadata = new CacheRegion<>(CacheClass.METADATA, properties.getMetadata().getTtl(),
                properties.getMetadata().getMaxEntries(), memory, SizeEstimator.forItems(), clock);
        this.searchResults = new CacheRegion<>(CacheClass.SEARCH_RESULTS, properties.getSearch().getTtl(),
                properties.getSearch().getMaxEntries(), memory, SizeEstimator.forSearches(), clock);
        this.pressureMonitor = pressureMonitor;
        this.mediumEvictionCount = properties.getPressure().getMediumEvictionCount();
        LOG.info("Adaptive cache ready: ceiling={}MB, stream={}/{}, metadata={}/{}, search={}/{}",
                properties.getMaxMemoryMb(),
                properties.getStream().getMaxEntries(), properties.getStream().getTtl(),
                properties.getMetadata().getMaxEntries(), properties.getMetadata().getTtl(),
                properties.getSearch().getMaxEntries(), properties.getSearch().getTtl());
    }

    /** Stream URLs keyed by the item's canonical URL. */
    public CacheRegion<String> streamUrls() {
        return streamUrls;
    }

    /** Item metadata keyed by canonical URL. */
    public CacheRegion<Item> metadata() {
        return metadata;
    }

    /** Ranked search results keyed by normalized query. */
    public CacheRegion<CachedSearch> searchResults() {
        return searchResults;
    }

    private List<CacheRegion<?>> regions() {
        return List.of(streamUrls, metadata, searchResults);
    }

    /**
     * Removes TTL-expired entries from every region.
     *
     * @return number of entries removed
     */
    public int cleanupExpired() {
        int removed = 0;
        for (CacheRegion<?> region : regions()) {
            removed += region.removeExpired();
        }
        if (removed > 0) {
            LOG.debug("Cache cleanup removed {} expired entries", removed);
        }
        return removed;
    }

    /**
     * Background optimization pass: TTL cleanup, then a graduated response to memory pressure.
     */
    public OptimizationReport optimize() {
        int expired = cleanupExpired();
        MemoryPressure pressure = pressureMonitor.currentPressure();
        lastPressure = pressure;
        int evicted = switch (pressure) {
            case LOW -> 0;
            case MEDIUM -> evictLeastFrequentlyUsed(mediumEvictionCount);
            case HIGH, CRITICAL -> evictPercentage(pressure.evictionPercent());
        };
        if (evicted > 0) {
            LOG.info("Cache optimization under {} pressure: expired={}, evicted={}, remaining={}",
                    pressure, expired, evicted, totalEntries());
        }
        return new OptimizationReport(pressure, expired, evicted);
    }

    /**
     * Evicts {@code percent}% of every region's current entries (rounded down per region), so
     * the total reduction is proportional to each region's size.
     *
     * @return number of entries evicted
     */
    public int evictPercentage(int percent) {
        if (percent <= 0) {
            return 0;
        }
        int capped = Math.min(percent, 100);
        int evicted = 0;
        for (CacheRegion<?> region : regions()) {
            int target = region.size() * capped / 100;
            evicted += region.evict(target);
        }
        return evicted;
    }

    /**
     * Evicts the {@code count} least frequently accessed entries across all regions; ties go to
     * the entry touched longest ago.
     *
     * @return number of entries evicted
     */
    public int evictLeastFrequentlyUsed(int count) {
        if (count <= 0) {
            return 0;
        }
        List<Candidate<?>> candidates = new ArrayList<>();
        collect(streamUrls, candidates);
        collect(metadata, candidates);
        collect(searchResults, candidates);
        candidates.sort(Comparator
                .comparingLong((Candidate<?> c) -> c.entry().getAccessCount())
                .thenComparing(c -> c.entry().getLastAccessed()));

        int evicted = 0;
        for (Candidate<?> candidate : candidates) {
            if (evicted >= count) {
                break;
            }
            if (candidate.evict()) {
                evicted++;
            }
        }
        return evicted;
    }

    private static <T> void collect(CacheRegion<T> region, List<Candidate<?>> out) {
        for (Map.Entry<String, CacheEntry<T>> e : region.snapshot().entrySet()) {
            out.add(new Candidate<>(region, e.getKey(), e.getValue()));
        }
    }

    private record Candidate<T>(CacheRegion<T> region, String key, CacheEntry<T> entry) {
        boolean evict() {
            return region.evictEntry(key, entry);
        }
    }

    public void clear() {
        regions().forEach(CacheRegion::clear);
    }

    public int totalEntries() {
        int total = 0;
        for (CacheRegion<?> region : regions()) {
            total += region.size();
        }
        return total;
    }

    public CacheStatistics statistics() {
        return new CacheStatistics(
                List.of(streamUrls.statistics(), metadata.statistics(), searchResults.statistics()),
                memory.used(), memory.peak(), memory.ceiling(), lastPressure);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        for (CacheRegion<?> region : regions()) {
            String tag = region.getCacheClass().tag();
            Gauge.builder(METRIC_PREFIX + ".entries", region, CacheRegion::size)
                    .description("Entries currently cached")
                    .tag("region", tag)
                    .register(registry);
            Gauge.builder(METRIC_PREFIX + ".memory.bytes", region, CacheRegion::memoryBytes)
                    .description("Estimated bytes held by cached entries")
                    .tag("region", tag)
                    .baseUnit("bytes")
                    .register(registry);
            FunctionCounter.builder(METRIC_PREFIX + ".hits", region, r -> r.hitCount())
                    .tag("region", tag)
                    .register(registry);
            FunctionCounter.builder(METRIC_PREFIX + ".misses", region, r -> r.missCount())
                    .tag("region", tag)
                    .register(registry);
            FunctionCounter.builder(METRIC_PREFIX + ".evictions", region, r -> r.evictionCount())
                    .tag("region", tag)
                    .register(registry);
        }
    }
}

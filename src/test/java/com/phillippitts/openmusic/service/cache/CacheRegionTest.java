package com.phillippitts.openmusic.service.cache;

import com.phillippitts.openmusic.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CacheRegionTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private MutableClock clock;
    private MemoryAccount memory;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        memory = new MemoryAccount(1_000_000);
    }

    private CacheRegion<String> region(int maxEntries) {
        return new CacheRegion<>(CacheClass.STREAM_URL, TTL, maxEntries, memory, SizeEstimator.forStrings(), clock);
    }

    @Test
    void evictsLeastRecentlyUsedAtCapacity() {
        CacheRegion<String> region = region(2);
        region.put("A", "a");
        region.put("B", "b");
        region.get("A");
        region.get("B");

        region.put("C", "c");

        assertThat(region.get("A")).isEmpty();
        assertThat(region.get("B")).contains("b");
        assertThat(region.get("C")).contains("c");
        assertThat(region.size()).isEqualTo(2);
        assertThat(region.statistics().evictions()).isEqualTo(1);
    }

    @Test
    void recencyNotInsertionOrderDecidesVictim() {
        CacheRegion<String> region = region(2);
        region.put("A", "a");
        region.put("B", "b");
        region.get("A");

        region.put("C", "c");

        assertThat(region.get("B")).isEmpty();
        assertThat(region.get("A")).contains("a");
    }

    @Test
    void expiredEntryIsEvictedBeforeRecentlyUsedFreshOne() {
        CacheRegion<String> region = region(2);
        region.put("A", "a");
        clock.advance(Duration.ofMinutes(8));
        region.put("B", "b");
        clock.advance(Duration.ofMinutes(1));
        region.get("A");
        clock.advance(Duration.ofMinutes(3));

        region.put("C", "c");

        assertThat(region.snapshot()).containsOnlyKeys("B", "C");
        assertThat(region.statistics().expirations()).isEqualTo(1);
        assertThat(region.statistics().evictions()).isZero();
    }

    @Test
    void replacingKeyDoesNotEvict() {
        CacheRegion<String> region = region(2);
        region.put("A", "a");
        region.put("B", "b");
        region.put("A", "a2");

        assertThat(region.get("A")).contains("a2");
        assertThat(region.get("B")).contains("b");
        assertThat(memory.used()).isEqualTo(region.memoryBytes());
    }

    @Test
    void expiresAfterTtl() {
        CacheRegion<String> region = region(10);
        region.put("A", "a");

        clock.advance(TTL);
        assertThat(region.get("A")).contains("a");

        clock.advance(Duration.ofSeconds(1));
        assertThat(region.get("A")).isEmpty();
        assertThat(region.size()).isZero();
        assertThat(memory.used()).isZero();
        assertThat(region.statistics().expirations()).isEqualTo(1);
    }

    @Test
    void removeExpiredOnlyDropsStaleEntries() {
        CacheRegion<String> region = region(10);
        region.put("old", "1");
        clock.advance(TTL.plusSeconds(1));
        region.put("fresh", "2");

        assertThat(region.removeExpired()).isEqualTo(1);
        assertThat(region.get("fresh")).contains("2");
    }

    @Test
    void evictPrefersExpiredThenLeastRecent() {
        CacheRegion<String> region = region(10);
        region.put("stale", "s");
        clock.advance(TTL.plusSeconds(1));
        region.put("x", "x");
        region.put("y", "y");
        region.get("x");

        assertThat(region.evict(2)).isEqualTo(2);

        assertThat(region.snapshot()).containsOnlyKeys("x");
    }

    @Test
    void evictsWithinRegionToStayUnderMemoryCeiling() {
        // Each "kN" -> "v" entry estimates to 182 bytes; two fit under 400
        memory = new MemoryAccount(400);
        CacheRegion<String> region = region(10);

        assertThat(region.put("k1", "v")).isTrue();
        assertThat(region.put("k2", "v")).isTrue();
        assertThat(region.put("k3", "v")).isTrue();

        assertThat(region.size()).isEqualTo(2);
        assertThat(region.get("k1")).isEmpty();
        assertThat(memory.used()).isLessThanOrEqualTo(400);
    }

    @Test
    void valueLargerThanCeilingIsSkipped() {
        memory = new MemoryAccount(400);
        CacheRegion<String> region = region(10);

        assertThat(region.put("huge", "x".repeat(1000))).isFalse();

        assertThat(region.get("huge")).isEmpty();
        assertThat(region.statistics().rejected()).isEqualTo(1);
        assertThat(memory.used()).isZero();
    }

    @Test
    void neverEvictsFromAnotherRegion() {
        memory = new MemoryAccount(400);
        CacheRegion<String> streams = region(10);
        CacheRegion<String> other = new CacheRegion<>(CacheClass.METADATA, TTL, 10, memory,
                SizeEstimator.forStrings(), clock);
        streams.put("k1", "v");
        streams.put("k2", "v");

        assertThat(other.put("k3", "v")).isFalse();
        assertThat(streams.size()).isEqualTo(2);
    }

    @Test
    void clearReleasesMemory() {
        CacheRegion<String> region = region(10);
        region.put("A", "a");
        region.put("B", "b");

        region.clear();

        assertThat(region.size()).isZero();
        assertThat(memory.used()).isZero();
        assertThat(memory.peak()).isPositive();
    }

    @Test
    void tracksHitsAndMisses() {
        CacheRegion<String> region = region(10);
        region.put("A", "a");
        region.get("A");
        region.get("A");
        region.get("missing");

        RegionStatistics stats = region.statistics();
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRatio()).isEqualTo(2.0 / 3.0);
    }
}

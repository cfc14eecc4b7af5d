package com.phillippitts.openmusic.service.resolver;

import com.phillippitts.openmusic.domain.Item;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders one backend's results: titles containing the query first, then by how close the
 * duration is to a typical track (1 to 10 minutes). The sort is stable, so backend order
 * decides among equal scores.
 */
public final class ResultRanker {

    static final Duration TYPICAL_MIN = Duration.ofMinutes(1);
    static final Duration TYPICAL_MAX = Duration.ofMinutes(10);

    /** Score of an item whose duration is unknown: below any typical track. */
    static final double UNKNOWN_DURATION_SCORE = 0.5;

    /** Width of the log-normal fall-off outside the typical band. */
    private static final double SIGMA = 0.6;

    private ResultRanker() {}

    public static List<Item> rank(List<Item> items, String query) {
        if (items.size() < 2) {
            return List.copyOf(items);
        }
        String needle = QueryNormalizer.cacheKey(query);
        List<Item> ranked = new ArrayList<>(items);
        ranked.sort(Comparator
                .comparing((Item item) -> !matches(item, needle))
                .thenComparing(Comparator.comparingDouble(ResultRanker::durationScore).reversed()));
        return List.copyOf(ranked);
    }

    static boolean matches(Item item, String normalizedQuery) {
        if (normalizedQuery.isEmpty()) {
            return false;
        }
        return QueryNormalizer.cacheKey(item.title()).contains(normalizedQuery)
                || item.title().toLowerCase(Locale.ROOT).contains(normalizedQuery);
    }

    /**
     * 1.0 inside the typical band, decaying smoothly with the log-distance to the nearest band
     * edge outside it; {@link #UNKNOWN_DURATION_SCORE} when unknown.
     */
    static double durationScore(Item item) {
        Duration d = item.duration();
        if (d == null) {
            return UNKNOWN_DURATION_SCORE;
        }
        double seconds = Math.max(1, d.toMillis() / 1000.0);
        double min = TYPICAL_MIN.getSeconds();
        double max = TYPICAL_MAX.getSeconds();
        if (seconds >= min && seconds <= max) {
            return 1.0;
        }
        double distance = seconds < min ? Math.log(min / seconds) : Math.log(seconds / max);
        return Math.exp(-(distance * distance) / (2 * SIGMA * SIGMA));
    }
}

package com.phillippitts.openmusic.service.cache;

import com.phillippitts.openmusic.domain.Item;

/**
 * Rough in-memory size of a cached value, in bytes.
 *
 * @param <T> value type
 */
@FunctionalInterface
public interface SizeEstimator<T> {

    /** Fixed per-entry overhead: map node, entry object and key reference. */
    long ENTRY_OVERHEAD = 96;

    long estimate(String key, T value);

    static SizeEstimator<String> forStrings() {
        return (key, value) -> ENTRY_OVERHEAD + chars(key) + chars(value);
    }

    static SizeEstimator<Item> forItems() {
        return (key, value) -> ENTRY_OVERHEAD + chars(key) + item(value);
    }

    static SizeEstimator<CachedSearch> forSearches() {
        return (key, value) -> {
            long size = ENTRY_OVERHEAD + chars(key) + 32L + 8L * value.items().size();
            for (Item item : value.items()) {
                size += item(item);
            }
            return size;
        };
    }

    private static long item(Item item) {
        return 64 + chars(item.title()) + chars(item.artist()) + chars(item.thumbnail())
                + chars(item.canonicalUrl()) + chars(item.requestedBy())
                + (item.duration() != null ? 24 : 0);
    }

    private static long chars(String s) {
        // String header plus two bytes per char (upper bound for non-Latin-1 text)
        return s == null ? 0 : 40 + 2L * s.length();
    }
}

package com.phillippitts.openmusic.service.cache;

import com.phillippitts.openmusic.domain.Item;

import java.util.List;

/**
 * Ranked search results together with the limit they were fetched under.
 *
 * @param items ranked results, never more than {@code fetchLimit}
 * @param fetchLimit result count the backends were asked for
 */
public record CachedSearch(List<Item> items, int fetchLimit) {

    public CachedSearch {
        items = List.copyOf(items);
    }

    /**
     * True when this entry can answer a request for {@code limit} results: either it holds that
     * many, or the backends already returned fewer than a request at least as large asked for.
     */
    public boolean satisfies(int limit) {
        return !items.isEmpty() && (items.size() >= limit || fetchLimit >= limit);
    }
}

package com.phillippitts.openmusic.service.cache;

/**
 * The three independently configured cache regions.
 */
public enum CacheClass {
    /** Playable stream URL keyed by the item's canonical URL. */
    STREAM_URL("stream"),
    /** Item metadata keyed by canonical URL (track id). */
    METADATA("metadata"),
    /** Ranked result lists keyed by normalized query. */
    SEARCH_RESULTS("search");

    private final String tag;

    CacheClass(String tag) {
        this.tag = tag;
    }

    /** Short name used in metric tags and log lines. */
    public String tag() {
        return tag;
    }
}

package com.phillippitts.openmusic.domain;

/**
 * Closed set of backend families an {@link Item} can originate from.
 *
 * <p>Each configured backend names one of these kinds; the resolver selects the adapter for a
 * backend by kind rather than by its display name.
 */
public enum SourceKind {
    /** Local media-extraction subprocess (yt-dlp). */
    PRIMARY_EXTRACTOR,
    /** Official public search API (YouTube Data API v3). */
    PUBLIC_API,
    /** Community mirror instances exposing an Invidious-compatible API. */
    MIRROR,
    /** Scraped search-results page and channel RSS feeds. */
    FEED,
    /** Plain http(s) link to an audio file. */
    DIRECT_URL
}

package com.phillippitts.openmusic.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable reference to a resolved media item.
 *
 * <p>Playback failures never mutate an item; queue-side bookkeeping is keyed by
 * {@link #canonicalUrl()} instead.
 *
 * @param title display title (never blank)
 * @param artist uploader or artist name, may be null
 * @param duration playing time, null when unknown or live
 * @param thumbnail thumbnail URL, may be null
 * @param canonicalUrl stable URL identifying the item across backends
 * @param sourceKind backend family that produced the item
 * @param requestedBy opaque identity of the requester, null until the item is requested
 */
public record Item(
        String title,
        String artist,
        Duration duration,
        String thumbnail,
        String canonicalUrl,
        SourceKind sourceKind,
        String requestedBy
) {

    public Item {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (canonicalUrl == null || canonicalUrl.isBlank()) {
            throw new IllegalArgumentException("canonicalUrl must not be blank");
        }
        Objects.requireNonNull(sourceKind, "sourceKind");
        if (duration != null && (duration.isNegative() || duration.isZero())) {
            duration = null;
        }
    }

    /**
     * Factory for an item that has not been requested by anyone yet.
     */
    public static Item of(String title, String artist, Duration duration, String thumbnail,
                          String canonicalUrl, SourceKind sourceKind) {
        return new Item(title, artist, duration, thumbnail, canonicalUrl, sourceKind, null);
    }

    /**
     * Returns a copy attributed to the given requester.
     */
    public Item withRequestedBy(String requester) {
        return new Item(title, artist, duration, thumbnail, canonicalUrl, sourceKind, requester);
    }

    public boolean hasDuration() {
        return duration != null;
    }
}

package com.phillippitts.openmusic.service.source;

import com.phillippitts.openmusic.domain.Item;
import com.phillippitts.openmusic.domain.SourceKind;

import java.util.List;
import java.util.Optional;

/**
 * Uniform capability interface over one external data source.
 *
 * <p>Implementations are stateless with respect to playback sessions and may be called
 * concurrently. Every failure must surface as a
 * {@link com.phillippitts.openmusic.exception.BackendException} subclass; the resolver treats
 * anything else as an unavailable backend.
 */
public interface SourceAdapter {

    /**
     * Free-text search.
     *
     * @param query user query, already trimmed
     * @param limit maximum number of items wanted (at least 1)
     * @return matching items in backend order, empty when nothing matched
     */
    List<Item> search(String query, int limit);

    /**
     * Resolves a URL this adapter claims (see {@link #isValidUrl(String)}) to a single item.
     *
     * @return the item, or empty when the backend knows no such media
     */
    Optional<Item> resolve(String url);

    /** True when this adapter can resolve the given URL directly. */
    boolean isValidUrl(String url);

    /** Display name for logs and diagnostics. */
    String name();

    SourceKind kind();

    default boolean supportsSearch() {
        return true;
    }

    default boolean supportsDirectResolution() {
        return true;
    }
}

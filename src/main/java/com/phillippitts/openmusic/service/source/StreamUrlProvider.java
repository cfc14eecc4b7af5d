package com.phillippitts.openmusic.service.source;

import com.phillippitts.openmusic.domain.Item;

import java.util.Optional;

/**
 * Optional adapter capability: turn an item into a URL the playback collaborator can stream.
 */
public interface StreamUrlProvider {

    /**
     * @return playable stream URL, or empty when this backend cannot produce one for the item
     */
    Optional<String> streamUrl(Item item);
}

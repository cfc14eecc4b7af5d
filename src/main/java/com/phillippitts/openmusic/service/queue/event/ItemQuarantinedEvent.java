package com.phillippitts.openmusic.service.queue.event;

import java.time.Instant;

/**
 * Emitted when an item reaches the retry limit and is moved to the failed list.
 *
 * @param sessionId playback context owning the queue
 * @param url canonical URL of the quarantined item
 * @param title display title, or the URL when the item is not held by the queue
 * @param failureCount retry counter at quarantine time
 * @param timestamp when the item was quarantined
 */
public record ItemQuarantinedEvent(
        String sessionId,
        String url,
        String title,
        int failureCount,
        Instant timestamp
) {}

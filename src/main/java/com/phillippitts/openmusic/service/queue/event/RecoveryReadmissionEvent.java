package com.phillippitts.openmusic.service.queue.event;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when quarantined items are given another attempt.
 *
 * @param sessionId playback context owning the queue
 * @param urls canonical URLs re-admitted, in queue order
 * @param timestamp when the batch was re-admitted
 */
public record RecoveryReadmissionEvent(
        String sessionId,
        List<String> urls,
        Instant timestamp
) {
    public RecoveryReadmissionEvent {
        urls = List.copyOf(urls);
    }
}

package com.phillippitts.openmusic.service.queue.event;

import java.time.Instant;

/**
 * Emitted when a queue enters or leaves recovery mode.
 *
 * @param sessionId playback context owning the queue
 * @param active new recovery-mode flag
 * @param consecutiveFailures consecutive failure count at the time of the change
 * @param timestamp when the change happened
 */
public record RecoveryModeChangedEvent(
        String sessionId,
        boolean active,
        int consecutiveFailures,
        Instant timestamp
) {}

package com.phillippitts.openmusic.service.queue;

/**
 * Failure bookkeeping of one queue.
 *
 * @param pending items waiting to be played
 * @param failed items in the failed (quarantine) list
 * @param trackedUrls URLs with a non-zero retry counter
 * @param totalFailures sum of all retry counters
 * @param consecutiveFailures failures reported since the last success
 * @param recoveryMode whether recovery mode is active
 */
public record QueueStats(
        int pending,
        int failed,
        int trackedUrls,
        int totalFailures,
        int consecutiveFailures,
        boolean recoveryMode
) {}

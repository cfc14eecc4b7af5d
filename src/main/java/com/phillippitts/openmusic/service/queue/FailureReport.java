package com.phillippitts.openmusic.service.queue;

/**
 * Outcome of {@link ResilientQueue#reportFailure(String, String)}.
 *
 * @param url canonical URL that failed
 * @param failureCount retry counter after this failure
 * @param quarantined true once the counter reached the retry limit
 * @param recoveryMode recovery-mode flag after this failure
 */
public record FailureReport(String url, int failureCount, boolean quarantined, boolean recoveryMode) {
}

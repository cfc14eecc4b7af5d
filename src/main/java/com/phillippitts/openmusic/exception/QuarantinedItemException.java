package com.phillippitts.openmusic.exception;

/**
 * Thrown when an item is enqueued after exhausting its playback retries and the recovery
 * cooldown does not yet admit it again.
 */
public class QuarantinedItemException extends OpenMusicException {

    private final String url;
    private final int failureCount;

    public QuarantinedItemException(String url, int failureCount) {
        super("Item is quarantined after " + failureCount + " failures: " + url);
        this.url = url;
        this.failureCount = failureCount;
    }

    public String getUrl() {
        return url;
    }

    public int getFailureCount() {
        return failureCount;
    }
}

package com.phillippitts.openmusic.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and stream-drain thread management.
 *
 * <p>Used by {@link com.phillippitts.openmusic.service.source.extractor.ExtractorProcessManager}
 * around every extractor invocation.
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     *
     * <p>Extractor JSON for a handful of search results stays well below 1MB, which drains in
     * a few milliseconds.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort, daemon threads).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}

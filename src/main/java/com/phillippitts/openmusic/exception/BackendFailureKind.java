package com.phillippitts.openmusic.exception;

/**
 * How the resolver reacts to a failed backend attempt.
 */
public enum BackendFailureKind {
    /** Deadline expired; retried with backoff within the same call. */
    TIMEOUT,
    /** Malformed or unexpected response; backend skipped for the rest of the call. */
    PROTOCOL,
    /** Backend unreachable or refusing service; logged and tried again on the next call. */
    UNAVAILABLE
}

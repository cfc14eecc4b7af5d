package com.phillippitts.openmusic.service.resolver.event;

import com.phillippitts.openmusic.exception.BackendFailureKind;

/**
 * Result of a single adapter invocation.
 */
public enum AttemptOutcome {
    SUCCESS,
    EMPTY,
    TIMEOUT,
    PROTOCOL_ERROR,
    UNAVAILABLE;

    public static AttemptOutcome of(BackendFailureKind kind) {
        return switch (kind) {
            case TIMEOUT -> TIMEOUT;
            case PROTOCOL -> PROTOCOL_ERROR;
            case UNAVAILABLE -> UNAVAILABLE;
        };
    }

    public boolean isFailure() {
        return this == TIMEOUT || this == PROTOCOL_ERROR || this == UNAVAILABLE;
    }
}

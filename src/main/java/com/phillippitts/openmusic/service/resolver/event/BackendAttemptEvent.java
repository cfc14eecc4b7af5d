package com.phillippitts.openmusic.service.resolver.event;

import com.phillippitts.openmusic.domain.SourceKind;

import java.time.Duration;

/**
 * Published after every adapter invocation made by the resolver.
 *
 * @param backend configured backend name
 * @param kind backend family
 * @param operation "search", "resolve" or "stream"
 * @param attempt 1-based attempt number within the call
 * @param outcome what happened
 * @param elapsed wall time of the attempt
 * @param detail failure message, empty on success
 */
public record BackendAttemptEvent(
        String backend,
        SourceKind kind,
        String operation,
        int attempt,
        AttemptOutcome outcome,
        Duration elapsed,
        String detail
) {
}

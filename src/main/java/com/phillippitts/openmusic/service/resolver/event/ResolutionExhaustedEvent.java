package com.phillippitts.openmusic.service.resolver.event;

import java.util.List;

/**
 * Published when a resolution call ends without a result.
 *
 * @param query query or URL (unsanitized; listeners must sanitize before logging)
 * @param attemptedBackends backends tried, in order
 * @param allFailed true when every attempted backend failed with an error
 */
public record ResolutionExhaustedEvent(String query, List<String> attemptedBackends, boolean allFailed) {
    public ResolutionExhaustedEvent {
        attemptedBackends = List.copyOf(attemptedBackends);
    }
}

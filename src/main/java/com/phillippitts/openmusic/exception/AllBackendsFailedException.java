package com.phillippitts.openmusic.exception;

import java.util.List;

/**
 * Resolution exhausted with an error from every attempted backend. The cause is the last
 * {@link BackendException} observed.
 */
public class AllBackendsFailedException extends NoResultsException {

    public AllBackendsFailedException(String query, List<String> attemptedBackends,
                                      BackendException lastError) {
        super("All backends failed", query, attemptedBackends, lastError);
    }

    public BackendException getLastError() {
        return (BackendException) getCause();
    }

    public BackendFailureKind getLastFailureKind() {
        return getLastError().getKind();
    }
}

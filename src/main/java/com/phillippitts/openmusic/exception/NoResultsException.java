package com.phillippitts.openmusic.exception;

import java.util.List;

/**
 * Terminal failure of a resolution call: every enabled backend was tried and none produced a
 * usable result.
 */
public class NoResultsException extends OpenMusicException {

    private final String query;
    private final List<String> attemptedBackends;

    public NoResultsException(String query, List<String> attemptedBackends) {
        super(buildMessage("No results", query, attemptedBackends));
        this.query = query;
        this.attemptedBackends = List.copyOf(attemptedBackends);
    }

    protected NoResultsException(String message, String query, List<String> attemptedBackends,
                                 Throwable cause) {
        super(buildMessage(message, query, attemptedBackends), cause);
        this.query = query;
        this.attemptedBackends = List.copyOf(attemptedBackends);
    }

    public String getQuery() {
        return query;
    }

    /** Backend names in the order they were attempted; empty when none was enabled. */
    public List<String> getAttemptedBackends() {
        return attemptedBackends;
    }

    private static String buildMessage(String prefix, String query, List<String> attempted) {
        return prefix + " for query '" + query + "' (attempted: "
                + (attempted.isEmpty() ? "none" : String.join(", ", attempted)) + ")";
    }
}

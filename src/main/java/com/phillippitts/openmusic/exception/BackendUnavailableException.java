package com.phillippitts.openmusic.exception;

/**
 * Thrown when a backend cannot be reached or refuses service.
 */
public class BackendUnavailableException extends BackendException {

    public BackendUnavailableException(String message, String backendName) {
        super(message, backendName);
    }

    public BackendUnavailableException(String message, String backendName, Throwable cause) {
        super(message, backendName, cause);
    }

    @Override
    public BackendFailureKind getKind() {
        return BackendFailureKind.UNAVAILABLE;
    }
}

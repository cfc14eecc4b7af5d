package com.phillippitts.openmusic.exception;

/**
 * Thrown when a backend does not answer before its deadline.
 */
public class BackendTimeoutException extends BackendException {

    public BackendTimeoutException(String message, String backendName) {
        super(message, backendName);
    }

    public BackendTimeoutException(String message, String backendName, Throwable cause) {
        super(message, backendName, cause);
    }

    @Override
    public BackendFailureKind getKind() {
        return BackendFailureKind.TIMEOUT;
    }
}

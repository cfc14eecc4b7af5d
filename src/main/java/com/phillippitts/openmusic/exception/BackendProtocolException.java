package com.phillippitts.openmusic.exception;

/**
 * Thrown when a backend answers with a malformed or unexpected payload.
 */
public class BackendProtocolException extends BackendException {

    public BackendProtocolException(String message, String backendName) {
        super(message, backendName);
    }

    public BackendProtocolException(String message, String backendName, Throwable cause) {
        super(message, backendName, cause);
    }

    @Override
    public BackendFailureKind getKind() {
        return BackendFailureKind.PROTOCOL;
    }
}

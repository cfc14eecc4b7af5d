package com.phillippitts.openmusic.exception;

import java.util.Objects;

/**
 * Thrown when a backend adapter fails to search or resolve.
 *
 * <p>Adapters only ever throw one of the three concrete subclasses so that the resolver can
 * decide between retrying, skipping and moving on without inspecting raw transport errors.
 */
public abstract class BackendException extends OpenMusicException {

    private final String backendName;

    protected BackendException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = Objects.requireNonNull(backendName, "backendName");
    }

    protected BackendException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = Objects.requireNonNull(backendName, "backendName");
    }

    public String getBackendName() {
        return backendName;
    }

    public abstract BackendFailureKind getKind();

    /** True when another attempt against the same backend may succeed within the same call. */
    public boolean isRetryable() {
        return getKind() == BackendFailureKind.TIMEOUT;
    }
}

package com.phillippitts.openmusic.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link BackendException}s with rich contextual information.
 *
 * <p>Used mostly by subprocess and HTTP adapters, where the exit code, elapsed time and a
 * snippet of diagnostics are what an operator needs to tell a broken binary from a slow mirror.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw BackendExceptionBuilder.create("Non-zero exit: 1")
 *         .backend("yt-dlp")
 *         .kind(BackendFailureKind.UNAVAILABLE)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("binaryPath", binPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class BackendExceptionBuilder {

    private final String message;
    private String backendName;
    private BackendFailureKind kind = BackendFailureKind.UNAVAILABLE;
    private Throwable cause;
    private Integer exitCode;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private BackendExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static BackendExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new BackendExceptionBuilder(message);
    }

    public BackendExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    /**
     * Selects the failure kind and therefore the concrete exception type. Defaults to
     * {@link BackendFailureKind#UNAVAILABLE}.
     */
    public BackendExceptionBuilder kind(BackendFailureKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public BackendExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public BackendExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public BackendExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public BackendExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public BackendExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (exitCode={code}, httpStatus={status}, durationMs={ms}, {key1}={val1}, ...) (backend: {name})
     * </pre>
     *
     * @return constructed exception of the configured kind
     */
    public BackendException build() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";

        return switch (kind) {
            case TIMEOUT -> new BackendTimeoutException(detailedMessage, backend, cause);
            case PROTOCOL -> new BackendProtocolException(detailedMessage, backend, cause);
            case UNAVAILABLE -> new BackendUnavailableException(detailedMessage, backend, cause);
        };
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (exitCode != null) {
            details.put("exitCode", String.valueOf(exitCode));
        }
        if (httpStatus != null) {
            details.put("httpStatus", String.valueOf(httpStatus));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);

        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}

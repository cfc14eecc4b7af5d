package com.phillippitts.openmusic.service.source;

import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.exception.BackendExceptionBuilder;
import com.phillippitts.openmusic.exception.BackendFailureKind;
import org.json.JSONException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Translates HTTP client and payload errors into the backend failure taxonomy.
 *
 * <ul>
 *   <li>read/connect timeout: {@link BackendFailureKind#TIMEOUT}</li>
 *   <li>I/O error, 5xx, 429, 401/403: {@link BackendFailureKind#UNAVAILABLE}</li>
 *   <li>other 4xx, unparsable JSON: {@link BackendFailureKind#PROTOCOL}</li>
 * </ul>
 */
public final class HttpFailures {

    private HttpFailures() {}

    public static BackendException translate(String backend, String operation, RuntimeException e) {
        if (e instanceof BackendException be) {
            return be;
        }
        BackendExceptionBuilder builder = BackendExceptionBuilder.create(operation + " failed: " + e.getMessage())
                .backend(backend)
                .cause(e);

        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            builder.httpStatus(status).kind(kindForStatus(status));
        } else if (e instanceof ResourceAccessException) {
            builder.kind(isTimeout(e) ? BackendFailureKind.TIMEOUT : BackendFailureKind.UNAVAILABLE);
        } else if (e instanceof JSONException) {
            builder.kind(BackendFailureKind.PROTOCOL);
        } else if (e instanceof RestClientException) {
            // Body conversion and other client-side failures mean an unexpected payload
            builder.kind(BackendFailureKind.PROTOCOL);
        } else {
            builder.kind(BackendFailureKind.UNAVAILABLE);
        }
        return builder.build();
    }

    static BackendFailureKind kindForStatus(int status) {
        if (status == 429 || status == 401 || status == 403 || status >= 500) {
            return BackendFailureKind.UNAVAILABLE;
        }
        return BackendFailureKind.PROTOCOL;
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }
}

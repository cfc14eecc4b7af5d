package com.phillippitts.openmusic.service.source;

import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.exception.BackendFailureKind;
import com.phillippitts.openmusic.exception.BackendTimeoutException;
import org.json.JSONException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class HttpFailuresTest {

    @Test
    void readTimeoutIsTimeout() {
        ResourceAccessException e = new ResourceAccessException("I/O error",
                new SocketTimeoutException("Read timed out"));

        BackendException translated = HttpFailures.translate("invidious", "search", e);

        assertThat(translated.getKind()).isEqualTo(BackendFailureKind.TIMEOUT);
        assertThat(translated.isRetryable()).isTrue();
        assertThat(translated.getBackendName()).isEqualTo("invidious");
        assertThat(translated).hasCause(e);
    }

    @Test
    void connectionRefusedIsUnavailable() {
        ResourceAccessException e = new ResourceAccessException("I/O error", new IOException("Connection refused"));

        assertThat(HttpFailures.translate("invidious", "search", e).getKind())
                .isEqualTo(BackendFailureKind.UNAVAILABLE);
    }

    @Test
    void statusCodesMapToKinds() {
        assertThat(HttpFailures.kindForStatus(500)).isEqualTo(BackendFailureKind.UNAVAILABLE);
        assertThat(HttpFailures.kindForStatus(503)).isEqualTo(BackendFailureKind.UNAVAILABLE);
        assertThat(HttpFailures.kindForStatus(429)).isEqualTo(BackendFailureKind.UNAVAILABLE);
        assertThat(HttpFailures.kindForStatus(403)).isEqualTo(BackendFailureKind.UNAVAILABLE);
        assertThat(HttpFailures.kindForStatus(404)).isEqualTo(BackendFailureKind.PROTOCOL);
        assertThat(HttpFailures.kindForStatus(400)).isEqualTo(BackendFailureKind.PROTOCOL);
    }

    @Test
    void responseExceptionCarriesStatus() {
        BackendException translated = HttpFailures.translate("youtube-api", "search",
                new HttpServerErrorException(HttpStatus.BAD_GATEWAY));

        assertThat(translated.getKind()).isEqualTo(BackendFailureKind.UNAVAILABLE);
        assertThat(translated).hasMessageContaining("httpStatus=502");

        assertThat(HttpFailures.translate("youtube-api", "search",
                new HttpClientErrorException(HttpStatus.NOT_FOUND)).getKind())
                .isEqualTo(BackendFailureKind.PROTOCOL);
    }

    @Test
    void malformedJsonIsProtocol() {
        assertThat(HttpFailures.translate("invidious", "search", new JSONException("bad")).getKind())
                .isEqualTo(BackendFailureKind.PROTOCOL);
    }

    @Test
    void backendExceptionsPassThrough() {
        BackendTimeoutException original = new BackendTimeoutException("slow", "invidious");

        assertThat(HttpFailures.translate("other", "search", original)).isSameAs(original);
    }

    @Test
    void unknownRuntimeErrorIsUnavailable() {
        assertThat(HttpFailures.translate("invidious", "search", new IllegalStateException("boom")).getKind())
                .isEqualTo(BackendFailureKind.UNAVAILABLE);
    }
}

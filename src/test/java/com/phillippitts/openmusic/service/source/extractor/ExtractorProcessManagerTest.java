package com.phillippitts.openmusic.service.source.extractor;

import com.phillippitts.openmusic.config.source.ExtractorConfig;
import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.exception.BackendFailureKind;
import com.phillippitts.openmusic.exception.BackendTimeoutException;
import com.phillippitts.openmusic.exception.BackendUnavailableException;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.openmusic.service.source.extractor.ExtractorTestDoubles.FakeProcess;
import static com.phillippitts.openmusic.service.source.extractor.ExtractorTestDoubles.RecordingProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractorProcessManagerTest {

    private static ExtractorConfig config(int timeoutSeconds, int maxStdoutBytes) {
        return new ExtractorConfig("/usr/local/bin/yt-dlp", timeoutSeconds, 8, maxStdoutBytes, "UA", "android");
    }

    @Test
    void returnsStdoutAndPrefixesBinary() {
        RecordingProcessFactory factory = new RecordingProcessFactory(FakeProcess.succeeded("line one\nline two"));
        ExtractorProcessManager mgr = new ExtractorProcessManager(factory, config(2, 1024));

        String out = mgr.run(List.of("--dump-json", "ytsearch1:abba"));

        assertThat(out).isEqualTo("line one\nline two");
        assertThat(factory.lastCommand())
                .containsExactly("/usr/local/bin/yt-dlp", "--dump-json", "ytsearch1:abba");
        assertThat(mgr.runningProcesses()).isZero();
    }

    @Test
    void nonZeroExitIsUnavailableWithStderrSnippet() {
        RecordingProcessFactory factory = new RecordingProcessFactory(
                FakeProcess.exited("", "ERROR: Video unavailable", 1));
        ExtractorProcessManager mgr = new ExtractorProcessManager(factory, config(2, 1024));

        assertThatThrownBy(() -> mgr.run(List.of("x")))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("Non-zero exit: 1")
                .hasMessageContaining("stderr=ERROR: Video unavailable")
                .hasMessageContaining("backend: yt-dlp");
    }

    @Test
    void missingBinaryIsUnavailable() {
        RecordingProcessFactory factory = new RecordingProcessFactory(new IOException("No such file"));
        ExtractorProcessManager mgr = new ExtractorProcessManager(factory, config(2, 1024));

        assertThatThrownBy(() -> mgr.run(List.of("x")))
                .isInstanceOfSatisfying(BackendException.class,
                        e -> assertThat(e.getKind()).isEqualTo(BackendFailureKind.UNAVAILABLE))
                .hasMessageContaining("No such file")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void timeoutDestroysProcessAndThrowsTimeout() {
        FakeProcess process = FakeProcess.hanging();
        ExtractorProcessManager mgr = new ExtractorProcessManager(new RecordingProcessFactory(process), config(1, 1024));

        long start = System.nanoTime();
        assertThatThrownBy(() -> mgr.run(List.of("x")))
                .isInstanceOf(BackendTimeoutException.class)
                .hasMessageContaining("Timeout after 1s");
        long durationMs = (System.nanoTime() - start) / 1_000_000L;

        assertThat(durationMs).isLessThan(5000);
        assertThat(mgr.runningProcesses()).isZero();
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(process::wasDestroyed);
    }

    @Test
    void stdoutIsCappedAtConfiguredSize() {
        String big = "a".repeat(50) + "\n" + "b".repeat(50) + "\n" + "c".repeat(50);
        ExtractorProcessManager mgr = new ExtractorProcessManager(
                new RecordingProcessFactory(FakeProcess.succeeded(big)), config(2, 60));

        String out = mgr.run(List.of("x"));

        assertThat(out).hasSizeLessThanOrEqualTo(60).startsWith("a".repeat(50));
        assertThat(out).doesNotContain("c");
    }

    @Test
    void closeIsIdempotentWhenNothingRuns() {
        ExtractorProcessManager mgr = new ExtractorProcessManager(
                new RecordingProcessFactory(FakeProcess.succeeded("")), config(2, 1024));

        mgr.close();
        mgr.close();

        assertThat(mgr.runningProcesses()).isZero();
    }
}

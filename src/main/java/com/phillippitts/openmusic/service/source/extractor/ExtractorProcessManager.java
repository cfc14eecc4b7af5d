package com.phillippitts.openmusic.service.source.extractor;

import com.phillippitts.openmusic.config.source.ExtractorConfig;
import com.phillippitts.openmusic.exception.BackendException;
import com.phillippitts.openmusic.exception.BackendExceptionBuilder;
import com.phillippitts.openmusic.exception.BackendFailureKind;
import com.phillippitts.openmusic.util.ProcessTimeouts;
import com.phillippitts.openmusic.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs the yt-dlp extractor as a subprocess.
 *
 * <p>Responsibilities:
 * - Prefix the configured binary to a caller-supplied argument list
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout (JSON lines or URLs) and stderr (diagnostics) concurrently, both capped
 * - Enforce a hard timeout and terminate runaway processes
 * - Provide structured error context in {@link BackendException}
 *
 * <p>Each invocation owns its process and gobbler threads, so concurrent resolutions from
 * different sessions never share state. {@link #close()} kills whatever is still running at
 * shutdown.
 */
@Component
public final class ExtractorProcessManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ExtractorProcessManager.class);

    static final String BACKEND = "yt-dlp";
    static final int STDERR_MAX_BYTES = 64 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 400;

    private final ProcessFactory processFactory;
    private final ExtractorConfig config;
    private final Set<Process> running = ConcurrentHashMap.newKeySet();

    /**
     * Context for creating detailed error messages.
     */
    private record ErrorContext(
            BackendFailureKind kind,
            int exitCode,
            StringBuilder stderr,
            long startNano,
            Throwable cause
    ) {}

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    @Autowired
    public ExtractorProcessManager(ExtractorConfig config) {
        this(new DefaultProcessFactory(), config);
    }

    ExtractorProcessManager(ProcessFactory processFactory, ExtractorConfig config) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.config = Objects.requireNonNull(config, "config");
    }

    ExtractorConfig config() {
        return config;
    }

    /**
     * Runs the extractor with the given arguments and returns its stdout.
     *
     * @param arguments arguments following the binary
     * @return stdout content (may be empty)
     * @throws BackendException TIMEOUT on deadline expiry, UNAVAILABLE on non-zero exit or
     *         when the binary cannot be started
     */
    public String run(List<String> arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(config.binaryPath());
        command.addAll(arguments);

        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = startProcessWithGobblers(command);
            waitForProcessCompletion(exec, startTime);
            return handleProcessResult(exec, startTime);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw extractorError("I/O failure: " + e.getMessage(),
                    new ErrorContext(BackendFailureKind.UNAVAILABLE, -1, null, startTime, e));
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution startProcessWithGobblers(List<String> command) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, null);
        running.add(process);

        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "extractor-out",
                config.maxStdoutBytes());
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "extractor-err",
                STDERR_MAX_BYTES);

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForProcessCompletion(ProcessExecution exec, long startTime) throws InterruptedException {
        boolean finished = exec.process().waitFor(config.timeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw extractorError("Timeout after " + config.timeoutSeconds() + "s",
                    new ErrorContext(BackendFailureKind.TIMEOUT, -1, exec.stderr(), startTime, null));
        }

        // Ensure gobblers have a moment to flush
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private String handleProcessResult(ProcessExecution exec, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw extractorError("Non-zero exit: " + exitCode,
                    new ErrorContext(BackendFailureKind.UNAVAILABLE, exitCode, exec.stderr(), startTime, null));
        }

        String output;
        synchronized (exec.stdout()) {
            output = exec.stdout().toString();
        }
        LOG.debug("Extractor stdout size={} chars in {}ms", output.length(), TimeUtils.elapsedMillis(startTime));
        return output;
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from an input stream into a StringBuilder until capacity is reached, then
     * keeps draining without accumulating so the child never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(0, available));
                            LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Extractor process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying extractor process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying extractor process: {}", e.toString());
        }
    }

    private void cleanup(ProcessExecution exec) {
        running.remove(exec.process());
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private BackendException extractorError(String msg, ErrorContext ctx) {
        long durationMs = TimeUtils.nanosToMillis(System.nanoTime() - ctx.startNano());
        String stderrSnippet = ctx.stderr() == null ? "" : snippet(ctx.stderr(), ERROR_SNIPPET_MAX_CHARS);

        BackendExceptionBuilder builder = BackendExceptionBuilder.create(msg)
                .backend(BACKEND)
                .kind(ctx.kind())
                .exitCode(ctx.exitCode())
                .durationMs(durationMs)
                .metadata("binaryPath", config.binaryPath())
                .metadata("stderr", stderrSnippet);

        if (ctx.cause() != null) {
            builder.cause(ctx.cause());
        }
        return builder.build();
    }

    private static String snippet(StringBuilder sb, int maxChars) {
        synchronized (sb) {
            int len = Math.min(maxChars, sb.length());
            return sb.substring(0, len);
        }
    }

    /** Number of extractor processes currently running. */
    int runningProcesses() {
        return running.size();
    }

    /**
     * Kills every extractor process still running. Idempotent.
     */
    @Override
    public void close() {
        for (Process process : List.copyOf(running)) {
            running.remove(process);
            if (process.isAlive()) {
                destroyProcess(process);
            }
        }
    }
}

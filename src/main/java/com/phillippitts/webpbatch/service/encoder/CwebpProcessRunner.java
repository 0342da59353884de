package com.phillippitts.webpbatch.service.encoder;

import com.phillippitts.webpbatch.config.encoder.EncoderConfig;
import com.phillippitts.webpbatch.exception.ConversionException;
import com.phillippitts.webpbatch.exception.ConversionExceptionBuilder;
import com.phillippitts.webpbatch.util.LogSanitizer;
import com.phillippitts.webpbatch.util.ProcessTimeouts;
import com.phillippitts.webpbatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one cwebp process per image.
 *
 * <p>Responsibilities:
 * - Build the CLI from an {@link EncodeRequest}
 * - Start the process via {@link ProcessFactory} with stdin closed
 * - Capture stdout and stderr concurrently so the process never blocks on a full pipe
 * - Turn a non-zero exit or an I/O failure into a {@link ConversionException}
 *
 * <p>The wait has no timeout: a hung encoder blocks the run until it exits.
 */
final class CwebpProcessRunner {

    private static final Logger LOG = LogManager.getLogger(CwebpProcessRunner.class);

    static final int STDOUT_MAX_BYTES = 4096;
    static final int ERROR_SNIPPET_MAX_CHARS = 300;

    private final ProcessFactory processFactory;
    private final EncoderConfig config;

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

    CwebpProcessRunner(ProcessFactory processFactory, EncoderConfig config) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Encodes one image and waits for the encoder to exit.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} -q ${quality} ${source} -o ${target}
     * ${binary} -lossless ${source} -o ${target}     (PNG at quality 100)
     * </pre>
     *
     * @param binary resolved encoder executable
     * @param request encode parameters
     * @throws ConversionException on non-zero exit, I/O error or interruption
     */
    void run(Path binary, EncodeRequest request) {
        Objects.requireNonNull(binary, "binary");
        Objects.requireNonNull(request, "request");

        List<String> command = buildCommand(binary, request);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;

        try {
            exec = start(command);
            int exitCode = exec.process().waitFor();
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            if (exitCode != 0) {
                throw ConversionExceptionBuilder.create("Non-zero exit: " + exitCode)
                        .exitCode(exitCode)
                        .durationMs(TimeUtils.elapsedMillis(startTime))
                        .metadata("stderr", snippet(exec.stderr()))
                        .build();
            }
            LOG.debug("cwebp finished in {} ms: {}", TimeUtils.elapsedMillis(startTime),
                    LogSanitizer.truncate(exec.stderr().toString(), ERROR_SNIPPET_MAX_CHARS));
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw ConversionExceptionBuilder.create("Encoder failure: " + e.getMessage())
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("binary", binary)
                    .cause(e)
                    .build();
        } finally {
            cleanup(exec);
        }
    }

    // Visible for tests
    static List<String> buildCommand(Path binary, EncodeRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary.toString());

        if (request.lossless()) {
            cmd.add("-lossless");
        } else {
            cmd.add("-q");
            cmd.add(String.valueOf(request.quality()));
        }

        cmd.add(request.source().toAbsolutePath().toString());
        cmd.add("-o");
        cmd.add(request.target().toAbsolutePath().toString());
        return cmd;
    }

    private ProcessExecution start(List<String> command) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, null);
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            LOG.debug("Could not close encoder stdin: {}", e.toString());
        }

        // Start gobblers before waiting to avoid deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "cwebp-out", STDOUT_MAX_BYTES);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "cwebp-err", config.maxStderrBytes());
        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from an input stream into a StringBuilder until capacity is reached, then keeps
     * draining without accumulating.
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
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static String snippet(StringBuilder sb) {
        synchronized (sb) {
            return LogSanitizer.singleLine(LogSanitizer.truncate(sb.toString(), ERROR_SNIPPET_MAX_CHARS));
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec == null) {
            return;
        }
        Process process = exec.process();
        if (process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
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
                    LOG.warn("Encoder process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying encoder process");
        }
    }
}

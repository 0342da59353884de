package com.phillippitts.webpbatch.util;

import java.time.Duration;

/**
 * Standard timeout values for encoder process and gobbler thread management.
 *
 * <p>The encoder itself runs without a timeout; these values only bound the cleanup of
 * stream gobbler threads and of processes that are still alive when the runner closes.
 *
 * @see com.phillippitts.webpbatch.service.encoder.CwebpProcessRunner
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     *
     * <p>cwebp writes a short progress report to stderr; 500ms is plenty to drain it.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}

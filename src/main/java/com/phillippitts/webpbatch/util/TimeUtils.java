package com.phillippitts.webpbatch.util;

/**
 * Utility methods for elapsed time calculations based on {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /**
     * Number of nanoseconds in one second.
     */
    public static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Calculates elapsed seconds (fractional) since a nanosecond timestamp.
     *
     * <p>Used for the {@code duration_seconds} fields of folder and run summaries.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed seconds since startNanos, never negative
     */
    public static double elapsedSeconds(long startNanos) {
        return Math.max(0L, System.nanoTime() - startNanos) / NANOS_PER_SECOND;
    }
}

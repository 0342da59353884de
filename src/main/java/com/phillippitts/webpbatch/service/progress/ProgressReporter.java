package com.phillippitts.webpbatch.service.progress;

import java.util.OptionalInt;

/**
 * Maps processed and total work units to a whole percentage.
 */
public final class ProgressReporter {

    private ProgressReporter() {
    }

    /**
     * @param processed work units accounted for so far
     * @param total     total work units of the run
     * @return floor of {@code processed * 100 / total} clamped to [0, 100], or empty when total is not positive
     */
    public static OptionalInt percent(long processed, long total) {
        if (total <= 0) {
            return OptionalInt.empty();
        }
        long pct = Math.max(0L, processed) * 100L / total;
        return OptionalInt.of((int) Math.min(100L, pct));
    }
}

package com.phillippitts.webpbatch.service.progress;

import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Counts processed work units for one run and emits the percentage whenever it increases.
 *
 * <p>Emitted values are strictly increasing and never exceed 100, even when the processed
 * count overshoots the total. Not thread-safe; owned by the run worker.
 */
public final class ProgressTracker {

    private final int total;
    private final IntConsumer sink;
    private int processed;
    private int lastEmitted = -1;

    public ProgressTracker(int total, IntConsumer sink) {
        this.total = total;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Adds work units and emits the new percentage if it went up.
     *
     * @param units number of units to add; zero or negative values are ignored
     */
    public void advance(int units) {
        if (units <= 0) {
            return;
        }
        processed += units;
        ProgressReporter.percent(processed, total).ifPresent(this::emit);
    }

    /**
     * Emits 100 unless it was already emitted.
     */
    public void complete() {
        emit(100);
    }

    public int processed() {
        return processed;
    }

    public int total() {
        return total;
    }

    private void emit(int percent) {
        if (percent > lastEmitted) {
            lastEmitted = percent;
            sink.accept(percent);
        }
    }
}

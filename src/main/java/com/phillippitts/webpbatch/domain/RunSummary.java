package com.phillippitts.webpbatch.domain;

import java.util.List;

/**
 * Terminal result of a run. Exactly one is produced per run, whether it completed, was
 * cancelled or ended early because the encoder was missing.
 *
 * @param cancelled           whether the run stopped at a cancellation checkpoint
 * @param durationSeconds     total run time
 * @param totalImages         total work units
 * @param processedImages     work units accounted for when the run ended
 * @param expectedConversions number of convertible images found by the scan
 * @param totals              aggregate counters over {@code folders}
 * @param folders             per-folder summaries in processing order
 */
public record RunSummary(
        boolean cancelled,
        double durationSeconds,
        int totalImages,
        int processedImages,
        int expectedConversions,
        RunTotals totals,
        List<FolderSummary> folders
) {

    public RunSummary {
        folders = List.copyOf(folders);
    }

    public static RunSummary of(boolean cancelled, double durationSeconds, int totalImages,
                                int processedImages, int expectedConversions, List<FolderSummary> folders) {
        return new RunSummary(cancelled, durationSeconds, totalImages, processedImages,
                expectedConversions, RunTotals.of(folders), folders);
    }

    /**
     * Summary of a run that never reached the folder loop (encoder missing).
     */
    public static RunSummary empty(double durationSeconds) {
        return new RunSummary(false, durationSeconds, 0, 0, 0, RunTotals.EMPTY, List.of());
    }
}

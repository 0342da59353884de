package com.phillippitts.webpbatch.domain;

import java.util.List;

/**
 * Aggregate counters of a run, summed over its folder summaries.
 */
public record RunTotals(
        int converted,
        int skippedExisting,
        int errors,
        long bytesOriginal,
        long bytesConverted,
        long bytesSaved,
        int archives
) {

    public static final RunTotals EMPTY = new RunTotals(0, 0, 0, 0L, 0L, 0L, 0);

    /**
     * Sums the folder summaries. {@code bytesSaved} is computed from the summed byte counts and
     * clamped at zero, so a folder that grew cannot make the run total negative.
     */
    public static RunTotals of(List<FolderSummary> folders) {
        int converted = 0;
        int skipped = 0;
        int errors = 0;
        long original = 0L;
        long produced = 0L;
        int archives = 0;
        for (FolderSummary f : folders) {
            converted += f.converted();
            skipped += f.skippedExisting();
            errors += f.errors().size();
            original += f.bytesOriginal();
            produced += f.bytesConverted();
            if (f.archivePath() != null) {
                archives++;
            }
        }
        return new RunTotals(converted, skipped, errors, original, produced,
                Math.max(0L, original - produced), archives);
    }
}

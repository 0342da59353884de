package com.phillippitts.webpbatch.service.run;

import com.phillippitts.webpbatch.domain.ConversionOutcome;
import com.phillippitts.webpbatch.domain.FolderBatch;
import com.phillippitts.webpbatch.domain.FolderSummary;
import com.phillippitts.webpbatch.util.TimeUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-folder accumulator, sealed into a {@link FolderSummary} once the folder is done.
 *
 * <p>Byte totals only include successful conversions.
 */
final class FolderStats {

    private final FolderBatch batch;
    private final long startNanos;
    private final List<String> errors = new ArrayList<>();
    private int converted;
    private long bytesOriginal;
    private long bytesConverted;
    private Path archivePath;
    private Long archiveSize;

    FolderStats(FolderBatch batch) {
        this.batch = batch;
        this.startNanos = System.nanoTime();
    }

    void record(ConversionOutcome outcome) {
        if (outcome.success()) {
            converted++;
            bytesOriginal += outcome.originalSize();
            bytesConverted += outcome.convertedSize();
        } else {
            error(outcome.errorMessage());
        }
    }

    void error(String message) {
        errors.add(message);
    }

    void errors(List<String> messages) {
        errors.addAll(messages);
    }

    void archive(Path path, Long size) {
        this.archivePath = path;
        this.archiveSize = size;
    }

    int converted() {
        return converted;
    }

    FolderSummary seal() {
        return new FolderSummary(
                batch.folder().toString(),
                converted,
                batch.skippedWebp().size(),
                errors,
                bytesOriginal,
                bytesConverted,
                archivePath == null ? null : archiveSize,
                archivePath == null ? null : archivePath.toString(),
                TimeUtils.elapsedSeconds(startNanos));
    }
}

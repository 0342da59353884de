package com.phillippitts.webpbatch.domain;

import java.util.List;
import java.util.Objects;

/**
 * Statistics of one processed folder.
 *
 * @param folder          folder path as given in the run configuration
 * @param converted       number of successfully encoded images
 * @param skippedExisting number of WebP files left out by skip mode
 * @param errors          image-level and folder-scoped errors in the order they occurred
 * @param bytesOriginal   total size of the successfully encoded sources
 * @param bytesConverted  total size of the produced WebP files
 * @param archiveSize     archive size in bytes; null when no archive was written or its size is unknown
 * @param archivePath     archive location; null when no archive was written
 * @param durationSeconds time spent on this folder
 */
public record FolderSummary(
        String folder,
        int converted,
        int skippedExisting,
        List<String> errors,
        long bytesOriginal,
        long bytesConverted,
        Long archiveSize,
        String archivePath,
        double durationSeconds
) {

    public FolderSummary {
        Objects.requireNonNull(folder, "folder must not be null");
        errors = List.copyOf(errors);
    }

    /**
     * Bytes saved by the conversion; never negative.
     */
    public long bytesSaved() {
        return Math.max(0L, bytesOriginal - bytesConverted);
    }
}

package com.phillippitts.webpbatch.service.history;

import com.phillippitts.webpbatch.domain.ArchiveFormat;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One finished run as kept in the history.
 *
 * @param timestamp       when the run ended
 * @param folders         folders of the run, as given
 * @param quality         encoder quality
 * @param archiveFormat   archive container selected for the run
 * @param replace         whether originals were replaced in place
 * @param skipWebp        whether existing WebP files were skipped
 * @param cancelled       whether the run was cancelled
 * @param converted       images converted
 * @param errors          errors reported
 * @param bytesSaved      bytes saved over the run
 * @param durationSeconds run duration
 */
public record HistoryEntry(
        Instant timestamp,
        List<String> folders,
        int quality,
        ArchiveFormat archiveFormat,
        boolean replace,
        boolean skipWebp,
        boolean cancelled,
        int converted,
        int errors,
        long bytesSaved,
        double durationSeconds
) {

    public HistoryEntry {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(archiveFormat, "archiveFormat must not be null");
        folders = List.copyOf(folders);
    }
}

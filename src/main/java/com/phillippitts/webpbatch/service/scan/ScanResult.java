package com.phillippitts.webpbatch.service.scan;

import com.phillippitts.webpbatch.domain.FolderBatch;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of scanning the requested folders.
 *
 * @param batches        one batch per usable folder, in request order
 * @param missingFolders requested folders that do not exist or cannot be listed
 */
public record ScanResult(List<FolderBatch> batches, List<Path> missingFolders) {

    public ScanResult {
        batches = List.copyOf(batches);
        missingFolders = List.copyOf(missingFolders);
    }

    /**
     * Number of images that will be encoded across all batches.
     */
    public int totalConvertible() {
        return batches.stream().mapToInt(b -> b.convertible().size()).sum();
    }

    /**
     * Number of eligible images across all batches, converted or skipped.
     */
    public int totalFiles() {
        return batches.stream().mapToInt(b -> b.allImages().size()).sum();
    }

    /**
     * Total work units of the run: the file count, or the convertible count when no files were
     * counted at all.
     */
    public int totalWorkUnits() {
        int files = totalFiles();
        return files != 0 ? files : totalConvertible();
    }
}

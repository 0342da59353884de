package com.phillippitts.webpbatch.service.output;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of applying an output strategy to one folder.
 *
 * @param errors      per-file and folder-scoped errors, in order
 * @param archivePath written archive, or null
 * @param archiveSize archive size in bytes, or null when no archive exists or its size could not be read
 */
public record OutputResult(List<String> errors, Path archivePath, Long archiveSize) {

    public OutputResult {
        errors = List.copyOf(errors);
    }

    public static OutputResult replaced(List<String> errors) {
        return new OutputResult(errors, null, null);
    }

    public static OutputResult withoutArchive(List<String> errors) {
        return new OutputResult(errors, null, null);
    }

    public static OutputResult archived(Path archivePath, Long archiveSize, List<String> errors) {
        return new OutputResult(errors, archivePath, archiveSize);
    }
}

package com.phillippitts.webpbatch.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of one conversion run, passed once to the coordinator at start.
 *
 * @param folders          folders to convert, processed in this order
 * @param quality          encoder quality, 10 to 100 inclusive
 * @param archiveFormat    archive container used when originals are not replaced
 * @param replaceOriginals replace originals in place; takes precedence over archiving
 * @param skipExistingWebp leave files that are already WebP out of the conversion
 */
public record RunConfiguration(
        List<Path> folders,
        int quality,
        ArchiveFormat archiveFormat,
        boolean replaceOriginals,
        boolean skipExistingWebp
) {

    public static final int MIN_QUALITY = 10;
    public static final int MAX_QUALITY = 100;

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if quality is out of range
     * @throws NullPointerException if folders or archiveFormat is null
     */
    public RunConfiguration {
        Objects.requireNonNull(folders, "folders must not be null");
        Objects.requireNonNull(archiveFormat, "archiveFormat must not be null");
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new IllegalArgumentException(
                    "Quality must be between " + MIN_QUALITY + " and " + MAX_QUALITY + ", got: " + quality);
        }
        folders = List.copyOf(folders);
    }

    /**
     * Replace mode wins when both replace and archive creation are requested.
     */
    public OutputMode outputMode() {
        return replaceOriginals ? OutputMode.REPLACE_IN_PLACE : OutputMode.ARCHIVE;
    }
}

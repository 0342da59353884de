package com.phillippitts.webpbatch.domain;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Scan result for one folder. Built once at scan time and never modified afterwards.
 *
 * <p>{@code convertible} and {@code skippedWebp} are disjoint and together make up
 * {@code allImages}.
 *
 * @param folder      the scanned folder
 * @param allImages   every eligible image, sorted by file name
 * @param convertible images to encode in this run
 * @param skippedWebp images left out because they already are WebP (skip mode only)
 */
public record FolderBatch(
        Path folder,
        List<Path> allImages,
        List<Path> convertible,
        List<Path> skippedWebp
) {

    public FolderBatch {
        Objects.requireNonNull(folder, "folder must not be null");
        allImages = List.copyOf(allImages);
        convertible = List.copyOf(convertible);
        skippedWebp = List.copyOf(skippedWebp);
    }

    public boolean hasConvertible() {
        return !convertible.isEmpty();
    }
}

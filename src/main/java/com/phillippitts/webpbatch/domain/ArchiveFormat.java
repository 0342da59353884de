package com.phillippitts.webpbatch.domain;

/**
 * Archive container written by the archive output strategy.
 *
 * <p>Both formats are DEFLATE-compressed ZIP containers; they only differ by extension.
 * {@link #CBZ} is the convention comic and manga readers expect.
 */
public enum ArchiveFormat {
    ZIP("zip"),
    CBZ("cbz");

    private final String extension;

    ArchiveFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Builds the archive file name for a folder, e.g. {@code chapter-01.cbz}.
     */
    public String fileNameFor(String folderName) {
        return folderName + "." + extension;
    }
}

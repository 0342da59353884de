package com.phillippitts.webpbatch.domain;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Image formats recognised by the folder scanner.
 *
 * <p>{@link #WEBP} is the target format; every other constant is a source raster format the
 * encoder accepts. {@link #PNG} is the lossless trigger: at quality 100 it is encoded with
 * {@code -lossless} instead of a numeric quality.
 */
public enum ImageFormat {
    WEBP("webp"),
    PNG("png"),
    JPEG("jpg", "jpeg"),
    BMP("bmp"),
    TIFF("tif", "tiff");

    private final Set<String> extensions;

    ImageFormat(String... extensions) {
        this.extensions = Set.of(extensions);
    }

    public Set<String> extensions() {
        return extensions;
    }

    public boolean isTarget() {
        return this == WEBP;
    }

    /**
     * Resolves the format of a file from its (case-insensitive) extension.
     *
     * @param file file path
     * @return the matching format, or empty when the extension is not supported
     */
    public static Optional<ImageFormat> of(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return Optional.empty();
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            if (format.extensions.contains(ext)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}

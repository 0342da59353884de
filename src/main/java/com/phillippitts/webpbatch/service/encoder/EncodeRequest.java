package com.phillippitts.webpbatch.service.encoder;

import com.phillippitts.webpbatch.domain.ImageFormat;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of one encoder invocation.
 *
 * @param source       image to encode
 * @param target       WebP file to produce
 * @param quality      quality 10 to 100
 * @param sourceFormat format of {@code source}
 */
public record EncodeRequest(
        Path source,
        Path target,
        int quality,
        ImageFormat sourceFormat
) {

    public EncodeRequest {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(sourceFormat, "sourceFormat must not be null");
    }

    /**
     * PNG at maximum quality is encoded losslessly instead of with {@code -q 100}.
     */
    public boolean lossless() {
        return sourceFormat == ImageFormat.PNG && quality == 100;
    }
}

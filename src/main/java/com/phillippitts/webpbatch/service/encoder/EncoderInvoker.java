package com.phillippitts.webpbatch.service.encoder;

import com.phillippitts.webpbatch.domain.ConversionOutcome;

import java.nio.file.Path;

/**
 * Converts one image to WebP with the external encoder.
 *
 * <p>Implementations never throw for encoder or file-system failures: every failure becomes a
 * {@link ConversionOutcome} with {@code success=false} and a message naming the file.
 */
public interface EncoderInvoker {

    /**
     * Encodes one image.
     *
     * @param binary  resolved encoder executable
     * @param request encode parameters
     * @return structured outcome; never null
     */
    ConversionOutcome convert(Path binary, EncodeRequest request);
}

package com.phillippitts.webpbatch.domain;

/**
 * Transient result of encoding one image.
 *
 * @param success       whether the encoder exited cleanly
 * @param originalSize  size of the source file in bytes
 * @param convertedSize size of the produced WebP file; 0 on failure or when the output is missing
 * @param errorMessage  failure description prefixed with the file name; null on success
 */
public record ConversionOutcome(
        boolean success,
        long originalSize,
        long convertedSize,
        String errorMessage
) {

    public static ConversionOutcome success(long originalSize, long convertedSize) {
        return new ConversionOutcome(true, originalSize, convertedSize, null);
    }

    public static ConversionOutcome failure(long originalSize, String errorMessage) {
        return new ConversionOutcome(false, originalSize, 0L, errorMessage);
    }
}

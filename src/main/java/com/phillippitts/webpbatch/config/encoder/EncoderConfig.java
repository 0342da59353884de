package com.phillippitts.webpbatch.config.encoder;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the cwebp encoder.
 * Binds to properties prefixed with "encoder".
 *
 * <p>Example application.properties:
 * <pre>
 * encoder.binary=cwebp
 * encoder.max-stderr-bytes=8192
 * </pre>
 *
 * @param binary         executable name looked up on the PATH, or an explicit path to the binary
 * @param maxStderrBytes maximum stderr accumulation per invocation, used for error messages
 */
@ConfigurationProperties(prefix = "encoder")
@Validated
public record EncoderConfig(
        @NotBlank(message = "Encoder binary must not be blank")
        @DefaultValue("cwebp")
        String binary,

        @Positive(message = "Max stderr bytes must be positive")
        @DefaultValue("8192")
        int maxStderrBytes
) {

    public static final String DEFAULT_BINARY = "cwebp";

    /**
     * Configuration with the default binary name and stderr cap.
     */
    public static EncoderConfig defaults() {
        return new EncoderConfig(DEFAULT_BINARY, 8192);
    }
}

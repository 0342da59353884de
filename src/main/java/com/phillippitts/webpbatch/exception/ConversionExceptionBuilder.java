package com.phillippitts.webpbatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ConversionException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ConversionExceptionBuilder.create("Non-zero exit: 255")
 *         .file("cover.png")
 *         .exitCode(255)
 *         .durationMs(840)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class ConversionExceptionBuilder {

    private final String message;
    private String fileName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ConversionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ConversionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ConversionExceptionBuilder(message);
    }

    /**
     * Sets the name of the source file being converted.
     *
     * @param fileName source file name (no directory)
     * @return this builder for chaining
     */
    public ConversionExceptionBuilder file(String fileName) {
        this.fileName = fileName;
        return this;
    }

    /**
     * Sets the root cause of the exception.
     *
     * @param cause underlying exception
     * @return this builder for chaining
     */
    public ConversionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the encoder process exit code.
     *
     * @param exitCode process exit code
     * @return this builder for chaining
     */
    public ConversionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    /**
     * Sets the operation duration in milliseconds.
     *
     * @param durationMs duration in milliseconds
     * @return this builder for chaining
     */
    public ConversionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value; ignored when null
     * @return this builder for chaining
     */
    public ConversionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the ConversionException.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (file: {name})
     * </pre>
     *
     * @return constructed ConversionException
     */
    public ConversionException build() {
        String detailedMessage = buildDetailedMessage();

        if (fileName == null) {
            return cause != null
                    ? new ConversionException(detailedMessage, cause)
                    : new ConversionException(detailedMessage);
        }
        if (cause != null) {
            return new ConversionException(detailedMessage, fileName, cause);
        } else {
            return new ConversionException(detailedMessage, fileName);
        }
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}

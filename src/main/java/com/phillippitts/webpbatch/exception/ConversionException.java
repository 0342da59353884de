package com.phillippitts.webpbatch.exception;

/**
 * Thrown when a single image conversion fails.
 * This may occur due to a non-zero encoder exit, an I/O error or an interrupted wait.
 */
public class ConversionException extends WebpBatchException {

    private final String fileName;

    public ConversionException(String message) {
        super(message);
        this.fileName = "unknown";
    }

    public ConversionException(String message, String fileName) {
        super(message + " (file: " + fileName + ")");
        this.fileName = fileName;
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.fileName = "unknown";
    }

    public ConversionException(String message, String fileName, Throwable cause) {
        super(message + " (file: " + fileName + ")", cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}

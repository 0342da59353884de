package com.phillippitts.webpbatch.exception;

/**
 * Base exception for all webp-batch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class WebpBatchException extends RuntimeException {

    public WebpBatchException(String message) {
        super(message);
    }

    public WebpBatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public WebpBatchException(Throwable cause) {
        super(cause);
    }
}

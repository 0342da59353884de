package com.phillippitts.webpbatch.exception;

/**
 * Thrown when run state is requested before any conversion run has been started.
 */
public class NoRunException extends WebpBatchException {

    public NoRunException() {
        super("No conversion run has been started");
    }
}

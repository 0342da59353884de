package com.phillippitts.webpbatch.exception;

/**
 * Thrown when the external WebP encoder cannot be found on the search path.
 * This is the only run-fatal condition: the run ends before any folder work.
 */
public class EncoderNotFoundException extends WebpBatchException {

    private final String binary;

    public EncoderNotFoundException(String binary) {
        super("WebP encoder not found: '" + binary + "' is not on the PATH and is not an executable file");
        this.binary = binary;
    }

    public EncoderNotFoundException(String binary, Throwable cause) {
        super("WebP encoder not found: " + binary, cause);
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }
}

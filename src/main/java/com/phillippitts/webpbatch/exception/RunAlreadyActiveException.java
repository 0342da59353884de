package com.phillippitts.webpbatch.exception;

/**
 * Thrown when a conversion run is requested while another run is still in flight.
 */
public class RunAlreadyActiveException extends WebpBatchException {

    private final String activeRunId;

    public RunAlreadyActiveException(String activeRunId) {
        super("A conversion run is already active: " + activeRunId);
        this.activeRunId = activeRunId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }
}

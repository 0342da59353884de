package com.phillippitts.webpbatch.service.run.event;

import java.time.Instant;

/**
 * Free-form status line for display. Consumers keep the latest one.
 *
 * @param runId     run identifier
 * @param message   human-readable status
 * @param timestamp when the status was emitted
 */
public record RunStatusEvent(String runId, String message, Instant timestamp) {

    public static RunStatusEvent of(String runId, String message) {
        return new RunStatusEvent(runId, message, Instant.now());
    }
}

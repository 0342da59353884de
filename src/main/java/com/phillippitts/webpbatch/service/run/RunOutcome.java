package com.phillippitts.webpbatch.service.run;

/**
 * How a run ended.
 */
public enum RunOutcome {
    /** Every folder was processed. */
    COMPLETED,
    /** The scan found no convertible image. */
    NOTHING_TO_CONVERT,
    /** Stopped at a cancellation checkpoint. */
    CANCELLED,
    /** The encoder could not be found; no folder was touched. */
    ENCODER_UNAVAILABLE
}

package com.phillippitts.webpbatch.service.run;

/**
 * Externally visible state of a run.
 */
public enum RunState {
    RUNNING,
    CANCELLING,
    FINISHED,
    /** The run ended with an unexpected exception and produced no summary. */
    FAILED
}

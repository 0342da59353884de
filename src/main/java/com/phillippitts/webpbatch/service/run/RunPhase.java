package com.phillippitts.webpbatch.service.run;

/**
 * Phases a run moves through.
 *
 * <pre>
 * IDLE → ENCODER_CHECK → UNAVAILABLE → FINISHED
 *                      → SCANNING → (PREPARING_OUTPUT → CONVERTING → FINALIZING)* → FINISHED
 * </pre>
 */
public enum RunPhase {
    IDLE,
    ENCODER_CHECK,
    UNAVAILABLE,
    SCANNING,
    PREPARING_OUTPUT,
    CONVERTING,
    FINALIZING,
    FINISHED
}

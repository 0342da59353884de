package com.phillippitts.webpbatch.service.run.event;

/**
 * Emitted whenever the run's progress percentage increases.
 *
 * @param runId   run identifier
 * @param percent whole percentage, 0 to 100, non-decreasing within a run
 */
public record RunProgressEvent(String runId, int percent) {}

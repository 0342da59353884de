package com.phillippitts.webpbatch.service.run.event;

/**
 * Last event of every run; no further events carry this run id.
 *
 * @param runId run identifier
 */
public record RunFinishedEvent(String runId) {}

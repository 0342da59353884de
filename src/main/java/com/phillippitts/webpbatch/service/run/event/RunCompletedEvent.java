package com.phillippitts.webpbatch.service.run.event;

import com.phillippitts.webpbatch.domain.RunConfiguration;
import com.phillippitts.webpbatch.domain.RunSummary;
import com.phillippitts.webpbatch.service.run.RunOutcome;

import java.time.Instant;

/**
 * Carries the terminal summary of a run. Published exactly once per run, before
 * {@link RunFinishedEvent}.
 *
 * @param runId         run identifier
 * @param configuration configuration the run was started with
 * @param outcome       how the run ended
 * @param summary       folder and run statistics
 * @param timestamp     when the run ended
 */
public record RunCompletedEvent(
        String runId,
        RunConfiguration configuration,
        RunOutcome outcome,
        RunSummary summary,
        Instant timestamp
) {}

package com.phillippitts.webpbatch.service.run;

import com.phillippitts.webpbatch.domain.RunConfiguration;
import com.phillippitts.webpbatch.domain.RunSummary;

/**
 * Drives one conversion run from encoder check to final summary.
 *
 * <p>Implementations run synchronously on the calling thread, publish progress, status,
 * completion and finished events while they work, and always return a summary: a missing
 * encoder, cancellation and per-folder failures all end in a {@link RunSummary}.
 */
public interface RunCoordinator {

    /**
     * Runs the conversion.
     *
     * @param runId  identifier stamped on every published event
     * @param config run configuration
     * @param token  cancellation flag polled at the run's checkpoints
     * @return the run summary, also published in a completion event
     */
    RunSummary run(String runId, RunConfiguration config, CancellationToken token);
}

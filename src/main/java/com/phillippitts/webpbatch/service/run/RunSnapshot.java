package com.phillippitts.webpbatch.service.run;

import com.phillippitts.webpbatch.domain.RunSummary;

import java.time.Instant;
import java.util.Objects;

/**
 * Latest known view of a run, replaced as run events arrive.
 *
 * @param runId      run identifier
 * @param state      current state
 * @param percent    last emitted progress percentage
 * @param status     last status line
 * @param startedAt  when the run was accepted
 * @param finishedAt when the run finished; null while running
 * @param outcome    how the run ended; null until the summary is available
 * @param summary    terminal summary; null until available
 */
public record RunSnapshot(
        String runId,
        RunState state,
        int percent,
        String status,
        Instant startedAt,
        Instant finishedAt,
        RunOutcome outcome,
        RunSummary summary
) {

    public RunSnapshot {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    static RunSnapshot started(String runId, Instant startedAt) {
        return new RunSnapshot(runId, RunState.RUNNING, 0, "Starting", startedAt, null, null, null);
    }

    RunSnapshot withPercent(int value) {
        return new RunSnapshot(runId, state, Math.max(percent, value), status, startedAt, finishedAt,
                outcome, summary);
    }

    RunSnapshot withStatus(String value) {
        return new RunSnapshot(runId, state, percent, value, startedAt, finishedAt, outcome, summary);
    }

    RunSnapshot withState(RunState value) {
        return new RunSnapshot(runId, value, percent, status, startedAt, finishedAt, outcome, summary);
    }

    RunSnapshot completed(RunOutcome value, RunSummary runSummary) {
        return new RunSnapshot(runId, state, percent, status, startedAt, finishedAt, value, runSummary);
    }

    RunSnapshot finished(Instant at) {
        RunState terminal = summary == null ? RunState.FAILED : RunState.FINISHED;
        return new RunSnapshot(runId, terminal, percent, status, startedAt, at, outcome, summary);
    }

    public boolean isActive() {
        return state == RunState.RUNNING || state == RunState.CANCELLING;
    }
}

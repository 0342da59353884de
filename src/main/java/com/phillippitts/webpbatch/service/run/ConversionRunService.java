package com.phillippitts.webpbatch.service.run;

import com.phillippitts.webpbatch.domain.RunConfiguration;
import com.phillippitts.webpbatch.exception.NoRunException;
import com.phillippitts.webpbatch.exception.RunAlreadyActiveException;
import com.phillippitts.webpbatch.service.metrics.ConversionMetrics;
import com.phillippitts.webpbatch.service.run.event.RunCompletedEvent;
import com.phillippitts.webpbatch.service.run.event.RunFinishedEvent;
import com.phillippitts.webpbatch.service.run.event.RunProgressEvent;
import com.phillippitts.webpbatch.service.run.event.RunStatusEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Entry point for starting, observing and cancelling conversion runs.
 *
 * <p>At most one run is active at a time. The run executes on the {@code conversionExecutor};
 * this service keeps the latest {@link RunSnapshot}, updated from the run's events, so callers
 * can poll it.
 *
 * <p><b>Thread Safety:</b> start and cancel are serialized on an internal lock. The snapshot is
 * replaced atomically and only events carrying the current run id are applied.
 */
@Service
public class ConversionRunService {

    private static final Logger LOG = LogManager.getLogger(ConversionRunService.class);
    static final String RUN_ID_KEY = "runId";

    private final RunCoordinator coordinator;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final ConversionMetrics metrics;

    private final Object lock = new Object();
    private ActiveRun active; // guarded by lock
    private final AtomicReference<RunSnapshot> latest = new AtomicReference<>();

    public ConversionRunService(RunCoordinator coordinator,
                                @Qualifier("conversionExecutor") Executor executor,
                                ApplicationEventPublisher publisher,
                                ConversionMetrics metrics) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Starts a run in the background.
     *
     * @param config run configuration
     * @return the snapshot of the accepted run
     * @throws RunAlreadyActiveException if another run has not finished yet
     */
    public RunSnapshot start(RunConfiguration config) {
        Objects.requireNonNull(config, "config");
        synchronized (lock) {
            if (active != null) {
                throw new RunAlreadyActiveException(active.runId());
            }
            String runId = UUID.randomUUID().toString();
            CancellationToken token = new CancellationToken();
            RunSnapshot initial = RunSnapshot.started(runId, Instant.now());
            active = new ActiveRun(runId, token);
            latest.set(initial);
            LOG.info("Accepted run {}: folders={}, quality={}, mode={}, format={}", runId,
                    config.folders().size(), config.quality(), config.outputMode(), config.archiveFormat());
            try {
                executor.execute(() -> execute(runId, config, token));
            } catch (RejectedExecutionException e) {
                active = null;
                latest.set(initial.withStatus("Rejected: conversion executor is busy").finished(Instant.now()));
                throw e;
            }
            return latest.get();
        }
    }

    /**
     * @return the snapshot of the active run, or of the last finished one
     * @throws NoRunException if no run was ever started
     */
    public RunSnapshot current() {
        RunSnapshot snapshot = latest.get();
        if (snapshot == null) {
            throw new NoRunException();
        }
        return snapshot;
    }

    /**
     * Requests cancellation of the active run. The run stops at its next checkpoint; calling
     * this again, or after the run finished, has no further effect.
     *
     * @return the current snapshot
     * @throws NoRunException if no run was ever started
     */
    public RunSnapshot cancel() {
        synchronized (lock) {
            if (active != null && active.token().cancel()) {
                LOG.info("Cancellation requested for run {}", active.runId());
                String runId = active.runId();
                update(runId, s -> s.state() == RunState.RUNNING ? s.withState(RunState.CANCELLING) : s);
            }
        }
        return current();
    }

    /**
     * @return id of the run that is still active, if any
     */
    public Optional<String> activeRunId() {
        synchronized (lock) {
            return active == null ? Optional.empty() : Optional.of(active.runId());
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return active != null;
        }
    }

    private void execute(String runId, RunConfiguration config, CancellationToken token) {
        ThreadContext.put(RUN_ID_KEY, runId);
        try {
            coordinator.run(runId, config, token);
        } catch (RuntimeException e) {
            LOG.error("Run {} failed unexpectedly", runId, e);
            publisher.publishEvent(RunStatusEvent.of(runId, "Run failed: " + e.getMessage()));
            publisher.publishEvent(new RunFinishedEvent(runId));
        } finally {
            synchronized (lock) {
                release(runId);
            }
            ThreadContext.remove(RUN_ID_KEY);
        }
    }

    @EventListener
    public void onProgress(RunProgressEvent event) {
        update(event.runId(), s -> s.withPercent(event.percent()));
    }

    @EventListener
    public void onStatus(RunStatusEvent event) {
        update(event.runId(), s -> s.withStatus(event.message()));
    }

    @EventListener
    public void onCompleted(RunCompletedEvent event) {
        update(event.runId(), s -> s.completed(event.outcome(), event.summary()));
        metrics.recordRun(event.outcome(), event.summary());
        LOG.info("Run {} {}: converted={}, errors={}, saved={} bytes, {}s", event.runId(),
                event.outcome(), event.summary().totals().converted(), event.summary().totals().errors(),
                event.summary().totals().bytesSaved(), String.format("%.1f", event.summary().durationSeconds()));
    }

    /**
     * Marks the run finished and frees the slot in one step, so a caller that sees a finished
     * snapshot can start the next run right away.
     */
    @EventListener
    public void onFinished(RunFinishedEvent event) {
        synchronized (lock) {
            update(event.runId(), s -> s.finished(Instant.now()));
            release(event.runId());
        }
    }

    // Caller holds lock
    private void release(String runId) {
        if (active != null && active.runId().equals(runId)) {
            active = null;
        }
    }

    private void update(String runId, UnaryOperator<RunSnapshot> change) {
        latest.updateAndGet(s -> s != null && s.runId().equals(runId) ? change.apply(s) : s);
    }

    private record ActiveRun(String runId, CancellationToken token) {}
}

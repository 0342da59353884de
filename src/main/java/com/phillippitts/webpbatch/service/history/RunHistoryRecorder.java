package com.phillippitts.webpbatch.service.history;

import com.phillippitts.webpbatch.config.properties.HistoryProperties;
import com.phillippitts.webpbatch.domain.RunConfiguration;
import com.phillippitts.webpbatch.domain.RunSummary;
import com.phillippitts.webpbatch.service.run.RunOutcome;
import com.phillippitts.webpbatch.service.run.event.RunCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Appends every run that reached the folder stage to the history.
 *
 * <p>Runs that ended because the encoder was missing are not recorded.
 */
@Component
public class RunHistoryRecorder {

    private static final Logger LOG = LogManager.getLogger(RunHistoryRecorder.class);

    private final RunHistoryStore store;
    private final HistoryProperties properties;

    public RunHistoryRecorder(RunHistoryStore store, HistoryProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @EventListener
    public void onRunCompleted(RunCompletedEvent event) {
        if (!properties.enabled() || event.outcome() == RunOutcome.ENCODER_UNAVAILABLE) {
            return;
        }
        store.append(toEntry(event));
        LOG.debug("Recorded run {} in history", event.runId());
    }

    static HistoryEntry toEntry(RunCompletedEvent event) {
        RunConfiguration config = event.configuration();
        RunSummary summary = event.summary();
        return new HistoryEntry(
                event.timestamp(),
                config.folders().stream().map(Path::toString).toList(),
                config.quality(),
                config.archiveFormat(),
                config.replaceOriginals(),
                config.skipExistingWebp(),
                summary.cancelled(),
                summary.totals().converted(),
                summary.totals().errors(),
                summary.totals().bytesSaved(),
                summary.durationSeconds());
    }
}

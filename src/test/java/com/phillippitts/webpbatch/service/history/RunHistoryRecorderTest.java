package com.phillippitts.webpbatch.service.history;

import com.phillippitts.webpbatch.config.properties.HistoryProperties;
import com.phillippitts.webpbatch.domain.ArchiveFormat;
import com.phillippitts.webpbatch.domain.FolderSummary;
import com.phillippitts.webpbatch.domain.RunConfiguration;
import com.phillippitts.webpbatch.domain.RunSummary;
import com.phillippitts.webpbatch.service.run.RunOutcome;
import com.phillippitts.webpbatch.service.run.event.RunCompletedEvent;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RunHistoryRecorderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final RunHistoryStore store = mock(RunHistoryStore.class);

    @Test
    void recordsCompletedRun() {
        RunHistoryRecorder recorder = new RunHistoryRecorder(store, properties(true));
        RunCompletedEvent event = event(RunOutcome.COMPLETED);

        recorder.onRunCompleted(event);

        verify(store).append(RunHistoryRecorder.toEntry(event));
    }

    @Test
    void recordsCancelledRun() {
        RunHistoryRecorder recorder = new RunHistoryRecorder(store, properties(true));

        recorder.onRunCompleted(event(RunOutcome.CANCELLED));

        verify(store).append(any());
    }

    @Test
    void skipsRunWithoutEncoder() {
        RunHistoryRecorder recorder = new RunHistoryRecorder(store, properties(true));

        recorder.onRunCompleted(event(RunOutcome.ENCODER_UNAVAILABLE));

        verify(store, never()).append(any());
    }

    @Test
    void skipsWhenDisabled() {
        RunHistoryRecorder recorder = new RunHistoryRecorder(store, properties(false));

        recorder.onRunCompleted(event(RunOutcome.COMPLETED));

        verify(store, never()).append(any());
    }

    @Test
    void entryCarriesConfigurationAndTotals() {
        HistoryEntry entry = RunHistoryRecorder.toEntry(event(RunOutcome.COMPLETED));

        assertThat(entry.timestamp()).isEqualTo(NOW);
        assertThat(entry.folders()).containsExactly(Path.of("/comics/vol1").toString());
        assertThat(entry.quality()).isEqualTo(90);
        assertThat(entry.archiveFormat()).isEqualTo(ArchiveFormat.CBZ);
        assertThat(entry.replace()).isFalse();
        assertThat(entry.skipWebp()).isTrue();
        assertThat(entry.converted()).isEqualTo(3);
        assertThat(entry.errors()).isEqualTo(1);
        assertThat(entry.bytesSaved()).isEqualTo(400L);
        assertThat(entry.durationSeconds()).isEqualTo(1.5);
    }

    private static HistoryProperties properties(boolean enabled) {
        return new HistoryProperties(enabled, "unused.json", 20);
    }

    private static RunCompletedEvent event(RunOutcome outcome) {
        RunConfiguration config = new RunConfiguration(List.of(Path.of("/comics/vol1")), 90,
                ArchiveFormat.CBZ, false, true);
        FolderSummary folder = new FolderSummary("/comics/vol1", 3, 0, List.of("x.png: bad"),
                1000L, 600L, 900L, "/comics/vol1.cbz", 1.4);
        RunSummary summary = RunSummary.of(outcome == RunOutcome.CANCELLED, 1.5, 4, 4, 4, List.of(folder));
        return new RunCompletedEvent("run-1", config, outcome, summary, NOW);
    }
}

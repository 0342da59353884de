package com.phillippitts.webpbatch.service.history;

import com.phillippitts.webpbatch.domain.ArchiveFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileRunHistoryStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingFileReadsAsEmpty() {
        JsonFileRunHistoryStore store = new JsonFileRunHistoryStore(dir.resolve("history.json"), 20);

        assertThat(store.list()).isEmpty();
    }

    @Test
    void appendKeepsNewestFirst() {
        JsonFileRunHistoryStore store = new JsonFileRunHistoryStore(dir.resolve("history.json"), 20);

        store.append(entry(1, 10));
        store.append(entry(2, 20));

        assertThat(store.list()).extracting(HistoryEntry::converted).containsExactly(20, 10);
    }

    @Test
    void appendDropsEntriesBeyondCap() {
        JsonFileRunHistoryStore store = new JsonFileRunHistoryStore(dir.resolve("history.json"), 3);

        for (int i = 1; i <= 5; i++) {
            store.append(entry(i, i));
        }

        assertThat(store.list()).extracting(HistoryEntry::converted).containsExactly(5, 4, 3);
    }

    @Test
    void entriesSurviveANewStoreInstance() {
        Path file = dir.resolve("nested/history.json");
        HistoryEntry original = entry(7, 42);
        new JsonFileRunHistoryStore(file, 20).append(original);

        List<HistoryEntry> loaded = new JsonFileRunHistoryStore(file, 20).list();

        assertThat(loaded).containsExactly(original);
        assertThat(file.resolveSibling("history.json.tmp")).doesNotExist();
    }

    @Test
    void writesSnakeCaseKeys() throws Exception {
        Path file = dir.resolve("history.json");
        new JsonFileRunHistoryStore(file, 20).append(entry(1, 3));

        String json = Files.readString(file, StandardCharsets.UTF_8);

        assertThat(json).contains("\"archive_format\"", "\"skip_webp\"", "\"bytes_saved\"", "\"duration_seconds\"");
    }

    @Test
    void malformedFileReadsAsEmptyAndIsOverwrittenOnAppend() throws Exception {
        Path file = dir.resolve("history.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);
        JsonFileRunHistoryStore store = new JsonFileRunHistoryStore(file, 20);

        assertThat(store.list()).isEmpty();

        store.append(entry(1, 1));
        assertThat(store.list()).hasSize(1);
    }

    @Test
    void malformedEntriesAreSkipped() throws Exception {
        Path file = dir.resolve("history.json");
        Files.writeString(file, "[{\"timestamp\":\"yesterday\",\"quality\":75}, 17,"
                + "{\"timestamp\":\"2024-05-01T10:00:00Z\",\"quality\":80,\"converted\":4}]", StandardCharsets.UTF_8);

        List<HistoryEntry> entries = new JsonFileRunHistoryStore(file, 20).list();

        assertThat(entries).singleElement().satisfies(e -> {
            assertThat(e.quality()).isEqualTo(80);
            assertThat(e.converted()).isEqualTo(4);
            assertThat(e.archiveFormat()).isEqualTo(ArchiveFormat.ZIP);
            assertThat(e.skipWebp()).isTrue();
            assertThat(e.folders()).isEmpty();
        });
    }

    @Test
    void clearRemovesFile() {
        Path file = dir.resolve("history.json");
        JsonFileRunHistoryStore store = new JsonFileRunHistoryStore(file, 20);
        store.append(entry(1, 1));

        store.clear();

        assertThat(file).doesNotExist();
        assertThat(store.list()).isEmpty();
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThatThrownBy(() -> new JsonFileRunHistoryStore(dir.resolve("h.json"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static HistoryEntry entry(int second, int converted) {
        return new HistoryEntry(Instant.parse("2024-05-01T10:00:00Z").plusSeconds(second),
                List.of("/comics/vol1", "/comics/vol2"), 80, ArchiveFormat.CBZ, false, true, false,
                converted, 1, 1234L, 2.5);
    }
}

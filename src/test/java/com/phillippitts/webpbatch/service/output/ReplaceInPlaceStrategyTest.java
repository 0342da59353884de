package com.phillippitts.webpbatch.service.output;

import com.phillippitts.webpbatch.domain.ArchiveFormat;
import com.phillippitts.webpbatch.domain.FolderBatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReplaceInPlaceStrategyTest {

    @TempDir
    Path root;

    private final ReplaceInPlaceStrategy strategy = new ReplaceInPlaceStrategy();

    @Test
    void replacesConvertedOriginalsAndRemovesTempDir() throws Exception {
        Path folder = Files.createDirectory(root.resolve("vol"));
        Path a = Files.write(folder.resolve("a.png"), new byte[100]);
        Path b = Files.write(folder.resolve("b.jpg"), new byte[100]);
        Path tmp = Files.createDirectory(folder.resolve(".webp_tmp"));
        Map<Path, Path> produced = new LinkedHashMap<>();
        produced.put(a, Files.write(tmp.resolve("a.webp"), new byte[40]));
        produced.put(b, Files.write(tmp.resolve("b.webp"), new byte[30]));
        FolderBatch batch = new FolderBatch(folder, List.of(a, b), List.of(a, b), List.of());

        OutputResult result = strategy.apply(new FolderOutput(batch, tmp, produced), ArchiveFormat.ZIP);

        assertThat(result.errors()).isEmpty();
        assertThat(result.archivePath()).isNull();
        assertThat(a).doesNotExist();
        assertThat(b).doesNotExist();
        assertThat(Files.size(folder.resolve("a.webp"))).isEqualTo(40L);
        assertThat(Files.size(folder.resolve("b.webp"))).isEqualTo(30L);
        assertThat(tmp).doesNotExist();
    }

    @Test
    void keepsOriginalWhoseConversionFailed() throws Exception {
        Path folder = Files.createDirectory(root.resolve("vol"));
        Path ok = Files.write(folder.resolve("ok.png"), new byte[10]);
        Path failed = Files.write(folder.resolve("failed.png"), new byte[10]);
        Path tmp = Files.createDirectory(folder.resolve(".webp_tmp"));
        Map<Path, Path> produced = Map.of(ok, Files.write(tmp.resolve("ok.webp"), new byte[5]));
        FolderBatch batch = new FolderBatch(folder, List.of(failed, ok), List.of(failed, ok), List.of());

        strategy.apply(new FolderOutput(batch, tmp, produced), ArchiveFormat.ZIP);

        assertThat(failed).exists();
        assertThat(ok).doesNotExist();
        assertThat(folder.resolve("ok.webp")).exists();
    }

    @Test
    void originalAlreadyGoneIsNotAnError() throws Exception {
        Path folder = Files.createDirectory(root.resolve("vol"));
        Path vanished = folder.resolve("gone.png");
        Path tmp = Files.createDirectory(folder.resolve(".webp_tmp"));
        Map<Path, Path> produced = Map.of(vanished, Files.write(tmp.resolve("gone.webp"), new byte[5]));
        FolderBatch batch = new FolderBatch(folder, List.of(vanished), List.of(vanished), List.of());

        OutputResult result = strategy.apply(new FolderOutput(batch, tmp, produced), ArchiveFormat.ZIP);

        assertThat(result.errors()).isEmpty();
        assertThat(folder.resolve("gone.webp")).exists();
    }

    @Test
    void leavesSkippedWebpUntouched() throws Exception {
        Path folder = Files.createDirectory(root.resolve("vol"));
        Path existing = Files.write(folder.resolve("old.webp"), new byte[7]);
        Path tmp = Files.createDirectory(folder.resolve(".webp_tmp"));
        FolderBatch batch = new FolderBatch(folder, List.of(existing), List.of(), List.of(existing));

        OutputResult result = strategy.apply(new FolderOutput(batch, tmp, Map.of()), ArchiveFormat.ZIP);

        assertThat(result.errors()).isEmpty();
        assertThat(existing).hasSize(7);
        assertThat(tmp).doesNotExist();
    }
}

package com.phillippitts.webpbatch.service.scan;

import com.phillippitts.webpbatch.domain.FolderBatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FolderScannerTest {

    @TempDir
    Path root;

    private final FolderScanner scanner = new FolderScanner();

    @Test
    void partitionsWebpIntoSkippedWhenSkipEnabled() throws Exception {
        Path folder = folderWith("vol1", "b.png", "a.jpg", "c.webp", "notes.txt", "d.JPEG");

        FolderBatch batch = scanner.scanFolder(folder, true);

        assertThat(names(batch.allImages())).containsExactly("a.jpg", "b.png", "c.webp", "d.JPEG");
        assertThat(names(batch.convertible())).containsExactly("a.jpg", "b.png", "d.JPEG");
        assertThat(names(batch.skippedWebp())).containsExactly("c.webp");
    }

    @Test
    void webpIsConvertibleWhenSkipDisabled() throws Exception {
        Path folder = folderWith("vol1", "a.webp", "b.tiff");

        FolderBatch batch = scanner.scanFolder(folder, false);

        assertThat(names(batch.convertible())).containsExactly("a.webp", "b.tiff");
        assertThat(batch.skippedWebp()).isEmpty();
    }

    @Test
    void doesNotRecurseIntoSubfolders() throws Exception {
        Path folder = folderWith("vol1", "a.png");
        Path nested = Files.createDirectory(folder.resolve("nested.png"));
        Files.write(nested.resolve("inner.png"), new byte[1]);

        FolderBatch batch = scanner.scanFolder(folder, true);

        assertThat(names(batch.allImages())).containsExactly("a.png");
    }

    @Test
    void missingFolderIsReportedAndExcluded() throws Exception {
        Path present = folderWith("vol1", "a.png");
        Path missing = root.resolve("does-not-exist");
        List<String> status = new ArrayList<>();

        ScanResult result = scanner.scan(List.of(missing, present), true, status::add);

        assertThat(result.batches()).extracting(FolderBatch::folder).containsExactly(present);
        assertThat(result.missingFolders()).containsExactly(missing);
        assertThat(status).singleElement().asString().contains("does-not-exist");
    }

    @Test
    void regularFileIsTreatedAsMissingFolder() throws Exception {
        Path file = Files.write(root.resolve("file.png"), new byte[1]);

        ScanResult result = scanner.scan(List.of(file), true, s -> { });

        assertThat(result.batches()).isEmpty();
        assertThat(result.missingFolders()).containsExactly(file);
    }

    @Test
    void workUnitsCountAllEligibleFiles() throws Exception {
        Path a = folderWith("a", "1.png", "2.webp");
        Path b = folderWith("b", "3.webp");

        ScanResult result = scanner.scan(List.of(a, b), true, s -> { });

        assertThat(result.totalConvertible()).isEqualTo(1);
        assertThat(result.totalFiles()).isEqualTo(3);
        assertThat(result.totalWorkUnits()).isEqualTo(3);
    }

    @Test
    void emptyScanHasNoWorkUnits() {
        ScanResult result = new ScanResult(List.of(), List.of());

        assertThat(result.totalWorkUnits()).isZero();
    }

    private Path folderWith(String name, String... files) throws Exception {
        Path folder = Files.createDirectory(root.resolve(name));
        for (String f : files) {
            Files.write(folder.resolve(f), new byte[8]);
        }
        return folder;
    }

    private static List<String> names(List<Path> paths) {
        return paths.stream().map(p -> p.getFileName().toString()).toList();
    }
}

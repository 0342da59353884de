package com.phillippitts.webpbatch.service.scan;

import com.phillippitts.webpbatch.domain.FolderBatch;
import com.phillippitts.webpbatch.domain.ImageFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Enumerates the images directly inside each requested folder (no recursion) and splits them
 * into convertible images and WebP files left out by skip mode.
 *
 * <p>Files are sorted by name so progress counts are reproducible within a run.
 */
@Component
public class FolderScanner {

    private static final Logger LOG = LogManager.getLogger(FolderScanner.class);

    /**
     * Scans every folder. Folders that do not exist or cannot be listed are reported through
     * {@code status} and left out of the result.
     *
     * @param folders          folders in processing order
     * @param skipExistingWebp put WebP files into {@code skippedWebp} instead of {@code convertible}
     * @param status           receives one line per missing folder
     * @return batches for the usable folders
     */
    public ScanResult scan(List<Path> folders, boolean skipExistingWebp, Consumer<String> status) {
        List<FolderBatch> batches = new ArrayList<>();
        List<Path> missing = new ArrayList<>();

        for (Path folder : folders) {
            if (!Files.isDirectory(folder)) {
                LOG.warn("Folder does not exist: {}", folder);
                status.accept("Folder not found, skipping: " + folder);
                missing.add(folder);
                continue;
            }
            try {
                FolderBatch batch = scanFolder(folder, skipExistingWebp);
                LOG.debug("Scanned {}: {} images, {} convertible, {} already WebP", folder,
                        batch.allImages().size(), batch.convertible().size(), batch.skippedWebp().size());
                batches.add(batch);
            } catch (IOException | UncheckedIOException e) {
                LOG.warn("Cannot list folder {}: {}", folder, e.toString());
                status.accept("Folder cannot be read, skipping: " + folder);
                missing.add(folder);
            }
        }
        return new ScanResult(batches, missing);
    }

    // Visible for tests
    FolderBatch scanFolder(Path folder, boolean skipExistingWebp) throws IOException {
        List<Path> images;
        try (Stream<Path> entries = Files.list(folder)) {
            images = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> ImageFormat.of(p).isPresent())
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        List<Path> convertible = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        for (Path image : images) {
            boolean webp = ImageFormat.of(image).map(ImageFormat::isTarget).orElse(false);
            if (skipExistingWebp && webp) {
                skipped.add(image);
            } else {
                convertible.add(image);
            }
        }
        return new FolderBatch(folder, images, convertible, skipped);
    }
}

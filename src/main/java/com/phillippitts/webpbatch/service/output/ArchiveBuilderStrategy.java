package com.phillippitts.webpbatch.service.output;

import com.phillippitts.webpbatch.domain.ArchiveFormat;
import com.phillippitts.webpbatch.domain.OutputMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packs the WebP files of a folder into one archive placed next to the folder.
 *
 * <p>The archive is named after the folder ({@code <parent>/<folder>.zip} or {@code .cbz}).
 * WebP originals that skip mode left out are added too, so the archive holds the complete
 * set. Source files are never touched. The temporary directory is removed on every path.
 */
@Component
public class ArchiveBuilderStrategy implements OutputStrategy {

    private static final Logger LOG = LogManager.getLogger(ArchiveBuilderStrategy.class);

    @Override
    public OutputMode mode() {
        return OutputMode.ARCHIVE;
    }

    @Override
    public OutputResult apply(FolderOutput output, ArchiveFormat archiveFormat) {
        List<String> errors = new ArrayList<>();
        Path archive;
        try {
            archive = buildArchive(output, archiveFormat, errors);
        } finally {
            ReplaceInPlaceStrategy.removeTempDir(output.tempDir(), errors);
        }
        if (archive == null) {
            return OutputResult.withoutArchive(errors);
        }
        return OutputResult.archived(archive, sizeOrNull(archive), errors);
    }

    private Path buildArchive(FolderOutput output, ArchiveFormat archiveFormat, List<String> errors) {
        Path folder = output.batch().folder();
        Path absolute = folder.toAbsolutePath().normalize();
        Path parent = absolute.getParent();
        if (parent == null || absolute.getFileName() == null) {
            errors.add("Cannot create archive for " + folder + ": folder has no parent directory");
            return null;
        }
        Path target = parent.resolve(archiveFormat.fileNameFor(absolute.getFileName().toString()));

        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.warn("Could not remove existing archive {}: {}", target, e.toString());
            errors.add("Could not remove existing archive " + target + ": " + e.getMessage());
            return null;
        }

        List<Path> entries = collectEntries(output, errors);
        try {
            write(target, entries);
        } catch (IOException e) {
            LOG.warn("Could not create archive {}: {}", target, e.toString());
            errors.add("Could not create archive " + target + ": " + e.getMessage());
            deletePartial(target);
            return null;
        }
        LOG.info("Created archive {} ({} entries)", target, entries.size());
        return target;
    }

    // Produced WebP files sorted by name, then skip-excluded originals
    private static List<Path> collectEntries(FolderOutput output, List<String> errors) {
        List<Path> produced = new ArrayList<>();
        for (Path webp : output.produced().values()) {
            if (Files.exists(webp)) {
                produced.add(webp);
            }
        }
        produced.sort(Comparator.comparing(p -> p.getFileName().toString()));

        Set<String> names = new HashSet<>();
        List<Path> entries = new ArrayList<>();
        for (Path p : produced) {
            names.add(p.getFileName().toString());
            entries.add(p);
        }
        for (Path original : output.batch().skippedWebp()) {
            String name = original.getFileName().toString();
            if (names.add(name)) {
                entries.add(original);
            } else {
                LOG.warn("Archive already holds an entry named {}; original not added", name);
                errors.add("Archive entry " + name + " is taken by a converted image; original not added");
            }
        }
        return entries;
    }

    private static void write(Path target, List<Path> entries) throws IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target));
             ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.setMethod(ZipOutputStream.DEFLATED);
            zip.setLevel(Deflater.DEFAULT_COMPRESSION);
            for (Path file : entries) {
                zip.putNextEntry(new ZipEntry(file.getFileName().toString()));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }

    private static void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.debug("Could not delete partial archive {}: {}", target, e.toString());
        }
    }

    private static Long sizeOrNull(Path target) {
        try {
            return Files.size(target);
        } catch (IOException e) {
            LOG.debug("Could not read archive size of {}: {}", target, e.toString());
            return null;
        }
    }
}

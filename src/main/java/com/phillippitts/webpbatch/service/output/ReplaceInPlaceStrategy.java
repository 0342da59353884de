package com.phillippitts.webpbatch.service.output;

import com.phillippitts.webpbatch.domain.ArchiveFormat;
import com.phillippitts.webpbatch.domain.OutputMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces the converted originals with their WebP files inside the source folder.
 *
 * <p>Originals are deleted first, then the WebP files are moved in from the temporary
 * directory. Only originals whose conversion succeeded are deleted. Every file is attempted
 * even if an earlier one failed; the temporary directory is removed at the end regardless.
 * The steps are not transactional.
 */
@Component
public class ReplaceInPlaceStrategy implements OutputStrategy {

    private static final Logger LOG = LogManager.getLogger(ReplaceInPlaceStrategy.class);

    @Override
    public OutputMode mode() {
        return OutputMode.REPLACE_IN_PLACE;
    }

    @Override
    public OutputResult apply(FolderOutput output, ArchiveFormat archiveFormat) {
        Path folder = output.batch().folder();
        List<String> errors = new ArrayList<>();

        try {
            for (Path original : output.batch().convertible()) {
                if (!output.produced().containsKey(original)) {
                    continue;
                }
                try {
                    Files.deleteIfExists(original);
                } catch (IOException e) {
                    LOG.warn("Could not delete original {}: {}", original, e.toString());
                    errors.add("Could not delete original " + original.getFileName() + ": " + e.getMessage());
                }
            }

            for (Map.Entry<Path, Path> entry : output.produced().entrySet()) {
                Path webp = entry.getValue();
                if (!Files.exists(webp)) {
                    continue;
                }
                Path destination = folder.resolve(webp.getFileName().toString());
                try {
                    Files.move(webp, destination, StandardCopyOption.REPLACE_EXISTING);
                } catch (IOException e) {
                    LOG.warn("Could not move {} into {}: {}", webp.getFileName(), folder, e.toString());
                    errors.add("Could not move " + webp.getFileName() + " into folder: " + e.getMessage());
                }
            }
        } finally {
            removeTempDir(output.tempDir(), errors);
        }

        LOG.info("Replaced originals in {} ({} files, {} errors)", folder, output.produced().size(), errors.size());
        return OutputResult.replaced(errors);
    }

    static void removeTempDir(Path tempDir, List<String> errors) {
        try {
            TempDirectories.deleteRecursively(tempDir);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary directory {}: {}", tempDir, e.toString());
            errors.add("Could not remove temporary directory " + tempDir + ": " + e.getMessage());
        }
    }
}

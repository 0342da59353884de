package com.phillippitts.webpbatch.service.output;

import com.phillippitts.webpbatch.domain.FolderBatch;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What the conversion loop produced for one folder, handed to the output strategy.
 *
 * @param batch    the scanned folder
 * @param tempDir  temporary directory holding the WebP files
 * @param produced source image to WebP file, for successful conversions only, in conversion order
 */
public record FolderOutput(FolderBatch batch, Path tempDir, Map<Path, Path> produced) {

    public FolderOutput {
        Objects.requireNonNull(batch, "batch must not be null");
        Objects.requireNonNull(tempDir, "tempDir must not be null");
        produced = Collections.unmodifiableMap(new LinkedHashMap<>(produced));
    }
}

package com.phillippitts.webpbatch.service.encoder;

import com.phillippitts.webpbatch.config.encoder.EncoderConfig;
import com.phillippitts.webpbatch.exception.EncoderNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the cwebp executable.
 *
 * <p>A configured value containing a path separator is treated as an explicit path; a bare
 * name is looked up in every directory of the search path (with {@code .exe} appended on
 * Windows). Nothing is installed or downloaded.
 */
@Component
public class EncoderLocator {

    private static final Logger LOG = LogManager.getLogger(EncoderLocator.class);

    private final EncoderConfig config;
    private final String searchPath;
    private final boolean windows;

    @Autowired
    public EncoderLocator(EncoderConfig config) {
        this(config, System.getenv("PATH"));
    }

    public EncoderLocator(EncoderConfig config, String searchPath) {
        this.config = Objects.requireNonNull(config, "config");
        this.searchPath = searchPath == null ? "" : searchPath;
        this.windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    /**
     * Resolves the encoder executable.
     *
     * @return absolute path of the executable, or empty when it cannot be found
     */
    public Optional<Path> locate() {
        String binary = config.binary();
        if (binary.contains("/") || binary.contains(File.separator)) {
            return asExecutable(binary);
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String candidate : candidateNames(binary)) {
                Optional<Path> found = asExecutable(dir + File.separator + candidate);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        LOG.debug("Encoder '{}' not found on search path", binary);
        return Optional.empty();
    }

    /**
     * Resolves the encoder executable or fails.
     *
     * @return absolute path of the executable
     * @throws EncoderNotFoundException when the executable cannot be found
     */
    public Path require() {
        return locate().orElseThrow(() -> new EncoderNotFoundException(config.binary()));
    }

    private List<String> candidateNames(String binary) {
        List<String> names = new ArrayList<>(2);
        names.add(binary);
        if (windows && !binary.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            names.add(binary + ".exe");
        }
        return names;
    }

    private static Optional<Path> asExecutable(String location) {
        try {
            Path path = Path.of(location).toAbsolutePath().normalize();
            if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                return Optional.of(path);
            }
        } catch (InvalidPathException e) {
            LOG.debug("Ignoring invalid search path entry '{}': {}", location, e.getMessage());
        }
        return Optional.empty();
    }
}

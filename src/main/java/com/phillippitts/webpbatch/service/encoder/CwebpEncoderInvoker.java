package com.phillippitts.webpbatch.service.encoder;

import com.phillippitts.webpbatch.config.encoder.EncoderConfig;
import com.phillippitts.webpbatch.domain.ConversionOutcome;
import com.phillippitts.webpbatch.exception.ConversionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link EncoderInvoker} backed by the cwebp command line tool.
 *
 * <p>Sizes are read with {@link Files#size(Path)}; a missing output after a clean exit is
 * logged and counted as 0 bytes rather than failing the image.
 */
@Component
public class CwebpEncoderInvoker implements EncoderInvoker {

    private static final Logger LOG = LogManager.getLogger(CwebpEncoderInvoker.class);

    private final CwebpProcessRunner runner;

    @Autowired
    public CwebpEncoderInvoker(EncoderConfig config) {
        this(new DefaultProcessFactory(), config);
    }

    CwebpEncoderInvoker(ProcessFactory processFactory, EncoderConfig config) {
        this.runner = new CwebpProcessRunner(
                Objects.requireNonNull(processFactory, "processFactory"),
                Objects.requireNonNull(config, "config"));
    }

    @Override
    public ConversionOutcome convert(Path binary, EncodeRequest request) {
        String fileName = String.valueOf(request.source().getFileName());
        long originalSize = sizeOrZero(request.source());
        try {
            runner.run(binary, request);
        } catch (ConversionException e) {
            LOG.debug("Conversion failed for {}: {}", fileName, e.getMessage());
            return ConversionOutcome.failure(originalSize, fileName + ": " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure converting {}", fileName, e);
            return ConversionOutcome.failure(originalSize, fileName + ": unexpected error: " + e);
        }

        long convertedSize = sizeOrZero(request.target());
        if (convertedSize == 0L && !Files.exists(request.target())) {
            LOG.warn("Encoder reported success but produced no output for {}", fileName);
        }
        LOG.debug("Converted {} ({} -> {} bytes, lossless={})", fileName, originalSize, convertedSize,
                request.lossless());
        return ConversionOutcome.success(originalSize, convertedSize);
    }

    private static long sizeOrZero(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            LOG.debug("Could not read size of {}: {}", file, e.toString());
            return 0L;
        }
    }
}

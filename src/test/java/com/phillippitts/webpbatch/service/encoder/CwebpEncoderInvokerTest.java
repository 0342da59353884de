package com.phillippitts.webpbatch.service.encoder;

import com.phillippitts.webpbatch.config.encoder.EncoderConfig;
import com.phillippitts.webpbatch.domain.ConversionOutcome;
import com.phillippitts.webpbatch.domain.ImageFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.phillippitts.webpbatch.service.encoder.EncoderTestDoubles.FailingProcessFactory;
import static com.phillippitts.webpbatch.service.encoder.EncoderTestDoubles.ProcessBehavior;
import static com.phillippitts.webpbatch.service.encoder.EncoderTestDoubles.RecordingProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;

class CwebpEncoderInvokerTest {

    private static final Path BINARY = Path.of("cwebp");

    @TempDir
    Path dir;

    @Test
    void successReportsOriginalAndConvertedSizes() throws Exception {
        Path src = Files.write(dir.resolve("page.png"), new byte[300]);
        Path dst = dir.resolve("page.webp");
        CwebpEncoderInvoker invoker = new CwebpEncoderInvoker(
                new RecordingProcessFactory(ProcessBehavior.succeeding(120)), EncoderConfig.defaults());

        ConversionOutcome outcome = invoker.convert(BINARY, new EncodeRequest(src, dst, 75, ImageFormat.PNG));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.originalSize()).isEqualTo(300);
        assertThat(outcome.convertedSize()).isEqualTo(120);
        assertThat(outcome.errorMessage()).isNull();
    }

    @Test
    void missingOutputAfterCleanExitCountsAsZeroBytes() throws Exception {
        Path src = Files.write(dir.resolve("page.jpg"), new byte[50]);
        CwebpEncoderInvoker invoker = new CwebpEncoderInvoker(
                new RecordingProcessFactory(new ProcessBehavior("", "", 0, -1)), EncoderConfig.defaults());

        ConversionOutcome outcome = invoker.convert(BINARY,
                new EncodeRequest(src, dir.resolve("page.webp"), 75, ImageFormat.JPEG));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.convertedSize()).isZero();
    }

    @Test
    void nonZeroExitBecomesFailurePrefixedWithFileName() throws Exception {
        Path src = Files.write(dir.resolve("broken.png"), new byte[10]);
        CwebpEncoderInvoker invoker = new CwebpEncoderInvoker(
                new RecordingProcessFactory(ProcessBehavior.failing(2, "Decoding failed")), EncoderConfig.defaults());

        ConversionOutcome outcome = invoker.convert(BINARY,
                new EncodeRequest(src, dir.resolve("broken.webp"), 80, ImageFormat.PNG));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.convertedSize()).isZero();
        assertThat(outcome.originalSize()).isEqualTo(10);
        assertThat(outcome.errorMessage()).startsWith("broken.png: ").contains("Non-zero exit: 2");
    }

    @Test
    void processStartFailureNeverThrows() throws Exception {
        Path src = Files.write(dir.resolve("a.tif"), new byte[10]);
        CwebpEncoderInvoker invoker = new CwebpEncoderInvoker(new FailingProcessFactory(), EncoderConfig.defaults());

        ConversionOutcome outcome = invoker.convert(BINARY,
                new EncodeRequest(src, dir.resolve("a.webp"), 80, ImageFormat.TIFF));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.errorMessage()).startsWith("a.tif: Encoder failure");
    }
}

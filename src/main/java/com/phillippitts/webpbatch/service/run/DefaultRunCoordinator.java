package com.phillippitts.webpbatch.service.run;

import com.phillippitts.webpbatch.config.properties.ConversionProperties;
import com.phillippitts.webpbatch.domain.ConversionOutcome;
import com.phillippitts.webpbatch.domain.FolderBatch;
import com.phillippitts.webpbatch.domain.FolderSummary;
import com.phillippitts.webpbatch.domain.ImageFormat;
import com.phillippitts.webpbatch.domain.OutputMode;
import com.phillippitts.webpbatch.domain.RunConfiguration;
import com.phillippitts.webpbatch.domain.RunSummary;
import com.phillippitts.webpbatch.exception.EncoderNotFoundException;
import com.phillippitts.webpbatch.service.encoder.EncodeRequest;
import com.phillippitts.webpbatch.service.encoder.EncoderInvoker;
import com.phillippitts.webpbatch.service.encoder.EncoderLocator;
import com.phillippitts.webpbatch.service.output.FolderOutput;
import com.phillippitts.webpbatch.service.output.OutputNames;
import com.phillippitts.webpbatch.service.output.OutputResult;
import com.phillippitts.webpbatch.service.output.OutputStrategies;
import com.phillippitts.webpbatch.service.output.OutputStrategy;
import com.phillippitts.webpbatch.service.output.TempDirectories;
import com.phillippitts.webpbatch.service.progress.ProgressTracker;
import com.phillippitts.webpbatch.service.run.event.RunCompletedEvent;
import com.phillippitts.webpbatch.service.run.event.RunFinishedEvent;
import com.phillippitts.webpbatch.service.run.event.RunProgressEvent;
import com.phillippitts.webpbatch.service.run.event.RunStatusEvent;
import com.phillippitts.webpbatch.service.scan.FolderScanner;
import com.phillippitts.webpbatch.service.scan.ScanResult;
import com.phillippitts.webpbatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sequential {@link RunCoordinator}: one folder, then one image, at a time.
 *
 * <p><b>Cancellation checkpoints:</b> before each folder (which is also before its output
 * directory is prepared), before each image's encode call, and after the image loop before the
 * output strategy runs. A folder interrupted inside its image loop still gets a summary with
 * what was converted so far; a folder that never started gets none.
 *
 * <p><b>Progress:</b> the denominator is the number of eligible files across all folders, or
 * the number of convertible images when that is zero. Each encode attempt adds one unit; the
 * WebP files skipped in a folder are added after its output strategy ran.
 *
 * <p><b>Error Handling:</b> image failures and folder-scoped failures are recorded in the
 * folder summary and never stop the run. Only a missing encoder ends the run early.
 *
 * @since 1.0
 */
@Component
public class DefaultRunCoordinator implements RunCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultRunCoordinator.class);

    private final EncoderLocator encoderLocator;
    private final FolderScanner scanner;
    private final EncoderInvoker encoder;
    private final OutputStrategies strategies;
    private final ConversionProperties properties;
    private final ApplicationEventPublisher publisher;

    public DefaultRunCoordinator(EncoderLocator encoderLocator,
                                 FolderScanner scanner,
                                 EncoderInvoker encoder,
                                 OutputStrategies strategies,
                                 ConversionProperties properties,
                                 ApplicationEventPublisher publisher) {
        this.encoderLocator = Objects.requireNonNull(encoderLocator, "encoderLocator must not be null");
        this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
        this.strategies = Objects.requireNonNull(strategies, "strategies must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public RunSummary run(String runId, RunConfiguration config, CancellationToken token) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(token, "token");

        RunContext ctx = new RunContext(runId, config, token);
        ctx.enter(RunPhase.ENCODER_CHECK);

        Path binary;
        try {
            binary = encoderLocator.require();
        } catch (EncoderNotFoundException e) {
            ctx.enter(RunPhase.UNAVAILABLE);
            LOG.error("Run {} aborted: {}", runId, e.getMessage());
            status(ctx, e.getMessage() + ". Install the WebP tools (cwebp) and retry.");
            return finish(ctx, RunOutcome.ENCODER_UNAVAILABLE, RunSummary.empty(ctx.elapsedSeconds()));
        }
        LOG.debug("Run {} using encoder {}", runId, binary);

        ctx.enter(RunPhase.SCANNING);
        status(ctx, "Scanning " + config.folders().size() + " folder(s)");
        ScanResult scan = scanner.scan(config.folders(), config.skipExistingWebp(), msg -> status(ctx, msg));
        int expected = scan.totalConvertible();
        int totalUnits = scan.totalWorkUnits();

        if (expected == 0) {
            status(ctx, "Nothing to convert");
            LOG.info("Run {}: nothing to convert in {} folder(s)", runId, scan.batches().size());
            return finish(ctx, RunOutcome.NOTHING_TO_CONVERT,
                    RunSummary.of(false, ctx.elapsedSeconds(), 0, 0, 0, List.of()));
        }

        ProgressTracker progress = new ProgressTracker(totalUnits,
                pct -> publisher.publishEvent(new RunProgressEvent(runId, pct)));
        OutputStrategy strategy = strategies.forMode(config.outputMode());
        status(ctx, "Converting " + expected + " image(s) in " + scan.batches().size() + " folder(s)");

        List<FolderSummary> folders = new ArrayList<>();
        for (FolderBatch batch : scan.batches()) {
            if (token.isCancellationRequested()) {
                return cancelled(ctx, totalUnits, progress, expected, folders);
            }
            FolderResult result = processFolder(ctx, binary, batch, strategy, progress);
            folders.add(result.summary());
            if (result.cancelled()) {
                return cancelled(ctx, totalUnits, progress, expected, folders);
            }
        }

        progress.complete();
        RunSummary summary = RunSummary.of(false, ctx.elapsedSeconds(), totalUnits, progress.processed(),
                expected, folders);
        status(ctx, "Done: " + summary.totals().converted() + " converted, "
                + summary.totals().errors() + " error(s)");
        return finish(ctx, RunOutcome.COMPLETED, summary);
    }

    private FolderResult processFolder(RunContext ctx, Path binary, FolderBatch batch,
                                       OutputStrategy strategy, ProgressTracker progress) {
        RunConfiguration config = ctx.config();
        Path folder = batch.folder();
        FolderStats stats = new FolderStats(batch);
        Path tempDir = folder.resolve(properties.getTempDirName());

        ctx.enter(RunPhase.PREPARING_OUTPUT);
        try {
            TempDirectories.prepare(tempDir);
        } catch (IOException e) {
            LOG.warn("Cannot prepare temporary directory {}: {}", tempDir, e.toString());
            stats.error("Could not prepare temporary directory " + tempDir + ": " + e.getMessage());
            return FolderResult.done(stats.seal());
        }

        if (!batch.hasConvertible() && config.outputMode() != OutputMode.REPLACE_IN_PLACE) {
            status(ctx, folder.getFileName() + ": nothing to convert, skipping");
            removeTempDir(tempDir, stats);
            return FolderResult.done(stats.seal());
        }

        ctx.enter(RunPhase.CONVERTING);
        Map<Path, String> names = OutputNames.assign(batch.convertible(), batch.skippedWebp());
        Map<Path, Path> produced = new LinkedHashMap<>();
        int index = 0;
        for (Path image : batch.convertible()) {
            if (ctx.token().isCancellationRequested()) {
                removeTempDir(tempDir, stats);
                return FolderResult.cancelled(stats.seal());
            }
            index++;
            status(ctx, folder.getFileName() + ": converting " + image.getFileName()
                    + " (" + index + "/" + batch.convertible().size() + ")");

            Path target = tempDir.resolve(names.get(image));
            ImageFormat format = ImageFormat.of(image)
                    .orElseThrow(() -> new IllegalStateException("Unsupported file in batch: " + image));
            ConversionOutcome outcome = encoder.convert(binary,
                    new EncodeRequest(image, target, config.quality(), format));
            progress.advance(1);

            stats.record(outcome);
            if (outcome.success()) {
                produced.put(image, target);
            } else {
                LOG.debug("Image failed in {}: {}", folder, outcome.errorMessage());
            }
        }

        if (ctx.token().isCancellationRequested()) {
            removeTempDir(tempDir, stats);
            return FolderResult.cancelled(stats.seal());
        }

        ctx.enter(RunPhase.FINALIZING);
        OutputResult result = strategy.apply(new FolderOutput(batch, tempDir, produced), config.archiveFormat());
        stats.errors(result.errors());
        if (result.archivePath() != null) {
            stats.archive(result.archivePath(), result.archiveSize());
        }
        progress.advance(batch.skippedWebp().size());

        FolderSummary summary = stats.seal();
        LOG.info("Folder {} done: converted={}, skipped={}, errors={}, saved={} bytes", folder,
                summary.converted(), summary.skippedExisting(), summary.errors().size(), summary.bytesSaved());
        return FolderResult.done(summary);
    }

    private RunSummary cancelled(RunContext ctx, int totalUnits, ProgressTracker progress, int expected,
                                 List<FolderSummary> folders) {
        LOG.info("Run {} cancelled after {} folder(s)", ctx.runId(), folders.size());
        status(ctx, "Cancelled");
        RunSummary summary = RunSummary.of(true, ctx.elapsedSeconds(), totalUnits, progress.processed(),
                expected, folders);
        return finish(ctx, RunOutcome.CANCELLED, summary);
    }

    private RunSummary finish(RunContext ctx, RunOutcome outcome, RunSummary summary) {
        ctx.enter(RunPhase.FINISHED);
        publisher.publishEvent(new RunCompletedEvent(ctx.runId(), ctx.config(), outcome, summary, Instant.now()));
        publisher.publishEvent(new RunFinishedEvent(ctx.runId()));
        return summary;
    }

    private void status(RunContext ctx, String message) {
        publisher.publishEvent(RunStatusEvent.of(ctx.runId(), message));
    }

    private static void removeTempDir(Path tempDir, FolderStats stats) {
        try {
            TempDirectories.deleteRecursively(tempDir);
        } catch (IOException e) {
            LOG.warn("Could not remove temporary directory {}: {}", tempDir, e.toString());
            stats.error("Could not remove temporary directory " + tempDir + ": " + e.getMessage());
        }
    }

    private record FolderResult(FolderSummary summary, boolean cancelled) {
        static FolderResult done(FolderSummary summary) {
            return new FolderResult(summary, false);
        }

        static FolderResult cancelled(FolderSummary summary) {
            return new FolderResult(summary, true);
        }
    }

    /**
     * Per-run state; the coordinator itself is stateless and shared.
     */
    private static final class RunContext {
        private final String runId;
        private final RunConfiguration config;
        private final CancellationToken token;
        private final long startNanos = System.nanoTime();
        private RunPhase phase = RunPhase.IDLE;

        RunContext(String runId, RunConfiguration config, CancellationToken token) {
            this.runId = runId;
            this.config = config;
            this.token = token;
        }

        void enter(RunPhase next) {
            LOG.trace("Run {}: {} -> {}", runId, phase, next);
            phase = next;
        }

        String runId() {
            return runId;
        }

        RunConfiguration config() {
            return config;
        }

        CancellationToken token() {
            return token;
        }

        double elapsedSeconds() {
            return TimeUtils.elapsedSeconds(startNanos);
        }
    }
}

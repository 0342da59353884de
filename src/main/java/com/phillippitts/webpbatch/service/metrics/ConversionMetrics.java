package com.phillippitts.webpbatch.service.metrics;

import com.phillippitts.webpbatch.domain.RunSummary;
import com.phillippitts.webpbatch.service.run.RunOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for conversion runs.
 *
 * <p>Provides:
 * <ul>
 *   <li>Run duration per outcome (completed, cancelled, encoder_unavailable, nothing_to_convert)</li>
 *   <li>Converted and failed image counts</li>
 *   <li>Bytes saved by conversion</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ConversionMetrics {

    static final String METRIC_PREFIX = "webpbatch.conversion";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one finished run.
     *
     * @param outcome how the run ended
     * @param summary the run's terminal summary
     */
    public void recordRun(RunOutcome outcome, RunSummary summary) {
        String tag = outcome.name().toLowerCase(Locale.ROOT);
        Timer.builder(METRIC_PREFIX + ".run.duration")
                .description("Wall time of a conversion run")
                .tag("outcome", tag)
                .register(registry)
                .record(Math.round(summary.durationSeconds() * 1000.0), TimeUnit.MILLISECONDS);

        increment(".images.converted", "Images successfully converted", summary.totals().converted());
        increment(".images.failed", "Images or folders that reported an error", summary.totals().errors());
        increment(".bytes.saved", "Bytes saved by conversion", summary.totals().bytesSaved());
    }

    private void increment(String suffix, String description, double amount) {
        Counter counter = Counter.builder(METRIC_PREFIX + suffix)
                .description(description)
                .register(registry);
        if (amount > 0) {
            counter.increment(amount);
        }
    }
}

package com.phillippitts.webpbatch.service.output;

import com.phillippitts.webpbatch.domain.OutputMode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the available output strategies, one per {@link OutputMode}.
 */
@Component
public class OutputStrategies {

    private final Map<OutputMode, OutputStrategy> byMode = new EnumMap<>(OutputMode.class);

    public OutputStrategies(List<OutputStrategy> strategies) {
        for (OutputStrategy strategy : strategies) {
            if (byMode.putIfAbsent(strategy.mode(), strategy) != null) {
                throw new IllegalStateException("Duplicate output strategy for mode " + strategy.mode());
            }
        }
    }

    /**
     * @param mode output mode of the run
     * @return the strategy for that mode
     * @throws IllegalStateException if no strategy is registered for the mode
     */
    public OutputStrategy forMode(OutputMode mode) {
        OutputStrategy strategy = byMode.get(mode);
        if (strategy == null) {
            throw new IllegalStateException("No output strategy registered for mode " + mode);
        }
        return strategy;
    }

    /**
     * Both built-in strategies, for tests and manual wiring.
     */
    public static OutputStrategies defaults() {
        return new OutputStrategies(List.of(new ReplaceInPlaceStrategy(), new ArchiveBuilderStrategy()));
    }
}

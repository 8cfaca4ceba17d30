package com.agenttrader.core.forecast;

import com.agenttrader.core.exception.InvalidSymbolException;
import com.agenttrader.core.indicator.IndicatorEngine;
import com.agenttrader.core.model.Bar;
import com.agenttrader.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds supervised samples from full bar histories: one sample per bar that has a complete
 * lookback and a known close {@code horizon} bars ahead.
 */
public final class TrainingSetBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TrainingSetBuilder.class);

    private final IndicatorEngine indicators;
    private final int horizon;

    public TrainingSetBuilder(IndicatorEngine indicators, int horizon) {
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be at least 1 bar");
        }
        this.indicators = indicators;
        this.horizon = horizon;
    }

    /**
     * Samples across all symbols, ordered by feature date (then symbol).
     * Symbols whose history is invalid are skipped with a warning.
     */
    public List<TrainingSample> build(Map<String, List<Bar>> histories) {
        List<TrainingSample> samples = new ArrayList<>();
        for (var entry : histories.entrySet()) {
            String symbol = entry.getKey();
            List<Bar> bars = entry.getValue();
            try {
                List<FeatureVector> series = indicators.computeSeries(symbol, bars);
                int offset = IndicatorEngine.MIN_LOOKBACK - 1;
                int added = 0;
                for (int j = 0; j < series.size(); j++) {
                    int target = offset + j + horizon;
                    if (target >= bars.size()) {
                        break;
                    }
                    samples.add(new TrainingSample(series.get(j), bars.get(target).close()));
                    added++;
                }
                logger.debug("{}: {} training samples from {} bars", symbol, added, bars.size());
            } catch (InvalidSymbolException | IllegalArgumentException e) {
                logger.warn("Skipping {} for training: {}", symbol, e.getMessage());
            }
        }
        samples.sort(Comparator.comparing((TrainingSample s) -> s.features().date())
            .thenComparing(s -> s.features().symbol()));
        logger.info("Training set built: {} samples from {} symbols", samples.size(), histories.size());
        return samples;
    }
}

package com.agenttrader.core.forecast;

import java.time.Instant;
import java.util.List;

/**
 * Result of one completed fit. Error metrics are in percentage points of the predicted move,
 * measured on the most recent (held-out) slice of the training set.
 *
 * @param baselineRmse mean RMSE of the previous fits in the drift window, {@code null} for the first fit
 */
public record FitReport(
    int trainSize,
    int testSize,
    double rmse,
    double mae,
    List<FeatureImportance> topFeatures,
    boolean driftDetected,
    Double baselineRmse,
    int trees,
    long durationMs,
    Instant fittedAt
) {
    public FitReport {
        topFeatures = List.copyOf(topFeatures);
    }
}

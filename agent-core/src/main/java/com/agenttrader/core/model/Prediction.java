package com.agenttrader.core.model;

import java.time.LocalDate;

/**
 * Cycle-scoped forecast for one symbol.
 * <p>
 * Degraded predictions ({@link PredictionStatus#INSUFFICIENT_DATA}, {@link PredictionStatus#ERROR})
 * carry a neutral forecast (no change, zero confidence) and a message explaining why.
 *
 * @param indicators indicator values at the evaluation bar, {@code null} when features could not be computed
 * @param asOf       date of the evaluation bar, {@code null} when unknown
 */
public record Prediction(
    String symbol,
    double currentPrice,
    double predictedPrice,
    double predictedChangePct,
    double confidence,
    IndicatorSnapshot indicators,
    PredictionStatus status,
    String message,
    LocalDate asOf
) {
    public static Prediction predicted(String symbol, double currentPrice, double predictedChangePct,
                                       double confidence, IndicatorSnapshot indicators, LocalDate asOf) {
        double predictedPrice = currentPrice * (1.0 + predictedChangePct / 100.0);
        return new Prediction(symbol, currentPrice, predictedPrice, predictedChangePct, confidence,
            indicators, PredictionStatus.PREDICTED, null, asOf);
    }

    public static Prediction insufficientData(String symbol, String message) {
        return new Prediction(symbol, 0.0, 0.0, 0.0, 0.0, null, PredictionStatus.INSUFFICIENT_DATA, message, null);
    }

    public static Prediction error(String symbol, double currentPrice, IndicatorSnapshot indicators, String message) {
        return new Prediction(symbol, currentPrice, currentPrice, 0.0, 0.0, indicators,
            PredictionStatus.ERROR, message, null);
    }

    public boolean isActionable() {
        return status == PredictionStatus.PREDICTED;
    }

    public double rsi() {
        return indicators != null ? indicators.rsi() : 50.0;
    }
}

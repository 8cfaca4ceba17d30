package com.agenttrader.core.model;

/**
 * Indicator values at the evaluation bar, kept on a {@link Prediction} for auditability.
 */
public record IndicatorSnapshot(
    double rsi,
    double macd,
    double macdSignal,
    double macdHistogram,
    double bbPosition,
    double ma5,
    double ma20,
    double ma50
) {
    /** MACD line as a percentage of the given price. */
    public double macdPercent(double price) {
        return price > 0 ? macd / price * 100.0 : 0.0;
    }
}

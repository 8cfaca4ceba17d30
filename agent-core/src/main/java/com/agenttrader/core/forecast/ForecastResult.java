package com.agenttrader.core.forecast;

/**
 * @param treePriceStd standard deviation of the individual trees' price predictions
 */
public record ForecastResult(double predictedPrice, double predictedChangePct, double confidence, double treePriceStd) {
}

package com.agenttrader.core.model;

/**
 * The inputs a decision was taken on. Carried from the decision through the ledger lot
 * that it opened, so the eventual outcome can be labelled against it.
 */
public record TradeSignal(
    double predictedChangePct,
    double confidence,
    double rsi,
    double macdPercent,
    double bbPosition,
    double riskTolerance
) {
    public static final int WIDTH = 6;

    public static TradeSignal of(Prediction prediction, double riskTolerance) {
        IndicatorSnapshot ind = prediction.indicators();
        double macdPct = ind != null ? ind.macdPercent(prediction.currentPrice()) : 0.0;
        double bb = ind != null ? ind.bbPosition() : 0.5;
        return new TradeSignal(prediction.predictedChangePct(), prediction.confidence(),
            prediction.rsi(), macdPct, bb, riskTolerance);
    }

    public double[] toArray() {
        return new double[] {predictedChangePct, confidence, rsi, macdPercent, bbPosition, riskTolerance};
    }
}

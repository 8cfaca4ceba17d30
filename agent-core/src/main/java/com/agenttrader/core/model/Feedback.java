package com.agenttrader.core.model;

import java.time.Instant;

/**
 * Outcome of a closed lot, compared against the signal that opened it.
 *
 * @param tradeType          action that opened the lot
 * @param signal             inputs of the opening decision, {@code null} for lots bought without one
 * @param realisedChangePct  move from entry to exit, in percent
 * @param predictionError    absolute gap between predicted and realised change, in percentage points
 */
public record Feedback(
    String userId,
    String symbol,
    TradeAction tradeType,
    long quantity,
    double entryPrice,
    Double exitPrice,
    Double profitLoss,
    boolean wasCorrect,
    double predictedChangePct,
    double realisedChangePct,
    double predictionError,
    TradeSignal signal,
    Instant timestamp
) {
    /** Error below which a forecast counts as accurate, in percentage points. */
    public static final double ACCURACY_TOLERANCE_PCT = 3.0;

    public static Feedback closed(String userId, String symbol, TradeAction tradeType, long quantity,
                                  double entryPrice, double exitPrice, TradeSignal signal, Instant timestamp) {
        double realised = (exitPrice / entryPrice - 1.0) * 100.0;
        double predicted = signal != null ? signal.predictedChangePct() : 0.0;
        boolean correct = switch (tradeType) {
            case BUY -> realised > 0;
            case SELL -> realised < 0;
            case HOLD -> Math.abs(realised) < 2.0;
        };
        return new Feedback(userId, symbol, tradeType, quantity, entryPrice, exitPrice,
            (exitPrice - entryPrice) * quantity, correct, predicted, realised,
            Math.abs(predicted - realised), signal, timestamp);
    }

    public boolean accurate() {
        return predictionError < ACCURACY_TOLERANCE_PCT;
    }

    /**
     * The action that would have been right in hindsight.
     */
    public TradeAction label(double bandPercent) {
        if (realisedChangePct > bandPercent) {
            return TradeAction.BUY;
        }
        if (realisedChangePct < -bandPercent) {
            return TradeAction.SELL;
        }
        return TradeAction.HOLD;
    }
}

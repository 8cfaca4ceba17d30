package com.agenttrader.core.model;

import java.util.List;

/**
 * BUY / SELL / HOLD verdict for one symbol.
 *
 * @param suggestedPositionSize fraction of total portfolio value to trade, in [0, 1]
 * @param stopLoss              protective exit price for a BUY, {@code null} otherwise
 * @param takeProfit            target exit price for a BUY, {@code null} otherwise
 */
public record Decision(
    String symbol,
    TradeAction action,
    double confidence,
    List<String> reasons,
    double suggestedPositionSize,
    Double stopLoss,
    Double takeProfit,
    DecisionSource method,
    double currentPrice,
    TradeSignal signal
) {
    public Decision {
        reasons = List.copyOf(reasons);
        if (suggestedPositionSize < 0.0 || suggestedPositionSize > 1.0) {
            throw new IllegalArgumentException("suggestedPositionSize out of [0,1]: " + suggestedPositionSize);
        }
    }

    public static Decision hold(String symbol, double confidence, List<String> reasons, DecisionSource method,
                                double currentPrice, TradeSignal signal) {
        return new Decision(symbol, TradeAction.HOLD, confidence, reasons, 0.0, null, null, method, currentPrice, signal);
    }
}

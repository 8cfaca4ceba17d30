package com.agenttrader.core.model;

/**
 * Read-only view of a holding in a portfolio ledger.
 */
public record Position(
    String symbol,
    long quantity,
    double avgBuyPrice,
    double currentPrice,
    double currentValue,
    double unrealizedPnl
) {
    public double unrealizedPnlPercent() {
        return avgBuyPrice > 0 ? (currentPrice - avgBuyPrice) / avgBuyPrice * 100.0 : 0.0;
    }
}

package com.agenttrader.core.model;

/**
 * Trading activity of one ledger. Win/loss counts only look at SELLs, which realise P&L.
 */
public record PerformanceStats(
    int totalTrades,
    int buyTrades,
    int sellTrades,
    int winningTrades,
    int losingTrades,
    double winRate,
    double realisedPnl
) {
    public static final PerformanceStats EMPTY = new PerformanceStats(0, 0, 0, 0, 0, 0.0, 0.0);
}

package com.agenttrader.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time valuation of one user's ledger.
 *
 * @param totalReturn total value minus initial cash
 */
public record PortfolioSnapshot(
    String userId,
    double cash,
    List<Position> positions,
    double totalValue,
    double initialCash,
    double totalReturn,
    Instant asOf
) {
    public PortfolioSnapshot {
        positions = List.copyOf(positions);
    }

    public double totalReturnPercent() {
        return initialCash > 0 ? totalReturn / initialCash * 100.0 : 0.0;
    }
}

package com.agenttrader.core.model;

import java.time.Instant;

/**
 * Append-only ledger entry.
 *
 * @param profitLoss realised P&L for a SELL, {@code null} for a BUY
 */
public record Transaction(
    String userId,
    String symbol,
    TransactionType type,
    long quantity,
    double price,
    double total,
    Double profitLoss,
    Instant timestamp
) {
}

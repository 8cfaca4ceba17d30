package com.agenttrader.core.model;

import java.util.List;

/**
 * What happened when a decision met the ledger.
 *
 * @param reason     why the order failed or was skipped, {@code null} when executed
 * @param feedback   outcome records emitted by a SELL, empty otherwise
 */
public record ExecutionResult(
    String symbol,
    TradeAction action,
    ExecutionStatus status,
    long quantity,
    double price,
    double total,
    Double profitLoss,
    String reason,
    Transaction transaction,
    List<Feedback> feedback
) {
    public ExecutionResult {
        feedback = List.copyOf(feedback);
    }

    public static ExecutionResult executed(Transaction tx, TradeAction action, List<Feedback> feedback) {
        return new ExecutionResult(tx.symbol(), action, ExecutionStatus.EXECUTED, tx.quantity(), tx.price(),
            tx.total(), tx.profitLoss(), null, tx, feedback);
    }

    public static ExecutionResult failed(String symbol, TradeAction action, double price, String reason) {
        return new ExecutionResult(symbol, action, ExecutionStatus.FAILED, 0, price, 0.0, null, reason, null, List.of());
    }

    public static ExecutionResult skipped(String symbol, TradeAction action, double price, String reason) {
        return new ExecutionResult(symbol, action, ExecutionStatus.SKIPPED, 0, price, 0.0, null, reason, null, List.of());
    }

    public static ExecutionResult held(String symbol, double price) {
        return new ExecutionResult(symbol, TradeAction.HOLD, ExecutionStatus.HELD, 0, price, 0.0, null, null, null, List.of());
    }
}

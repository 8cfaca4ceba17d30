package com.agenttrader.core.ledger;

import com.agenttrader.core.model.Feedback;
import com.agenttrader.core.model.Transaction;

import java.util.List;

/**
 * A completed SELL and one feedback record per lot (or part of a lot) it closed.
 */
public record SaleResult(Transaction transaction, List<Feedback> feedback) {

    public SaleResult {
        feedback = List.copyOf(feedback);
    }
}

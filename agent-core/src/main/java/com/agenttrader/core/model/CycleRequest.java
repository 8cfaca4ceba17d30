package com.agenttrader.core.model;

import java.util.List;

/**
 * One cycle's input: who trades, what, and how aggressively.
 */
public record CycleRequest(String userId, List<String> symbols, double riskTolerance) {

    public CycleRequest {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}

package com.agenttrader.core.model;

import java.util.Optional;

/**
 * Prediction / Decision / ExecutionResult triple for one symbol of a cycle.
 * Degraded symbols have a prediction only.
 */
public record SymbolResult(String symbol, Prediction prediction, Decision decision, ExecutionResult execution) {

    public static SymbolResult of(Prediction prediction) {
        return new SymbolResult(prediction.symbol(), prediction, null, null);
    }

    public SymbolResult withDecision(Decision d) {
        return new SymbolResult(symbol, prediction, d, execution);
    }

    public SymbolResult withExecution(ExecutionResult e) {
        return new SymbolResult(symbol, prediction, decision, e);
    }

    public Optional<Decision> decisionOpt() {
        return Optional.ofNullable(decision);
    }

    public Optional<ExecutionResult> executionOpt() {
        return Optional.ofNullable(execution);
    }

    public boolean degraded() {
        return !prediction.isActionable();
    }
}

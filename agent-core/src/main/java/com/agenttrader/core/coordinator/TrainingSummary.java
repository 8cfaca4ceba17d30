package com.agenttrader.core.coordinator;

import com.agenttrader.core.forecast.FitReport;
import com.agenttrader.core.model.DecisionSource;

import java.util.List;

/**
 * Outcome of training all agents.
 *
 * @param skipped symbols whose history could not be loaded
 */
public record TrainingSummary(
    FitReport forecast,
    DecisionSource decisionMode,
    int feedbackSamples,
    List<String> symbols,
    List<String> skipped
) {
    public TrainingSummary {
        symbols = List.copyOf(symbols);
        skipped = List.copyOf(skipped);
    }
}

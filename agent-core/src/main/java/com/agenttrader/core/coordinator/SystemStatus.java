package com.agenttrader.core.coordinator;

import com.agenttrader.core.forecast.FitReport;
import com.agenttrader.core.model.DecisionSource;
import com.agenttrader.core.model.PerformanceStats;
import com.agenttrader.core.model.PortfolioSnapshot;

import java.time.Instant;
import java.util.Map;

/**
 * @param lastFit    report of the live forecasting model, {@code null} when untrained
 * @param lastCycleAt completion time of the latest cycle, {@code null} before the first one
 */
public record SystemStatus(
    boolean modelTrained,
    boolean modelFitting,
    FitReport lastFit,
    DecisionSource decisionMode,
    int feedbackSamples,
    long cyclesRun,
    Instant lastCycleAt,
    Map<String, UserStatus> users
) {
    public SystemStatus {
        users = Map.copyOf(users);
    }

    public record UserStatus(PortfolioSnapshot portfolio, PerformanceStats performance) {
    }
}

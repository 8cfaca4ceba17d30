package com.agenttrader.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Best-effort result of one cycle. Always returned, including on timeout.
 *
 * @param stateTrail      states the cycle passed through, in order, ending with COMPLETE
 * @param results         one entry per requested symbol, in request order
 * @param decisionCounts  decisions per action
 * @param timedOut        whether the wall-clock budget ran out before all stages finished
 */
public record CycleSummary(
    String cycleId,
    String userId,
    double riskTolerance,
    Instant startedAt,
    Instant completedAt,
    long durationMs,
    List<CycleState> stateTrail,
    List<SymbolResult> results,
    Map<TradeAction, Integer> decisionCounts,
    int tradesExecuted,
    int failedExecutions,
    int degradedSymbols,
    List<Feedback> feedback,
    PortfolioSnapshot portfolio,
    DecisionSource decisionMode,
    boolean driftDetected,
    boolean refitTriggered,
    boolean timedOut
) {
    public CycleSummary {
        stateTrail = List.copyOf(stateTrail);
        results = List.copyOf(results);
        decisionCounts = Map.copyOf(decisionCounts);
        feedback = List.copyOf(feedback);
    }

    public int count(TradeAction action) {
        return decisionCounts.getOrDefault(action, 0);
    }
}

package com.agenttrader.core.decision;

import com.agenttrader.core.exception.ConfigurationException;

/**
 * Decision thresholds interpolated linearly in the risk tolerance {@code r}.
 * <ul>
 *   <li>buy: {@code 1.0 - 0.9r} percent</li>
 *   <li>sell: the negated buy threshold</li>
 *   <li>minimum confidence: {@code 0.6 - 0.2r}</li>
 * </ul>
 *
 * @param buyThreshold  predicted change (percent) a BUY must exceed
 * @param sellThreshold predicted change (percent) a SELL must fall below
 * @param minConfidence confidence floor for either action, in [0, 1]
 */
public record RiskThresholds(double riskTolerance, double buyThreshold, double sellThreshold, double minConfidence) {

    /**
     * @throws ConfigurationException when {@code r} is not a finite value in [0, 1]
     */
    public static RiskThresholds forRisk(double r) {
        if (!Double.isFinite(r) || r < 0.0 || r > 1.0) {
            throw new ConfigurationException("risk tolerance must be within [0, 1], got " + r);
        }
        double buy = 1.0 - 0.9 * r;
        return new RiskThresholds(r, buy, -buy, 0.6 - 0.2 * r);
    }
}

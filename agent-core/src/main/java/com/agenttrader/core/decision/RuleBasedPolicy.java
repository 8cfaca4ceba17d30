package com.agenttrader.core.decision;

import com.agenttrader.core.model.Decision;
import com.agenttrader.core.model.DecisionSource;
import com.agenttrader.core.model.Prediction;
import com.agenttrader.core.model.TradeAction;
import com.agenttrader.core.model.TradeSignal;

import java.util.ArrayList;
import java.util.List;

/**
 * Threshold rules over predicted change, confidence and RSI. Stateless and always available.
 * <p>
 * All comparisons against the change thresholds are strict, so a prediction sitting exactly on
 * a threshold holds.
 */
public final class RuleBasedPolicy {

    static final double RSI_OVERBOUGHT = 70.0;
    static final double RSI_OVERSOLD = 30.0;

    private final double maxPositionFraction;
    private final double stopLossPercent;
    private final double takeProfitPercent;

    public RuleBasedPolicy(double maxPositionFraction, double stopLossPercent, double takeProfitPercent) {
        this.maxPositionFraction = maxPositionFraction;
        this.stopLossPercent = stopLossPercent;
        this.takeProfitPercent = takeProfitPercent;
    }

    public Decision decide(Prediction prediction, RiskThresholds t) {
        String symbol = prediction.symbol();
        double price = prediction.currentPrice();
        double change = prediction.predictedChangePct();
        double confidence = prediction.confidence();
        double rsi = prediction.rsi();
        TradeSignal signal = TradeSignal.of(prediction, t.riskTolerance());

        if (!prediction.isActionable()) {
            return Decision.hold(symbol, 0.0, List.of("No usable prediction (" + prediction.status() + ")"),
                DecisionSource.RULE_BASED, price, signal);
        }

        boolean confident = confidence >= t.minConfidence();
        List<String> reasons = new ArrayList<>();

        if (change > t.buyThreshold() && confident && rsi < RSI_OVERBOUGHT) {
            reasons.add(String.format("ML predicts %+.2f%% gain (threshold %.2f%%)", change, t.buyThreshold()));
            reasons.add(String.format("Confidence %.0f%% meets %.0f%% floor", confidence * 100, t.minConfidence() * 100));
            reasons.add(String.format("RSI at %.0f (not overbought)", rsi));
            return new Decision(symbol, TradeAction.BUY, confidence, reasons, positionSize(confidence),
                stopLossFor(price), takeProfitFor(price), DecisionSource.RULE_BASED, price, signal);
        }

        if (change < t.sellThreshold() && confident && rsi > RSI_OVERSOLD) {
            reasons.add(String.format("ML predicts %.2f%% decline (threshold %.2f%%)", change, t.sellThreshold()));
            reasons.add(String.format("Confidence %.0f%% meets %.0f%% floor", confidence * 100, t.minConfidence() * 100));
            reasons.add(String.format("RSI at %.0f (not oversold)", rsi));
            return new Decision(symbol, TradeAction.SELL, confidence, reasons, positionSize(confidence),
                null, null, DecisionSource.RULE_BASED, price, signal);
        }

        reasons.add("Prediction below threshold or low confidence");
        if (!confident) {
            reasons.add(String.format("Confidence %.0f%% below %.0f%% floor", confidence * 100, t.minConfidence() * 100));
        } else if (change > t.buyThreshold() && rsi >= RSI_OVERBOUGHT) {
            reasons.add(String.format("RSI at %.0f (overbought), BUY blocked", rsi));
        } else if (change < t.sellThreshold() && rsi <= RSI_OVERSOLD) {
            reasons.add(String.format("RSI at %.0f (oversold), SELL blocked", rsi));
        } else {
            reasons.add(String.format("Predicted change %+.2f%% within [%.2f%%, %.2f%%]",
                change, t.sellThreshold(), t.buyThreshold()));
        }
        return Decision.hold(symbol, confidence, reasons, DecisionSource.RULE_BASED, price, signal);
    }

    /** Fraction of portfolio value to trade: half the cap, scaled up to the full cap by confidence. */
    double positionSize(double confidence) {
        double c = Math.max(0.0, Math.min(1.0, confidence));
        return maxPositionFraction * (0.5 + 0.5 * c);
    }

    Double stopLossFor(double price) {
        return price * (1.0 - stopLossPercent / 100.0);
    }

    Double takeProfitFor(double price) {
        return price * (1.0 + takeProfitPercent / 100.0);
    }
}

package com.agenttrader.core.decision;

import com.agenttrader.core.model.Decision;
import com.agenttrader.core.model.DecisionSource;
import com.agenttrader.core.model.Prediction;
import com.agenttrader.core.model.TradeAction;
import com.agenttrader.core.model.TradeSignal;

import java.util.ArrayList;
import java.util.List;

/**
 * The active decision policy. Which variant is live is chosen by the feedback sample-count gate
 * in {@link DecisionEngine}; each variant knows how to decide on its own.
 */
public sealed interface PolicyMode permits PolicyMode.Rule, PolicyMode.Learned {

    Decision decide(Prediction prediction, RiskThresholds thresholds, RuleBasedPolicy rules);

    DecisionSource source();

    record Rule() implements PolicyMode {
        @Override
        public Decision decide(Prediction prediction, RiskThresholds thresholds, RuleBasedPolicy rules) {
            return rules.decide(prediction, thresholds);
        }

        @Override
        public DecisionSource source() {
            return DecisionSource.RULE_BASED;
        }
    }

    /**
     * Classifier-driven decisions. Falls back to the rules whenever the classifier's top-class
     * probability is below the rule confidence floor.
     */
    record Learned(SoftmaxClassifier model, int trainedOn) implements PolicyMode {
        @Override
        public Decision decide(Prediction prediction, RiskThresholds thresholds, RuleBasedPolicy rules) {
            if (!prediction.isActionable()) {
                return rules.decide(prediction, thresholds);
            }
            TradeSignal signal = TradeSignal.of(prediction, thresholds.riskTolerance());
            double[] p = model.probabilities(signal.toArray());
            int top = SoftmaxClassifier.argmax(p);
            TradeAction action = TradeAction.values()[top];
            double confidence = p[top];

            if (confidence < thresholds.minConfidence()) {
                Decision fallback = rules.decide(prediction, thresholds);
                List<String> reasons = new ArrayList<>(fallback.reasons());
                reasons.add(0, String.format("Learned model unsure (%s at %.0f%% < %.0f%% floor), using rules",
                    action, confidence * 100, thresholds.minConfidence() * 100));
                return new Decision(fallback.symbol(), fallback.action(), fallback.confidence(), reasons,
                    fallback.suggestedPositionSize(), fallback.stopLoss(), fallback.takeProfit(),
                    fallback.method(), fallback.currentPrice(), fallback.signal());
            }

            double price = prediction.currentPrice();
            List<String> reasons = List.of(
                String.format("Learned model favours %s at %.0f%% (trained on %d outcomes)",
                    action, confidence * 100, trainedOn),
                String.format("Predicted change %+.2f%%, RSI %.0f", prediction.predictedChangePct(), prediction.rsi()));
            return switch (action) {
                case BUY -> new Decision(prediction.symbol(), action, confidence, reasons,
                    rules.positionSize(confidence), rules.stopLossFor(price), rules.takeProfitFor(price),
                    DecisionSource.ML_MODEL, price, signal);
                case SELL -> new Decision(prediction.symbol(), action, confidence, reasons,
                    rules.positionSize(confidence), null, null, DecisionSource.ML_MODEL, price, signal);
                case HOLD -> Decision.hold(prediction.symbol(), confidence, reasons, DecisionSource.ML_MODEL,
                    price, signal);
            };
        }

        @Override
        public DecisionSource source() {
            return DecisionSource.ML_MODEL;
        }
    }
}

package com.agenttrader.core.decision;

import com.agenttrader.core.config.PipelineConfig;
import com.agenttrader.core.model.Decision;
import com.agenttrader.core.model.DecisionSource;
import com.agenttrader.core.model.Feedback;
import com.agenttrader.core.model.Prediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Front door of the decision policy.
 * <p>
 * Starts in {@link PolicyMode.Rule}. Every batch of feedback is added to the sample pool; once the
 * pool reaches {@code DECISION_MIN_FEEDBACK_SAMPLES} the classifier is retrained on the whole pool
 * and the engine switches to {@link PolicyMode.Learned}.
 */
public final class DecisionEngine {
    private static final Logger logger = LoggerFactory.getLogger(DecisionEngine.class);

    private final PipelineConfig config;
    private final RuleBasedPolicy rules;
    private final AtomicReference<PolicyMode> mode = new AtomicReference<>(new PolicyMode.Rule());
    private final List<Feedback> samples = new ArrayList<>();

    public DecisionEngine(PipelineConfig config) {
        this.config = config;
        this.rules = new RuleBasedPolicy(config.getMaxPositionFraction(), config.getStopLossPercent(),
            config.getTakeProfitPercent());
    }

    /**
     * @throws com.agenttrader.core.exception.ConfigurationException when {@code riskTolerance} is outside [0, 1]
     */
    public Decision decide(Prediction prediction, double riskTolerance) {
        return decide(prediction, RiskThresholds.forRisk(riskTolerance));
    }

    public Decision decide(Prediction prediction, RiskThresholds thresholds) {
        Decision decision = mode.get().decide(prediction, thresholds, rules);
        logger.debug("{} -> {} ({}, confidence {})", prediction.symbol(), decision.action(), decision.method(),
            String.format("%.2f", decision.confidence()));
        return decision;
    }

    /**
     * Feed outcomes back. Feedback without an opening signal cannot be labelled against inputs and
     * is ignored.
     *
     * @return the mode in effect after adaptation
     */
    public synchronized DecisionSource adapt(List<Feedback> feedback) {
        List<Feedback> pool;
        synchronized (samples) {
            int before = samples.size();
            for (Feedback f : feedback) {
                if (f.signal() != null) {
                    samples.add(f);
                }
            }
            if (samples.size() == before) {
                return mode.get().source();
            }
            pool = List.copyOf(samples);
        }

        if (pool.size() < config.getDecisionMinFeedbackSamples()) {
            logger.info("Decision policy has {}/{} feedback samples, staying rule-based",
                pool.size(), config.getDecisionMinFeedbackSamples());
            return mode.get().source();
        }

        double[][] x = new double[pool.size()][];
        int[] y = new int[pool.size()];
        double band = config.getDecisionLabelBandPercent();
        for (int i = 0; i < pool.size(); i++) {
            x[i] = pool.get(i).signal().toArray();
            y[i] = pool.get(i).label(band).ordinal();
        }
        SoftmaxClassifier model = SoftmaxClassifier.train(x, y, config.getDecisionEpochs(),
            config.getDecisionLearningRate(), config.getDecisionSeed());
        mode.set(new PolicyMode.Learned(model, pool.size()));
        logger.info("🧠 Decision model trained on {} outcomes, accuracy {}",
            pool.size(), String.format("%.1f%%", model.trainingAccuracy() * 100));
        return DecisionSource.ML_MODEL;
    }

    public DecisionSource mode() {
        return mode.get().source();
    }

    public int feedbackSamples() {
        synchronized (samples) {
            return samples.size();
        }
    }

    RuleBasedPolicy rules() {
        return rules;
    }
}

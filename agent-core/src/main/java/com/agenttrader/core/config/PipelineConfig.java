package com.agenttrader.core.config;

import com.agenttrader.core.exception.ConfigurationException;
import com.agenttrader.core.execution.SellPolicy;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Tunables for the agent pipeline, read from UPPER_SNAKE properties.
 * <p>
 * Unparsable values fall back to the default with a warning; values that parse but break a
 * constraint fail validation with a {@link ConfigurationException}.
 */
public final class PipelineConfig {
    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    // Forecasting ensemble
    @Min(value = 1, message = "FORECAST_TREES must be at least 1")
    private final int forecastTrees;
    @Min(value = 1, message = "FORECAST_MAX_DEPTH must be at least 1")
    private final int forecastMaxDepth;
    @Min(value = 1, message = "FORECAST_MIN_SAMPLES_LEAF must be at least 1")
    private final int forecastMinSamplesLeaf;
    @Min(value = 2, message = "FORECAST_MIN_SAMPLES_SPLIT must be at least 2")
    private final int forecastMinSamplesSplit;
    private final long forecastSeed;
    @DecimalMin(value = "0.1", message = "FORECAST_TRAIN_FRACTION must be >= 0.1")
    @DecimalMax(value = "0.95", message = "FORECAST_TRAIN_FRACTION must be <= 0.95")
    private final double forecastTrainFraction;
    @Min(value = 1, message = "FORECAST_HORIZON must be at least 1 bar")
    private final int forecastHorizon;
    @Positive(message = "FORECAST_TARGET_CLIP_PERCENT must be positive")
    private final double forecastTargetClipPercent;

    // Drift
    @Min(value = 1, message = "DRIFT_WINDOW must be at least 1")
    private final int driftWindow;
    @Positive(message = "DRIFT_THRESHOLD_PERCENT must be positive")
    private final double driftThresholdPercent;

    // Learned decision policy
    @Min(value = 1, message = "DECISION_MIN_FEEDBACK_SAMPLES must be at least 1")
    private final int decisionMinFeedbackSamples;
    @DecimalMin(value = "0.0", message = "DECISION_LABEL_BAND_PERCENT must be >= 0")
    private final double decisionLabelBandPercent;
    private final long decisionSeed;
    @Min(value = 1, message = "DECISION_EPOCHS must be at least 1")
    private final int decisionEpochs;
    @Positive(message = "DECISION_LEARNING_RATE must be positive")
    private final double decisionLearningRate;

    // Sizing and execution
    @DecimalMin(value = "0.0", inclusive = false, message = "MAX_POSITION_FRACTION must be > 0")
    @DecimalMax(value = "1.0", message = "MAX_POSITION_FRACTION must be <= 1")
    private final double maxPositionFraction;
    @Positive(message = "STOP_LOSS_PERCENT must be positive")
    private final double stopLossPercent;
    @Positive(message = "TAKE_PROFIT_PERCENT must be positive")
    private final double takeProfitPercent;
    @NotNull(message = "SELL_POLICY is required")
    private final SellPolicy sellPolicy;

    // Coordinator
    @Min(value = 1, message = "PREDICTION_PARALLELISM must be at least 1")
    @Max(value = 256, message = "PREDICTION_PARALLELISM must be at most 256")
    private final int predictionParallelism;
    @Min(value = 1, message = "CYCLE_TIME_BUDGET_MS must be at least 1")
    private final long cycleTimeBudgetMs;
    private final boolean refitOnDrift;

    private final Properties properties;

    private PipelineConfig(Properties props) {
        this.properties = props;

        this.forecastTrees = parseInt("FORECAST_TREES", 100);
        this.forecastMaxDepth = parseInt("FORECAST_MAX_DEPTH", 15);
        this.forecastMinSamplesLeaf = parseInt("FORECAST_MIN_SAMPLES_LEAF", 2);
        this.forecastMinSamplesSplit = parseInt("FORECAST_MIN_SAMPLES_SPLIT", 5);
        this.forecastSeed = parseLong("FORECAST_SEED", 42L);
        this.forecastTrainFraction = parseDouble("FORECAST_TRAIN_FRACTION", 0.8);
        this.forecastHorizon = parseInt("FORECAST_HORIZON", 1);
        this.forecastTargetClipPercent = parseDouble("FORECAST_TARGET_CLIP_PERCENT", 30.0);

        this.driftWindow = parseInt("DRIFT_WINDOW", 5);
        this.driftThresholdPercent = parseDouble("DRIFT_THRESHOLD_PERCENT", 25.0);

        this.decisionMinFeedbackSamples = parseInt("DECISION_MIN_FEEDBACK_SAMPLES", 30);
        this.decisionLabelBandPercent = parseDouble("DECISION_LABEL_BAND_PERCENT", 2.0);
        this.decisionSeed = parseLong("DECISION_SEED", 42L);
        this.decisionEpochs = parseInt("DECISION_EPOCHS", 300);
        this.decisionLearningRate = parseDouble("DECISION_LEARNING_RATE", 0.1);

        this.maxPositionFraction = parseDouble("MAX_POSITION_FRACTION", 0.10);
        this.stopLossPercent = parseDouble("STOP_LOSS_PERCENT", 2.0);
        this.takeProfitPercent = parseDouble("TAKE_PROFIT_PERCENT", 3.0);
        this.sellPolicy = parseSellPolicy("SELL_POLICY", SellPolicy.HARD_FAIL);

        this.predictionParallelism = parseInt("PREDICTION_PARALLELISM", 4);
        this.cycleTimeBudgetMs = parseLong("CYCLE_TIME_BUDGET_MS", 60_000L);
        this.refitOnDrift = parseBoolean("REFIT_ON_DRIFT", true);
    }

    public static PipelineConfig defaults() {
        return fromProperties(new Properties());
    }

    /**
     * Build and validate a config from properties.
     *
     * @throws ConfigurationException if any value violates its constraint
     */
    public static PipelineConfig fromProperties(Properties props) {
        var config = new PipelineConfig(props);
        config.validate();
        logger.info("Pipeline config: trees={}, depth={}, parallelism={}, budget={}ms, sellPolicy={}",
            config.forecastTrees, config.forecastMaxDepth, config.predictionParallelism,
            config.cycleTimeBudgetMs, config.sellPolicy);
        return config;
    }

    private void validate() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            var violations = validator.validate(this);
            if (!violations.isEmpty()) {
                String errors = violations.stream()
                    .map(v -> v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
                throw new ConfigurationException("Pipeline configuration invalid: " + errors);
            }
        }
    }

    private int parseInt(String key, int defaultValue) {
        return (int) parseLong(key, defaultValue);
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private SellPolicy parseSellPolicy(String key, SellPolicy defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return SellPolicy.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    // ========== Getters ==========

    public int getForecastTrees() {
        return forecastTrees;
    }

    public int getForecastMaxDepth() {
        return forecastMaxDepth;
    }

    public int getForecastMinSamplesLeaf() {
        return forecastMinSamplesLeaf;
    }

    public int getForecastMinSamplesSplit() {
        return forecastMinSamplesSplit;
    }

    public long getForecastSeed() {
        return forecastSeed;
    }

    public double getForecastTrainFraction() {
        return forecastTrainFraction;
    }

    /** Bars between a feature row and the close it is trained to predict. */
    public int getForecastHorizon() {
        return forecastHorizon;
    }

    public double getForecastTargetClipPercent() {
        return forecastTargetClipPercent;
    }

    public int getDriftWindow() {
        return driftWindow;
    }

    /** RMSE rise over the rolling baseline, in percent, that flags drift. */
    public double getDriftThresholdPercent() {
        return driftThresholdPercent;
    }

    public int getDecisionMinFeedbackSamples() {
        return decisionMinFeedbackSamples;
    }

    public double getDecisionLabelBandPercent() {
        return decisionLabelBandPercent;
    }

    public long getDecisionSeed() {
        return decisionSeed;
    }

    public int getDecisionEpochs() {
        return decisionEpochs;
    }

    public double getDecisionLearningRate() {
        return decisionLearningRate;
    }

    public double getMaxPositionFraction() {
        return maxPositionFraction;
    }

    public double getStopLossPercent() {
        return stopLossPercent;
    }

    public double getTakeProfitPercent() {
        return takeProfitPercent;
    }

    public SellPolicy getSellPolicy() {
        return sellPolicy;
    }

    public int getPredictionParallelism() {
        return predictionParallelism;
    }

    public long getCycleTimeBudgetMs() {
        return cycleTimeBudgetMs;
    }

    public boolean isRefitOnDrift() {
        return refitOnDrift;
    }
}

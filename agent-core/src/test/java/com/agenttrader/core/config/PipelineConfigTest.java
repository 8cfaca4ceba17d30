package com.agenttrader.core.config;

import com.agenttrader.core.exception.ConfigurationException;
import com.agenttrader.core.execution.SellPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PipelineConfig Tests")
class PipelineConfigTest {

    private static final double DELTA = 1e-9;

    private static Properties props(String... pairs) {
        Properties p = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            p.setProperty(pairs[i], pairs[i + 1]);
        }
        return p;
    }

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertThat(config.getForecastTrees()).isEqualTo(100);
        assertThat(config.getForecastMaxDepth()).isEqualTo(15);
        assertThat(config.getForecastMinSamplesLeaf()).isEqualTo(2);
        assertThat(config.getForecastMinSamplesSplit()).isEqualTo(5);
        assertThat(config.getForecastSeed()).isEqualTo(42L);
        assertThat(config.getForecastTrainFraction()).isCloseTo(0.8, within(DELTA));
        assertThat(config.getDecisionMinFeedbackSamples()).isEqualTo(30);
        assertThat(config.getMaxPositionFraction()).isCloseTo(0.10, within(DELTA));
        assertThat(config.getSellPolicy()).isEqualTo(SellPolicy.HARD_FAIL);
        assertThat(config.getPredictionParallelism()).isEqualTo(4);
        assertThat(config.isRefitOnDrift()).isTrue();
    }

    @Test
    @DisplayName("Properties override defaults")
    void testOverrides() {
        PipelineConfig config = PipelineConfig.fromProperties(props(
            "FORECAST_TREES", "25",
            "STOP_LOSS_PERCENT", "1.5",
            "REFIT_ON_DRIFT", "false",
            "CYCLE_TIME_BUDGET_MS", " 5000 "));

        assertThat(config.getForecastTrees()).isEqualTo(25);
        assertThat(config.getStopLossPercent()).isCloseTo(1.5, within(DELTA));
        assertThat(config.isRefitOnDrift()).isFalse();
        assertThat(config.getCycleTimeBudgetMs()).isEqualTo(5000L);
    }

    @Test
    @DisplayName("Unparsable numbers fall back to the default")
    void testBadNumberFallsBack() {
        PipelineConfig config = PipelineConfig.fromProperties(props("FORECAST_TREES", "lots"));

        assertThat(config.getForecastTrees()).isEqualTo(100);
    }

    @ParameterizedTest(name = "{0}={1} is rejected")
    @CsvSource({
        "FORECAST_TREES, 0",
        "FORECAST_TRAIN_FRACTION, 0.99",
        "MAX_POSITION_FRACTION, 0",
        "MAX_POSITION_FRACTION, 1.5",
        "PREDICTION_PARALLELISM, 1000",
        "STOP_LOSS_PERCENT, -1"
    })
    @DisplayName("Values outside their constraint fail validation")
    void testConstraintViolations(String key, String value) {
        assertThatThrownBy(() -> PipelineConfig.fromProperties(props(key, value)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining(key);
    }

    @ParameterizedTest(name = "SELL_POLICY={0} -> {1}")
    @CsvSource({
        "clip_to_available, CLIP_TO_AVAILABLE",
        "HARD_FAIL, HARD_FAIL",
        "sideways, HARD_FAIL"
    })
    @DisplayName("Sell policy parses case-insensitively with fallback")
    void testSellPolicy(String raw, SellPolicy expected) {
        assertThat(PipelineConfig.fromProperties(props("SELL_POLICY", raw)).getSellPolicy()).isEqualTo(expected);
    }
}

package com.agenttrader.core.decision;

import com.agenttrader.core.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskThresholds Tests")
class RiskThresholdsTest {

    private static final double DELTA = 1e-12;

    @ParameterizedTest(name = "r={0} -> buy {1}%, sell {2}%, min confidence {3}")
    @CsvSource({
        "0.0, 1.0,  -1.0,  0.6",
        "0.5, 0.55, -0.55, 0.5",
        "1.0, 0.1,  -0.1,  0.4"
    })
    @DisplayName("Calibration points")
    void testCalibrationPoints(double r, double buy, double sell, double minConfidence) {
        RiskThresholds t = RiskThresholds.forRisk(r);

        assertEquals(buy, t.buyThreshold(), DELTA);
        assertEquals(sell, t.sellThreshold(), DELTA);
        assertEquals(minConfidence, t.minConfidence(), DELTA);
    }

    @Test
    @DisplayName("Linear across the whole range")
    void testLinear() {
        for (int i = 0; i <= 100; i++) {
            double r = i / 100.0;
            RiskThresholds t = RiskThresholds.forRisk(r);

            assertEquals(1.0 - 0.9 * r, t.buyThreshold(), DELTA);
            assertEquals(-t.buyThreshold(), t.sellThreshold(), DELTA);
            assertEquals(0.6 - 0.2 * r, t.minConfidence(), DELTA);
        }
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.01, 1.01, 5.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Risk tolerance outside [0, 1] is a configuration error")
    void testOutOfRange(double r) {
        assertThrows(ConfigurationException.class, () -> RiskThresholds.forRisk(r));
    }
}

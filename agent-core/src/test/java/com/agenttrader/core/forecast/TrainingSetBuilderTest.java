package com.agenttrader.core.forecast;

import com.agenttrader.core.indicator.IndicatorEngine;
import com.agenttrader.core.model.Bar;
import com.agenttrader.core.support.TestBars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TrainingSetBuilder Tests")
class TrainingSetBuilderTest {

    private final IndicatorEngine engine = new IndicatorEngine();

    @Test
    @DisplayName("One sample per bar with full lookback and a known target")
    void testSampleCount() {
        var builder = new TrainingSetBuilder(engine, 1);

        List<TrainingSample> samples = builder.build(Map.of("UP", TestBars.rising("UP", 60, 100, 1)));

        // bars 49..58 have a next close
        assertThat(samples).hasSize(10);
        assertThat(samples.get(0).features().close()).isEqualTo(149.0);
        assertThat(samples.get(0).nextClose()).isEqualTo(150.0);
        assertThat(samples.get(0).changePercent()).isEqualTo((150.0 / 149.0 - 1) * 100);
    }

    @Test
    @DisplayName("Horizon shifts the target")
    void testHorizon() {
        var builder = new TrainingSetBuilder(engine, 3);

        List<TrainingSample> samples = builder.build(Map.of("UP", TestBars.rising("UP", 60, 100, 1)));

        assertThat(samples).hasSize(8);
        assertThat(samples.get(0).nextClose()).isEqualTo(152.0);
    }

    @Test
    @DisplayName("Samples are ordered by date across symbols; bad histories are skipped")
    void testOrderingAndSkipping() {
        List<Bar> broken = new ArrayList<>(TestBars.zigzag("BAD", 60, 10));
        broken.set(5, new Bar("OTHER", broken.get(5).date(), 1, 1, 1, 1, 1));
        Map<String, List<Bar>> histories = new LinkedHashMap<>();
        histories.put("BBB", TestBars.zigzag("BBB", 60, 50));
        histories.put("AAA", TestBars.zigzag("AAA", 60, 20));
        histories.put("BAD", broken);
        histories.put("SHORT", TestBars.zigzag("SHORT", 20, 20));

        List<TrainingSample> samples = new TrainingSetBuilder(engine, 1).build(histories);

        assertThat(samples).hasSize(20);
        assertThat(samples.get(0).features().symbol()).isEqualTo("AAA");
        assertThat(samples.get(1).features().symbol()).isEqualTo("BBB");
        for (int i = 1; i < samples.size(); i++) {
            assertThat(samples.get(i).features().date()).isAfterOrEqualTo(samples.get(i - 1).features().date());
        }
    }
}

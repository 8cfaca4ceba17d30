package com.agenttrader.persistence;

import com.agenttrader.core.config.PipelineConfig;
import com.agenttrader.core.forecast.ForecastingModel;
import com.agenttrader.core.forecast.ForecastingModel.TrainedModel;
import com.agenttrader.core.forecast.TrainingSample;
import com.agenttrader.core.forecast.TrainingSetBuilder;
import com.agenttrader.core.indicator.IndicatorEngine;
import com.agenttrader.core.model.FeatureVector;
import com.agenttrader.support.Bars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ModelStore Tests")
class ModelStoreTest {

    @TempDir
    Path tempDir;

    private static ForecastingModel trainedModel() throws Exception {
        Properties p = new Properties();
        p.setProperty("FORECAST_TREES", "5");
        p.setProperty("FORECAST_MAX_DEPTH", "4");
        var model = new ForecastingModel(PipelineConfig.fromProperties(p));
        List<TrainingSample> samples = new TrainingSetBuilder(new IndicatorEngine(), 1).build(Map.of(
            "AAA", Bars.randomWalk("AAA", 120, 100.0, 7L),
            "BBB", Bars.randomWalk("BBB", 120, 40.0, 8L)));
        model.fit(samples);
        return model;
    }

    @Test
    @DisplayName("Saved model predicts identically after loading")
    void testRoundTrip() throws Exception {
        ForecastingModel original = trainedModel();
        var store = new ModelStore(tempDir.resolve("models/forecaster.json"));

        store.save(original.current().orElseThrow());
        Optional<TrainedModel> loaded = store.load();

        assertThat(loaded).isPresent();
        var restored = new ForecastingModel(PipelineConfig.defaults());
        restored.restore(loaded.get());
        FeatureVector probe = new IndicatorEngine().computeFeatures(Bars.randomWalk("AAA", 80, 100.0, 9L));
        assertThat(restored.predict(probe)).isEqualTo(original.predict(probe));
        assertThat(loaded.get().report().fittedAt()).isEqualTo(original.lastReport().orElseThrow().fittedAt());
    }

    @Test
    @DisplayName("Missing file means no model")
    void testMissing() throws Exception {
        assertThat(new ModelStore(tempDir.resolve("absent.json")).load()).isEmpty();
    }

    @Test
    @DisplayName("A model saved for other inputs is ignored")
    void testIncompatibleLayout() throws Exception {
        Path file = tempDir.resolve("old.json");
        Files.writeString(file, "{\"formatVersion\":1,\"inputs\":[\"close\"],\"model\":null}");

        assertThat(new ModelStore(file).load()).isEmpty();
    }

    @Test
    @DisplayName("A corrupt file is an I/O error")
    void testCorrupt() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new ModelStore(file).load()).isInstanceOf(java.io.IOException.class);
    }
}

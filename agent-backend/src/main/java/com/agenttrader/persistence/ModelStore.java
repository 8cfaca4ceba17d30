package com.agenttrader.persistence;

import com.agenttrader.core.forecast.ForecastingModel.TrainedModel;
import com.agenttrader.core.model.FeatureVector;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * Saves the trained forecasting ensemble as JSON so a restarted bot resumes with it.
 * <p>
 * The document records the model input names; a file written for a different input layout is
 * ignored rather than loaded.
 */
public final class ModelStore {
    private static final Logger logger = LoggerFactory.getLogger(ModelStore.class);
    static final int FORMAT_VERSION = 1;

    private final Path path;
    private final ObjectMapper objectMapper;

    /** On-disk envelope around a trained model. */
    record StoredModel(int formatVersion, List<String> inputs, TrainedModel model) {
    }

    public ModelStore(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Write the model atomically: to a sibling temp file first, then moved over the target.
     */
    public void save(TrainedModel model) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        objectMapper.writeValue(tmp.toFile(), new StoredModel(FORMAT_VERSION, FeatureVector.INPUT_NAMES, model));
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("💾 Model saved to {} ({} trees, RMSE {})", path, model.forest().trees().size(),
            String.format("%.3f", model.report().rmse()));
    }

    /**
     * Read the saved model, if there is a compatible one.
     *
     * @throws IOException when the file exists but cannot be read or parsed
     */
    public Optional<TrainedModel> load() throws IOException {
        if (!Files.exists(path)) {
            logger.info("No saved model at {}", path);
            return Optional.empty();
        }
        StoredModel stored = objectMapper.readValue(path.toFile(), StoredModel.class);
        if (stored.formatVersion() != FORMAT_VERSION || !FeatureVector.INPUT_NAMES.equals(stored.inputs())) {
            logger.warn("Saved model at {} has an incompatible layout (version {}), ignoring it",
                path, stored.formatVersion());
            return Optional.empty();
        }
        TrainedModel model = stored.model();
        logger.info("Loaded model from {}: {} trees, fitted {}", path, model.forest().trees().size(),
            model.report().fittedAt());
        return Optional.of(model);
    }

    public Path path() {
        return path;
    }
}

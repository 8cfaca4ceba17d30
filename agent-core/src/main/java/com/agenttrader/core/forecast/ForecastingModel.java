package com.agenttrader.core.forecast;

import com.agenttrader.core.config.PipelineConfig;
import com.agenttrader.core.exception.InsufficientDataException;
import com.agenttrader.core.exception.ModelNotTrainedException;
import com.agenttrader.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Ensemble forecaster of the relative next move.
 * <p>
 * The live model sits in an {@link AtomicReference}; a fit builds a complete new model off to the
 * side and swaps it in only on success, so predictions keep using the previous model while a fit
 * runs, and a cancelled or failed fit changes nothing.
 */
public final class ForecastingModel {
    private static final Logger logger = LoggerFactory.getLogger(ForecastingModel.class);

    /** Fewest samples a fit accepts. */
    public static final int MIN_TRAINING_SAMPLES = 20;
    private static final int TOP_FEATURES = 10;

    private final PipelineConfig config;
    private final DriftMonitor driftMonitor;
    private final AtomicReference<TrainedModel> live = new AtomicReference<>();
    private final AtomicInteger fitsInProgress = new AtomicInteger();

    /**
     * A forest together with the report of the fit that produced it.
     */
    public record TrainedModel(RandomForestRegressor forest, FitReport report) {
    }

    public ForecastingModel(PipelineConfig config) {
        this.config = config;
        this.driftMonitor = new DriftMonitor(config.getDriftWindow(), config.getDriftThresholdPercent());
    }

    public FitReport fit(List<TrainingSample> trainingSet) throws InsufficientDataException {
        return fit(trainingSet, () -> Thread.currentThread().isInterrupted());
    }

    /**
     * Fit on a time-ordered 80/20 split and publish the new model.
     * <p>
     * Samples are ordered by feature date (then symbol) before splitting; they are never shuffled.
     *
     * @throws InsufficientDataException when fewer than {@link #MIN_TRAINING_SAMPLES} samples are given
     * @throws java.util.concurrent.CancellationException when {@code cancelled} turns true between trees
     */
    public FitReport fit(List<TrainingSample> trainingSet, BooleanSupplier cancelled) throws InsufficientDataException {
        if (trainingSet.size() < MIN_TRAINING_SAMPLES) {
            throw new InsufficientDataException("TRAINING_SET", trainingSet.size(), MIN_TRAINING_SAMPLES);
        }
        fitsInProgress.incrementAndGet();
        try {
            long start = System.currentTimeMillis();
            List<TrainingSample> ordered = new ArrayList<>(trainingSet);
            ordered.sort(Comparator.comparing((TrainingSample s) -> s.features().date())
                .thenComparing(s -> s.features().symbol()));

            int trainSize = (int) Math.floor(ordered.size() * config.getForecastTrainFraction());
            trainSize = Math.max(1, Math.min(trainSize, ordered.size() - 1));
            List<TrainingSample> train = ordered.subList(0, trainSize);
            List<TrainingSample> test = ordered.subList(trainSize, ordered.size());

            logger.info("🤖 Fitting forecaster: {} train / {} test samples, {} trees",
                train.size(), test.size(), config.getForecastTrees());

            double[][] x = new double[train.size()][];
            double[] y = new double[train.size()];
            for (int i = 0; i < train.size(); i++) {
                x[i] = train.get(i).features().modelInputs();
                y[i] = clipTarget(train.get(i).changePercent());
            }

            var settings = new RandomForestRegressor.Settings(config.getForecastTrees(), config.getForecastMaxDepth(),
                config.getForecastMinSamplesLeaf(), config.getForecastMinSamplesSplit(), config.getForecastSeed());
            RandomForestRegressor forest = RandomForestRegressor.fit(x, y, settings, cancelled);

            double se = 0.0;
            double ae = 0.0;
            for (TrainingSample s : test) {
                double err = forest.predict(s.features().modelInputs()) - clipTarget(s.changePercent());
                se += err * err;
                ae += Math.abs(err);
            }
            double rmse = Math.sqrt(se / test.size());
            double mae = ae / test.size();

            DriftMonitor.Verdict verdict = driftMonitor.record(rmse);
            var report = new FitReport(train.size(), test.size(), rmse, mae, topFeatures(forest),
                verdict.drift(), verdict.baseline(), forest.trees().size(),
                System.currentTimeMillis() - start, Instant.now());

            live.set(new TrainedModel(forest, report));
            logger.info("✅ Forecaster trained: RMSE={}pp MAE={}pp in {}ms{}",
                String.format("%.3f", rmse), String.format("%.3f", mae), report.durationMs(),
                report.driftDetected() ? " (drift)" : "");
            return report;
        } finally {
            fitsInProgress.decrementAndGet();
        }
    }

    /**
     * Fit on the given executor. Cancelling the returned future with {@code mayInterruptIfRunning}
     * stops the fit at the next tree boundary and leaves the live model untouched.
     */
    public Future<FitReport> fitAsync(List<TrainingSample> trainingSet, ExecutorService executor) {
        List<TrainingSample> copy = List.copyOf(trainingSet);
        var task = new FutureTask<>(() -> fit(copy));
        executor.execute(task);
        return task;
    }

    /**
     * Forecast the next close for a feature vector.
     * Confidence is {@code clamp(1 - std(tree prices) / current price, 0, 1)}.
     *
     * @throws ModelNotTrainedException when no fit has completed yet
     */
    public ForecastResult predict(FeatureVector features) throws ModelNotTrainedException {
        TrainedModel model = live.get();
        if (model == null) {
            throw new ModelNotTrainedException(features.symbol());
        }
        double close = features.close();
        double[] each = model.forest().predictEach(features.modelInputs());

        double meanPrice = 0.0;
        double[] prices = new double[each.length];
        for (int i = 0; i < each.length; i++) {
            prices[i] = close * (1.0 + each[i] / 100.0);
            meanPrice += prices[i];
        }
        meanPrice /= prices.length;
        double var = 0.0;
        for (double p : prices) {
            var += (p - meanPrice) * (p - meanPrice);
        }
        double std = Math.sqrt(var / prices.length);

        double changePct = (meanPrice / close - 1.0) * 100.0;
        double confidence = Math.max(0.0, Math.min(1.0, 1.0 - std / close));
        logger.debug("{}: predicted {}% (confidence {})", features.symbol(),
            String.format("%+.2f", changePct), String.format("%.3f", confidence));
        return new ForecastResult(meanPrice, changePct, confidence, std);
    }

    /** Install a previously saved model, e.g. at startup. */
    public void restore(TrainedModel model) {
        live.set(model);
        driftMonitor.record(model.report().rmse());
        logger.info("Forecaster restored: {} trees, fitted {}", model.forest().trees().size(), model.report().fittedAt());
    }

    public Optional<TrainedModel> current() {
        return Optional.ofNullable(live.get());
    }

    public boolean isTrained() {
        return live.get() != null;
    }

    public boolean isFitting() {
        return fitsInProgress.get() > 0;
    }

    public Optional<FitReport> lastReport() {
        return current().map(TrainedModel::report);
    }

    private double clipTarget(double changePct) {
        double clip = config.getForecastTargetClipPercent();
        return Math.max(-clip, Math.min(clip, changePct));
    }

    private static List<FeatureImportance> topFeatures(RandomForestRegressor forest) {
        List<FeatureImportance> all = new ArrayList<>();
        double[] imp = forest.importances();
        for (int i = 0; i < imp.length; i++) {
            all.add(new FeatureImportance(FeatureVector.INPUT_NAMES.get(i), imp[i]));
        }
        all.sort(Comparator.comparingDouble(FeatureImportance::importance).reversed());
        return List.copyOf(all.subList(0, Math.min(TOP_FEATURES, all.size())));
    }
}

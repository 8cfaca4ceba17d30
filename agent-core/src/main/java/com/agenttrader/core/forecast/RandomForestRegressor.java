package com.agenttrader.core.forecast;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Bagged ensemble of {@link RegressionTree}s.
 * <p>
 * Each tree sees a bootstrap sample drawn from a per-tree seed derived from the forest seed,
 * so two fits with the same seed and data are identical.
 *
 * @param importances normalised split importance per input, summing to 1 (all zero when no tree split)
 */
public record RandomForestRegressor(List<RegressionTree> trees, int inputCount, double[] importances) {

    public RandomForestRegressor {
        trees = List.copyOf(trees);
        if (trees.isEmpty()) {
            throw new IllegalArgumentException("forest needs at least one tree");
        }
    }

    public record Settings(int trees, int maxDepth, int minSamplesLeaf, int minSamplesSplit, long seed) {
    }

    /**
     * Fit a forest.
     *
     * @param cancelled polled between trees; when it turns true the fit stops
     * @throws CancellationException when {@code cancelled} reported true
     */
    public static RandomForestRegressor fit(double[][] x, double[] y, Settings settings, BooleanSupplier cancelled) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("need matching, non-empty inputs and targets");
        }
        int inputs = x[0].length;
        var params = new RegressionTree.Params(settings.maxDepth(), settings.minSamplesLeaf(), settings.minSamplesSplit());
        double[] importance = new double[inputs];
        Random seeds = new Random(settings.seed());
        List<RegressionTree> trees = new ArrayList<>(settings.trees());

        for (int t = 0; t < settings.trees(); t++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("fit cancelled after " + t + " of " + settings.trees() + " trees");
            }
            Random rng = new Random(seeds.nextLong());
            int[] sample = new int[x.length];
            for (int i = 0; i < sample.length; i++) {
                sample[i] = rng.nextInt(x.length);
            }
            trees.add(RegressionTree.grow(x, y, sample, params, importance));
        }

        double total = 0.0;
        for (double v : importance) {
            total += v;
        }
        if (total > 0) {
            for (int i = 0; i < importance.length; i++) {
                importance[i] /= total;
            }
        }
        return new RandomForestRegressor(trees, inputs, importance);
    }

    /** Every tree's prediction for {@code x}, in tree order. */
    public double[] predictEach(double[] x) {
        if (x.length != inputCount) {
            throw new IllegalArgumentException("expected " + inputCount + " inputs, got " + x.length);
        }
        double[] out = new double[trees.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = trees.get(i).predict(x);
        }
        return out;
    }

    public double predict(double[] x) {
        double sum = 0.0;
        for (double p : predictEach(x)) {
            sum += p;
        }
        return sum / trees.size();
    }
}

package com.agenttrader.core.decision;

import com.agenttrader.core.model.TradeAction;

import java.util.Random;

/**
 * Multinomial logistic regression over standardised inputs, trained with seeded SGD.
 * Classes are indexed by {@link TradeAction#ordinal()}.
 */
public final class SoftmaxClassifier {

    private static final double L2 = 1e-4;
    private static final int CLASSES = TradeAction.values().length;

    private final double[] mean;
    private final double[] scale;
    private final double[][] weights;
    private final double[] bias;
    private final double trainingAccuracy;

    private SoftmaxClassifier(double[] mean, double[] scale, double[][] weights, double[] bias, double trainingAccuracy) {
        this.mean = mean;
        this.scale = scale;
        this.weights = weights;
        this.bias = bias;
        this.trainingAccuracy = trainingAccuracy;
    }

    public static SoftmaxClassifier train(double[][] x, int[] labels, int epochs, double learningRate, long seed) {
        if (x.length == 0 || x.length != labels.length) {
            throw new IllegalArgumentException("need matching, non-empty inputs and labels");
        }
        int d = x[0].length;
        double[] mean = new double[d];
        double[] scale = new double[d];
        for (double[] row : x) {
            for (int j = 0; j < d; j++) {
                mean[j] += row[j];
            }
        }
        for (int j = 0; j < d; j++) {
            mean[j] /= x.length;
        }
        for (double[] row : x) {
            for (int j = 0; j < d; j++) {
                scale[j] += (row[j] - mean[j]) * (row[j] - mean[j]);
            }
        }
        for (int j = 0; j < d; j++) {
            double std = Math.sqrt(scale[j] / x.length);
            scale[j] = std > 1e-9 ? std : 1.0;
        }

        double[][] z = new double[x.length][d];
        for (int i = 0; i < x.length; i++) {
            for (int j = 0; j < d; j++) {
                z[i][j] = (x[i][j] - mean[j]) / scale[j];
            }
        }

        double[][] w = new double[CLASSES][d];
        double[] b = new double[CLASSES];
        Random rng = new Random(seed);
        int[] order = new int[x.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }

        for (int epoch = 0; epoch < epochs; epoch++) {
            for (int i = order.length - 1; i > 0; i--) {
                int k = rng.nextInt(i + 1);
                int tmp = order[i];
                order[i] = order[k];
                order[k] = tmp;
            }
            for (int i : order) {
                double[] p = softmax(w, b, z[i]);
                for (int c = 0; c < CLASSES; c++) {
                    double grad = p[c] - (labels[i] == c ? 1.0 : 0.0);
                    for (int j = 0; j < d; j++) {
                        w[c][j] -= learningRate * (grad * z[i][j] + L2 * w[c][j]);
                    }
                    b[c] -= learningRate * grad;
                }
            }
        }

        int correct = 0;
        for (int i = 0; i < z.length; i++) {
            if (argmax(softmax(w, b, z[i])) == labels[i]) {
                correct++;
            }
        }
        return new SoftmaxClassifier(mean, scale, w, b, (double) correct / z.length);
    }

    /** Class probabilities, indexed by {@link TradeAction#ordinal()}. */
    public double[] probabilities(double[] x) {
        double[] z = new double[x.length];
        for (int j = 0; j < x.length; j++) {
            z[j] = (x[j] - mean[j]) / scale[j];
        }
        return softmax(weights, bias, z);
    }

    public double trainingAccuracy() {
        return trainingAccuracy;
    }

    static int argmax(double[] p) {
        int best = 0;
        for (int i = 1; i < p.length; i++) {
            if (p[i] > p[best]) {
                best = i;
            }
        }
        return best;
    }

    private static double[] softmax(double[][] w, double[] b, double[] z) {
        double[] logits = new double[CLASSES];
        double max = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < CLASSES; c++) {
            double s = b[c];
            for (int j = 0; j < z.length; j++) {
                s += w[c][j] * z[j];
            }
            logits[c] = s;
            max = Math.max(max, s);
        }
        double sum = 0.0;
        for (int c = 0; c < CLASSES; c++) {
            logits[c] = Math.exp(logits[c] - max);
            sum += logits[c];
        }
        for (int c = 0; c < CLASSES; c++) {
            logits[c] /= sum;
        }
        return logits;
    }
}

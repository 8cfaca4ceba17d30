package com.agenttrader.core.forecast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * CART regression tree stored as flat node arrays.
 * <p>
 * Node 0 is the root. A node with {@code feature[n] < 0} is a leaf predicting {@code value[n]};
 * otherwise samples with {@code x[feature] <= threshold} go left. The flat layout keeps the tree
 * trivially serialisable.
 */
public record RegressionTree(int[] feature, double[] threshold, int[] left, int[] right, double[] value) {

    public double predict(double[] x) {
        int node = 0;
        while (feature[node] >= 0) {
            node = x[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }

    public int nodeCount() {
        return feature.length;
    }

    /**
     * Grow a tree on the given sample indices (repeats allowed, as in a bootstrap).
     *
     * @param importance accumulates the squared-error reduction of every split, per feature
     */
    static RegressionTree grow(double[][] x, double[] y, int[] sample, Params params, double[] importance) {
        var builder = new Builder(x, y, params, importance);
        builder.split(sample, 0);
        return builder.build();
    }

    record Params(int maxDepth, int minSamplesLeaf, int minSamplesSplit) {
    }

    private static final class Builder {
        private final double[][] x;
        private final double[] y;
        private final Params params;
        private final double[] importance;
        private final List<double[]> nodes = new ArrayList<>();

        Builder(double[][] x, double[] y, Params params, double[] importance) {
            this.x = x;
            this.y = y;
            this.params = params;
            this.importance = importance;
        }

        // node layout: {feature, threshold, left, right, value}
        private int split(int[] idx, int depth) {
            int id = nodes.size();
            double sum = 0.0;
            for (int i : idx) {
                sum += y[i];
            }
            double mean = sum / idx.length;
            nodes.add(new double[] {-1, 0.0, -1, -1, mean});

            if (depth >= params.maxDepth() || idx.length < params.minSamplesSplit()) {
                return id;
            }

            int bestFeature = -1;
            double bestThreshold = 0.0;
            double bestGain = 1e-12;
            int bestLeftCount = 0;
            Integer[] best = null;

            double parentScore = sum * sum / idx.length;
            int minLeaf = params.minSamplesLeaf();
            for (int f = 0; f < x[0].length; f++) {
                final int feat = f;
                Integer[] order = new Integer[idx.length];
                for (int i = 0; i < idx.length; i++) {
                    order[i] = idx[i];
                }
                Arrays.sort(order, Comparator.comparingDouble(i -> x[i][feat]));

                double leftSum = 0.0;
                for (int k = 0; k < order.length - 1; k++) {
                    leftSum += y[order[k]];
                    int leftCount = k + 1;
                    int rightCount = order.length - leftCount;
                    if (leftCount < minLeaf) {
                        continue;
                    }
                    if (rightCount < minLeaf) {
                        break;
                    }
                    double here = x[order[k]][feat];
                    double next = x[order[k + 1]][feat];
                    if (here == next) {
                        continue;
                    }
                    double rightSum = sum - leftSum;
                    double gain = leftSum * leftSum / leftCount + rightSum * rightSum / rightCount - parentScore;
                    if (gain > bestGain) {
                        bestGain = gain;
                        bestFeature = feat;
                        bestThreshold = here + (next - here) / 2.0;
                        bestLeftCount = leftCount;
                        best = order;
                    }
                }
            }

            if (bestFeature < 0) {
                return id;
            }
            importance[bestFeature] += bestGain;

            int[] leftIdx = new int[bestLeftCount];
            int[] rightIdx = new int[idx.length - bestLeftCount];
            for (int i = 0; i < best.length; i++) {
                if (i < bestLeftCount) {
                    leftIdx[i] = best[i];
                } else {
                    rightIdx[i - bestLeftCount] = best[i];
                }
            }

            double[] node = nodes.get(id);
            node[0] = bestFeature;
            node[1] = bestThreshold;
            node[2] = split(leftIdx, depth + 1);
            node[3] = split(rightIdx, depth + 1);
            return id;
        }

        RegressionTree build() {
            int n = nodes.size();
            int[] feature = new int[n];
            double[] threshold = new double[n];
            int[] left = new int[n];
            int[] right = new int[n];
            double[] value = new double[n];
            for (int i = 0; i < n; i++) {
                double[] node = nodes.get(i);
                feature[i] = (int) node[0];
                threshold[i] = node[1];
                left[i] = (int) node[2];
                right[i] = (int) node[3];
                value[i] = node[4];
            }
            return new RegressionTree(feature, threshold, left, right, value);
        }
    }
}

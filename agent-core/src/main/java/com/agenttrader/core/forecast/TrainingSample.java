package com.agenttrader.core.forecast;

import com.agenttrader.core.model.FeatureVector;

/**
 * One supervised example: the features at a bar and the close {@code horizon} bars later.
 */
public record TrainingSample(FeatureVector features, double nextClose) {

    /** Realised move from the feature bar's close to {@code nextClose}, in percent. */
    public double changePercent() {
        return (nextClose / features.close() - 1.0) * 100.0;
    }
}

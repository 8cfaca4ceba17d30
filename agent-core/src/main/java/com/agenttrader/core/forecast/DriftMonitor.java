package com.agenttrader.core.forecast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling RMSE baseline over the last few fits.
 * <p>
 * A fit drifts when its RMSE exceeds the baseline mean by more than the threshold percentage.
 * The signal is advisory only.
 */
public final class DriftMonitor {
    private static final Logger logger = LoggerFactory.getLogger(DriftMonitor.class);

    private final int window;
    private final double thresholdPercent;
    private final Deque<Double> history = new ArrayDeque<>();

    public DriftMonitor(int window, double thresholdPercent) {
        this.window = window;
        this.thresholdPercent = thresholdPercent;
    }

    public record Verdict(boolean drift, Double baseline) {
    }

    public synchronized Verdict record(double rmse) {
        Double baseline = history.isEmpty()
            ? null
            : history.stream().mapToDouble(Double::doubleValue).average().orElse(rmse);
        boolean drift = baseline != null && rmse > baseline * (1.0 + thresholdPercent / 100.0);
        if (drift) {
            logger.warn("⚠️ Model drift: RMSE {} vs baseline {} (threshold +{}%)",
                String.format("%.3f", rmse), String.format("%.3f", baseline), String.format("%.0f", thresholdPercent));
        }
        history.addLast(rmse);
        while (history.size() > window) {
            history.removeFirst();
        }
        return new Verdict(drift, baseline);
    }

    public synchronized int size() {
        return history.size();
    }
}

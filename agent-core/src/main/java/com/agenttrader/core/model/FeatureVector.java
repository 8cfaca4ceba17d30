package com.agenttrader.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Technical features derived for one bar using only that bar and the bars before it.
 * <p>
 * Absolute values (moving averages, MACD, momentum) are kept as computed so they can be
 * reported; {@link #modelInputs()} turns them into price-relative inputs for the ensemble.
 *
 * @param laggedCloses closes at t-1 .. t-5, most recent first
 * @param momentum5    close minus the close five bars earlier
 * @param volumeDelta  volume minus the previous bar's volume
 */
public record FeatureVector(
    String symbol,
    LocalDate date,
    double close,
    double high,
    double low,
    double volume,
    double rsi,
    double macd,
    double macdSignal,
    double bbPosition,
    double ma5,
    double ma10,
    double ma20,
    double ma50,
    double momentum5,
    double momentum10,
    List<Double> laggedCloses,
    double volumeDelta
) {
    public static final int LAG_COUNT = 5;

    public static final List<String> INPUT_NAMES = List.of(
        "rsi", "macd_pct", "macd_signal_pct", "macd_hist_pct", "bb_position",
        "close_ma5", "close_ma10", "close_ma20", "close_ma50", "ma5_ma20",
        "momentum5_pct", "momentum10_pct",
        "return_lag1", "return_lag2", "return_lag3", "return_lag4", "return_lag5",
        "volume_change_pct", "range_pct");

    public FeatureVector {
        laggedCloses = List.copyOf(laggedCloses);
        if (laggedCloses.size() != LAG_COUNT) {
            throw new IllegalArgumentException("expected " + LAG_COUNT + " lagged closes, got " + laggedCloses.size());
        }
    }

    public double macdHistogram() {
        return macd - macdSignal;
    }

    public IndicatorSnapshot snapshot() {
        return new IndicatorSnapshot(rsi, macd, macdSignal, macdHistogram(), bbPosition, ma5, ma20, ma50);
    }

    /**
     * Price-relative inputs in {@link #INPUT_NAMES} order.
     */
    public double[] modelInputs() {
        double[] x = new double[INPUT_NAMES.size()];
        x[0] = rsi;
        x[1] = percentOf(macd, close);
        x[2] = percentOf(macdSignal, close);
        x[3] = percentOf(macdHistogram(), close);
        x[4] = bbPosition;
        x[5] = ratio(close, ma5);
        x[6] = ratio(close, ma10);
        x[7] = ratio(close, ma20);
        x[8] = ratio(close, ma50);
        x[9] = ratio(ma5, ma20);
        x[10] = percentOf(momentum5, close - momentum5);
        x[11] = percentOf(momentum10, close - momentum10);

        double newer = close;
        for (int i = 0; i < LAG_COUNT; i++) {
            double older = laggedCloses.get(i);
            x[12 + i] = older > 0 ? (newer / older - 1.0) * 100.0 : 0.0;
            newer = older;
        }

        x[17] = percentOf(volumeDelta, volume - volumeDelta);
        x[18] = percentOf(high - low, close);
        return x;
    }

    private static double percentOf(double value, double base) {
        return base > 0 ? value / base * 100.0 : 0.0;
    }

    private static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 1.0;
    }
}

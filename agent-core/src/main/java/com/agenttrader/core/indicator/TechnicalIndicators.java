package com.agenttrader.core.indicator;

import java.util.Arrays;

/**
 * Indicator series over a close (or volume) array.
 * <p>
 * Every output element {@code out[i]} depends only on {@code x[0..i]}. Positions without a full
 * window are {@code NaN}.
 */
public final class TechnicalIndicators {

    public static final double NEUTRAL_RSI = 50.0;
    public static final double NEUTRAL_BB_POSITION = 0.5;

    private TechnicalIndicators() {
    }

    public static double[] sma(double[] x, int period) {
        double[] out = nanArray(x.length);
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            sum += x[i];
            if (i >= period) {
                sum -= x[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Recursive exponential moving average seeded with the first value,
     * {@code alpha = 2 / (span + 1)}.
     */
    public static double[] ema(double[] x, int span) {
        double[] out = new double[x.length];
        if (x.length == 0) {
            return out;
        }
        double alpha = 2.0 / (span + 1.0);
        out[0] = x[0];
        for (int i = 1; i < x.length; i++) {
            out[i] = alpha * x[i] + (1.0 - alpha) * out[i - 1];
        }
        return out;
    }

    /**
     * RSI from simple rolling means of gains and losses over {@code period} changes.
     * A flat window reads as neutral 50; a window with gains and no losses reads 100.
     */
    public static double[] rsi(double[] close, int period) {
        double[] out = nanArray(close.length);
        for (int i = period; i < close.length; i++) {
            double gain = 0.0;
            double loss = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double change = close[j] - close[j - 1];
                if (change > 0) {
                    gain += change;
                } else {
                    loss -= change;
                }
            }
            gain /= period;
            loss /= period;
            if (loss == 0.0) {
                out[i] = gain == 0.0 ? NEUTRAL_RSI : 100.0;
            } else {
                out[i] = 100.0 - 100.0 / (1.0 + gain / loss);
            }
        }
        return out;
    }

    public record Macd(double[] line, double[] signal) {
    }

    public static Macd macd(double[] close, int fast, int slow, int signalSpan) {
        double[] fastEma = ema(close, fast);
        double[] slowEma = ema(close, slow);
        double[] line = new double[close.length];
        for (int i = 0; i < close.length; i++) {
            line[i] = fastEma[i] - slowEma[i];
        }
        return new Macd(line, ema(line, signalSpan));
    }

    /**
     * Sample standard deviation over a rolling window.
     */
    public static double[] rollingStd(double[] x, int period) {
        double[] out = nanArray(x.length);
        for (int i = period - 1; i < x.length; i++) {
            double mean = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                mean += x[j];
            }
            mean /= period;
            double ss = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double d = x[j] - mean;
                ss += d * d;
            }
            out[i] = Math.sqrt(ss / (period - 1));
        }
        return out;
    }

    /**
     * Location of the close within the Bollinger band, clamped to [0, 1].
     * A zero-width band reads as the neutral midpoint.
     */
    public static double[] bollingerPosition(double[] close, int period, double width) {
        double[] mid = sma(close, period);
        double[] std = rollingStd(close, period);
        double[] out = nanArray(close.length);
        for (int i = period - 1; i < close.length; i++) {
            double upper = mid[i] + width * std[i];
            double lower = mid[i] - width * std[i];
            double span = upper - lower;
            if (!(span > 1e-12)) {
                out[i] = NEUTRAL_BB_POSITION;
            } else {
                out[i] = Math.max(0.0, Math.min(1.0, (close[i] - lower) / span));
            }
        }
        return out;
    }

    private static double[] nanArray(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}

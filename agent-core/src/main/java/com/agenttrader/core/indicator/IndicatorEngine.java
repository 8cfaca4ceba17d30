package com.agenttrader.core.indicator;

import com.agenttrader.core.exception.InsufficientDataException;
import com.agenttrader.core.exception.InvalidSymbolException;
import com.agenttrader.core.model.Bar;
import com.agenttrader.core.model.FeatureVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an ascending bar history into feature vectors.
 * <p>
 * RSI(14), MACD(12,26,9), Bollinger(20, 2σ), MA 5/10/20/50, momentum over 5 and 10 bars,
 * five lagged closes and volume delta. A feature vector for bar {@code i} is built only from
 * bars {@code 0..i}, so {@link #computeSeries} and {@link #computeFeatures} agree on every prefix.
 */
public final class IndicatorEngine {
    private static final Logger logger = LoggerFactory.getLogger(IndicatorEngine.class);

    /** Bars needed before the first feature vector exists. */
    public static final int MIN_LOOKBACK = 50;

    static final int RSI_PERIOD = 14;
    static final int MACD_FAST = 12;
    static final int MACD_SLOW = 26;
    static final int MACD_SIGNAL = 9;
    static final int BB_PERIOD = 20;
    static final double BB_WIDTH = 2.0;

    /**
     * Features at the last bar.
     *
     * @throws InsufficientDataException when fewer than {@link #MIN_LOOKBACK} bars are given
     * @throws InvalidSymbolException    when bars of different symbols are mixed
     */
    public FeatureVector computeFeatures(List<Bar> bars) throws InsufficientDataException, InvalidSymbolException {
        String symbol = bars.isEmpty() ? "UNKNOWN" : bars.get(0).symbol();
        List<FeatureVector> series = computeSeries(symbol, bars);
        if (series.isEmpty()) {
            throw new InsufficientDataException(symbol, bars.size(), MIN_LOOKBACK);
        }
        return series.get(series.size() - 1);
    }

    /**
     * Features for every bar that has a full lookback, oldest first.
     * Returns an empty list when the history is too short.
     *
     * @throws InvalidSymbolException when a bar belongs to another symbol
     */
    public List<FeatureVector> computeSeries(String symbol, List<Bar> bars) throws InvalidSymbolException {
        validate(symbol, bars);
        int n = bars.size();
        if (n < MIN_LOOKBACK) {
            logger.debug("{}: {} bars, need {}", symbol, n, MIN_LOOKBACK);
            return List.of();
        }

        double[] close = new double[n];
        for (int i = 0; i < n; i++) {
            close[i] = bars.get(i).close();
        }

        double[] rsi = TechnicalIndicators.rsi(close, RSI_PERIOD);
        TechnicalIndicators.Macd macd = TechnicalIndicators.macd(close, MACD_FAST, MACD_SLOW, MACD_SIGNAL);
        double[] bb = TechnicalIndicators.bollingerPosition(close, BB_PERIOD, BB_WIDTH);
        double[] ma5 = TechnicalIndicators.sma(close, 5);
        double[] ma10 = TechnicalIndicators.sma(close, 10);
        double[] ma20 = TechnicalIndicators.sma(close, 20);
        double[] ma50 = TechnicalIndicators.sma(close, 50);

        List<FeatureVector> out = new ArrayList<>(n - MIN_LOOKBACK + 1);
        for (int i = MIN_LOOKBACK - 1; i < n; i++) {
            Bar bar = bars.get(i);
            List<Double> lags = new ArrayList<>(FeatureVector.LAG_COUNT);
            for (int k = 1; k <= FeatureVector.LAG_COUNT; k++) {
                lags.add(close[i - k]);
            }
            out.add(new FeatureVector(
                symbol,
                bar.date(),
                close[i],
                bar.high(),
                bar.low(),
                bar.volume(),
                finiteOr(rsi[i], TechnicalIndicators.NEUTRAL_RSI),
                finiteOr(macd.line()[i], 0.0),
                finiteOr(macd.signal()[i], 0.0),
                finiteOr(bb[i], TechnicalIndicators.NEUTRAL_BB_POSITION),
                ma5[i],
                ma10[i],
                ma20[i],
                ma50[i],
                close[i] - close[i - 5],
                close[i] - close[i - 10],
                lags,
                bar.volume() - bars.get(i - 1).volume()));
        }
        return out;
    }

    private static void validate(String symbol, List<Bar> bars) throws InvalidSymbolException {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidSymbolException(String.valueOf(symbol), "symbol is blank");
        }
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (!symbol.equals(bar.symbol())) {
                throw new InvalidSymbolException(symbol, "history contains a bar for " + bar.symbol());
            }
            if (i > 0 && !bar.date().isAfter(bars.get(i - 1).date())) {
                throw new IllegalArgumentException(String.format(
                    "%s bars must be strictly ascending by date (%s after %s)",
                    symbol, bar.date(), bars.get(i - 1).date()));
            }
        }
    }

    private static double finiteOr(double value, double fallback) {
        return Double.isFinite(value) ? value : fallback;
    }
}

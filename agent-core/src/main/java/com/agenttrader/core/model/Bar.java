package com.agenttrader.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One OHLCV record for a symbol on a given date.
 *
 * @param preMarket  optional pre-market price, {@code null} when unknown
 * @param afterHours optional after-hours price, {@code null} when unknown
 */
public record Bar(
    String symbol,
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    double volume,
    Double preMarket,
    Double afterHours
) {
    public Bar {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(date, "date");
        if (!(close > 0) || !Double.isFinite(close)) {
            throw new IllegalArgumentException("close must be a positive finite price for " + symbol + " on " + date);
        }
        if (volume < 0 || !Double.isFinite(volume)) {
            throw new IllegalArgumentException("volume must be finite and non-negative for " + symbol + " on " + date);
        }
    }

    public Bar(String symbol, LocalDate date, double open, double high, double low, double close, double volume) {
        this(symbol, date, open, high, low, close, volume, null, null);
    }
}

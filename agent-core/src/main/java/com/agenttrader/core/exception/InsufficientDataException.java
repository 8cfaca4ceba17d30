package com.agenttrader.core.exception;

/**
 * Raised when a symbol does not have enough bars for the indicator lookback.
 */
public class InsufficientDataException extends TradingException {

    private final int available;
    private final int required;

    public InsufficientDataException(String symbol, int available, int required) {
        super(symbol, String.format("%s has %d bars, %d required", symbol, available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}

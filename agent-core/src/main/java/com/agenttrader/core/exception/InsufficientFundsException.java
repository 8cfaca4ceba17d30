package com.agenttrader.core.exception;

/**
 * A BUY whose notional exceeds available cash.
 */
public class InsufficientFundsException extends TradingException {

    private final double required;
    private final double available;

    public InsufficientFundsException(String symbol, double required, double available) {
        super(symbol, String.format("Insufficient funds for %s: need $%.2f, have $%.2f",
            symbol, required, available));
        this.required = required;
        this.available = available;
    }

    public double getRequired() {
        return required;
    }

    public double getAvailable() {
        return available;
    }
}

package com.agenttrader.core.exception;

/**
 * Base type for recoverable pipeline conditions.
 * <p>
 * A {@code TradingException} always concerns a single symbol or a single order.
 * The coordinator captures it into that symbol's result and moves on.
 */
public class TradingException extends Exception {

    private final String symbol;

    public TradingException(String symbol, String message) {
        super(message);
        this.symbol = symbol;
    }

    public TradingException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}

package com.agenttrader.core.exception;

/**
 * A SELL for more shares than the position holds.
 */
public class InsufficientSharesException extends TradingException {

    private final long requested;
    private final long held;

    public InsufficientSharesException(String symbol, long requested, long held) {
        super(symbol, String.format("Insufficient shares of %s: requested %d, held %d",
            symbol, requested, held));
        this.requested = requested;
        this.held = held;
    }

    public long getRequested() {
        return requested;
    }

    public long getHeld() {
        return held;
    }
}

package com.agenttrader.core.exception;

public class InvalidSymbolException extends TradingException {

    public InvalidSymbolException(String symbol, String reason) {
        super(symbol, "Invalid symbol '" + symbol + "': " + reason);
    }
}

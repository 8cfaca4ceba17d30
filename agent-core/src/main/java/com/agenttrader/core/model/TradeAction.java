package com.agenttrader.core.model;

public enum TradeAction {
    BUY,
    SELL,
    HOLD
}

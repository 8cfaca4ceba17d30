package com.agenttrader.core.model;

public enum TransactionType {
    BUY,
    SELL
}

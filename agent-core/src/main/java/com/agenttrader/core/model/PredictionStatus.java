package com.agenttrader.core.model;

public enum PredictionStatus {
    PREDICTED,
    INSUFFICIENT_DATA,
    ERROR
}

package com.agenttrader.core.model;

public enum CycleState {
    STARTED,
    PREDICTING,
    DECIDING,
    EXECUTING,
    FEEDBACK,
    COMPLETE
}

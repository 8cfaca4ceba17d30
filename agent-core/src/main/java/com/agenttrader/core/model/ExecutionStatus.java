package com.agenttrader.core.model;

public enum ExecutionStatus {
    EXECUTED,
    FAILED,
    SKIPPED,
    HELD
}

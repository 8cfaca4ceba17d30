package com.agenttrader.core.model;

/**
 * Which policy produced a {@link Decision}.
 */
public enum DecisionSource {
    RULE_BASED,
    ML_MODEL
}

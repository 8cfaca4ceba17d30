package com.agenttrader.core.forecast;

public record FeatureImportance(String feature, double importance) {
}

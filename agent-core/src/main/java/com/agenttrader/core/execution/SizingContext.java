package com.agenttrader.core.execution;

/**
 * Market and portfolio figures an order is sized against.
 */
public record SizingContext(double currentPrice, double totalValue) {
}

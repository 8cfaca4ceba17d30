package com.agenttrader.core.execution;

/**
 * What to do with a SELL that asks for more shares than the ledger holds.
 */
public enum SellPolicy {
    /** Fail the order with InsufficientShares and leave the ledger untouched. */
    HARD_FAIL,
    /** Reduce the order to the held quantity. */
    CLIP_TO_AVAILABLE
}

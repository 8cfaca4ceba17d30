package com.agenttrader.core.exception;

/**
 * A ledger invariant no longer holds. This is a bug, never a business case.
 */
public class LedgerCorruptionException extends RuntimeException {

    public LedgerCorruptionException(String message) {
        super(message);
    }
}

package com.poolledger.common.exception;

/**
 * Base exception for all pool ledger exceptions.
 */
public abstract class PoolLedgerException extends RuntimeException {

    private final ErrorCategory category;

    protected PoolLedgerException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}

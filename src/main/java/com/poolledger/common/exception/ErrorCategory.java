package com.poolledger.common.exception;

/**
 * Categories of domain errors. Every rejected operation reports exactly one of these.
 */
public enum ErrorCategory {
    /**
     * Malformed request: non-positive amount, zero identifier, no-op role transfer,
     * mismatched batch lengths, arithmetic overflow.
     */
    VALIDATION,

    /**
     * Caller is not the current authority or owner.
     */
    AUTHORIZATION,

    /**
     * Requested amount exceeds what is available.
     */
    INSUFFICIENT_FUNDS,

    /**
     * A cross-contract transfer delivered less value than requested.
     */
    RECONCILIATION,

    /**
     * The value transfer mechanism itself failed, or the recipient rejected the value.
     */
    TRANSPORT,

    /**
     * A guarded operation was re-entered while already in progress.
     */
    REENTRANCY,

    NOT_FOUND
}

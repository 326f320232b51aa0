package com.poolledger.common.exception;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;

/**
 * Thrown when a ledger contract accepted a withdrawal but the value that actually
 * arrived is less than what was requested.
 */
public class ReconciliationException extends PoolLedgerException {

    private final Amount requested;
    private final Amount received;

    public ReconciliationException(Address target, Amount requested, Amount received) {
        super(ErrorCategory.RECONCILIATION,
            String.format("Withdrawal from %s delivered %s, requested %s", target, received, requested));
        this.requested = requested;
        this.received = received;
    }

    public Amount getRequested() {
        return requested;
    }

    public Amount getReceived() {
        return received;
    }
}

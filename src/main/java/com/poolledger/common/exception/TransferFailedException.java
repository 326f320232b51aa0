package com.poolledger.common.exception;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;

/**
 * Thrown when moving value between addresses fails at the transport level:
 * the sender does not actually hold the value, the recipient is unusable,
 * or the recipient refuses it.
 *
 * Distinct from {@link InsufficientFundsException}, which is raised by contract-level checks
 * before any transfer is attempted.
 */
public class TransferFailedException extends PoolLedgerException {

    private final Address from;
    private final Address to;

    public TransferFailedException(Address from, Address to, Amount amount, String reason) {
        super(ErrorCategory.TRANSPORT,
            String.format("Transfer of %s from %s to %s failed: %s", amount, from, to, reason));
        this.from = from;
        this.to = to;
    }

    public Address getFrom() {
        return from;
    }

    public Address getTo() {
        return to;
    }
}

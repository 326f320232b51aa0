package com.poolledger.common.exception;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;

/**
 * Thrown when a contract holds less value than an operation requires.
 */
public class InsufficientFundsException extends PoolLedgerException {

    public InsufficientFundsException(Address holder, Amount required, Amount available) {
        super(ErrorCategory.INSUFFICIENT_FUNDS,
            String.format("Insufficient funds in %s. Required: %s, Available: %s",
                holder, required, available));
    }

    public InsufficientFundsException(Address holder, String reason) {
        super(ErrorCategory.INSUFFICIENT_FUNDS, String.format("Insufficient funds in %s: %s", holder, reason));
    }
}

package com.poolledger.common.exception;

import com.poolledger.common.Address;

/**
 * Thrown when the caller does not hold the role an operation is gated on.
 */
public class UnauthorizedCallerException extends PoolLedgerException {

    private final Address caller;

    public UnauthorizedCallerException(Address caller, String role, Address contract) {
        super(ErrorCategory.AUTHORIZATION,
            String.format("Caller %s is not the %s of %s", caller, role, contract));
        this.caller = caller;
    }

    public Address getCaller() {
        return caller;
    }
}

package com.poolledger.common.exception;

import com.poolledger.common.Address;

/**
 * Thrown when a guarded operation on a contract is entered again before the
 * outer operation on the same contract has completed.
 */
public class ReentrantCallException extends PoolLedgerException {

    public ReentrantCallException(Address contract) {
        super(ErrorCategory.REENTRANCY, "Re-entrant call into " + contract);
    }
}

package com.poolledger.common.exception;

import com.poolledger.common.Address;

/**
 * Thrown when no contract is deployed at an address.
 */
public class ContractNotFoundException extends PoolLedgerException {

    public ContractNotFoundException(String kind, Address address) {
        super(ErrorCategory.NOT_FOUND, kind + " not found: " + address);
    }
}

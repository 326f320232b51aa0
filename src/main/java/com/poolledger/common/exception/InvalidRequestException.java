package com.poolledger.common.exception;

/**
 * Thrown when a request fails validation before any state is touched.
 */
public class InvalidRequestException extends PoolLedgerException {

    public InvalidRequestException(String message) {
        super(ErrorCategory.VALIDATION, message);
    }
}

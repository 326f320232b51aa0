package com.poolledger.common.exception;

import java.math.BigInteger;

/**
 * Thrown when an addition would exceed the largest representable amount.
 * Amounts never wrap.
 */
public class AmountOverflowException extends InvalidRequestException {

    public AmountOverflowException(BigInteger left, BigInteger right) {
        super(String.format("Amount overflow: %s + %s", left, right));
    }
}

package com.poolledger.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.poolledger.common.exception.AmountOverflowException;
import com.poolledger.common.exception.InvalidRequestException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigInteger;

/**
 * Immutable non-negative amount of value in base units.
 *
 * Amounts are bounded by 2^256 - 1. Arithmetic that would leave the range
 * is rejected rather than wrapped or saturated.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Amount implements Comparable<Amount> {

    public static final BigInteger MAX_VALUE = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    public static final Amount ZERO = new Amount(BigInteger.ZERO);

    public static final Amount MAX = new Amount(MAX_VALUE);

    @JsonValue
    BigInteger value;

    @JsonCreator
    public static Amount of(BigInteger value) {
        if (value == null) {
            throw new InvalidRequestException("Amount cannot be null");
        }
        if (value.signum() < 0) {
            throw new InvalidRequestException("Amount cannot be negative: " + value);
        }
        if (value.compareTo(MAX_VALUE) > 0) {
            throw new InvalidRequestException("Amount out of range: " + value);
        }
        return value.signum() == 0 ? ZERO : new Amount(value);
    }

    public static Amount of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public static Amount of(String value) {
        try {
            return of(new BigInteger(value));
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Not an integer amount: " + value);
        }
    }

    public Amount add(Amount other) {
        BigInteger sum = this.value.add(other.value);
        if (sum.compareTo(MAX_VALUE) > 0) {
            throw new AmountOverflowException(this.value, other.value);
        }
        return new Amount(sum);
    }

    /**
     * Subtract, rejecting a negative result. Callers check sufficiency first.
     */
    public Amount subtract(Amount other) {
        if (this.isLessThan(other)) {
            throw new IllegalStateException(
                String.format("Amount underflow: %s - %s", this.value, other.value));
        }
        return of(this.value.subtract(other.value));
    }

    public Amount min(Amount other) {
        return this.compareTo(other) <= 0 ? this : other;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    public boolean isGreaterThan(Amount other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Amount other) {
        return this.value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}

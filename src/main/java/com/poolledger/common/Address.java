package com.poolledger.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.poolledger.common.exception.InvalidRequestException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Opaque identifier of an account or contract.
 *
 * Addresses only support equality. The all-zero address is a distinguished value that is
 * never a valid role holder, transfer recipient or leaderboard entry.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Address {

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    private static final SecureRandom RANDOM = new SecureRandom();

    @JsonValue
    String value;

    @JsonCreator
    public static Address of(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidRequestException("Address cannot be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals(ZERO.value)) {
            return ZERO;
        }
        return new Address(normalized);
    }

    /**
     * Generate a fresh address for a newly deployed contract.
     */
    public static Address random() {
        byte[] bytes = new byte[20];
        RANDOM.nextBytes(bytes);
        return new Address("0x" + HexFormat.of().formatHex(bytes));
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    @Override
    public String toString() {
        return value;
    }
}

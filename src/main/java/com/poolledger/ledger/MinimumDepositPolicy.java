package com.poolledger.ledger;

import com.poolledger.common.Amount;
import com.poolledger.common.exception.InvalidRequestException;

/**
 * Smallest deposit a bank accepts.
 */
@FunctionalInterface
public interface MinimumDepositPolicy {

    Amount floor();

    default void check(Amount deposit) {
        Amount floor = floor();
        if (deposit.isLessThan(floor)) {
            throw new InvalidRequestException(
                String.format("Deposit %s is below the minimum of %s", deposit, floor));
        }
    }

    static MinimumDepositPolicy unrestricted() {
        return () -> Amount.ZERO;
    }

    static MinimumDepositPolicy atLeast(Amount floor) {
        return () -> floor;
    }
}

package com.poolledger.agent;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import lombok.Value;

/**
 * Result of one target in a batch withdrawal.
 */
@Value
public class WithdrawalOutcome {
    Address target;
    Amount requested;
    Amount received;
    boolean skipped;

    public static WithdrawalOutcome withdrawn(Address target, Amount requested, Amount received) {
        return new WithdrawalOutcome(target, requested, received, false);
    }

    public static WithdrawalOutcome skipped(Address target, Amount requested) {
        return new WithdrawalOutcome(target, requested, Amount.ZERO, true);
    }
}

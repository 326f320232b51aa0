package com.poolledger.bank;

import com.poolledger.common.Amount;
import com.poolledger.ledger.MinimumDepositPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Maps a bank variant to its minimum deposit policy.
 */
@Component
public class MinimumDepositPolicies {

    private final MinimumDepositPolicy enforced;

    public MinimumDepositPolicies(
            @Value("${pool-ledger.deposit.minimum-floor:1000000000000000}") BigInteger minimumFloor) {
        this.enforced = MinimumDepositPolicy.atLeast(Amount.of(minimumFloor));
    }

    public MinimumDepositPolicy policyFor(BankVariant variant) {
        return switch (variant) {
            case UNRESTRICTED -> MinimumDepositPolicy.unrestricted();
            case MINIMUM_ENFORCED -> enforced;
        };
    }
}

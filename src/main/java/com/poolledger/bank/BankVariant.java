package com.poolledger.bank;

/**
 * Deposit policy variants of a bank. Both share the same ledger and leaderboard behavior;
 * they differ only in the smallest deposit accepted.
 */
public enum BankVariant {
    /**
     * Any positive deposit is accepted.
     */
    UNRESTRICTED,

    /**
     * Deposits below the configured floor are rejected.
     */
    MINIMUM_ENFORCED
}

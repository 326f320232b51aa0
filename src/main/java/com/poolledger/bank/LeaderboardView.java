package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of a bank's leaderboard as parallel lists, highest first.
 * Empty slots report a {@code null} account and a zero amount.
 */
@Value
public class LeaderboardView {
    List<Address> accounts;
    List<Amount> amounts;
}

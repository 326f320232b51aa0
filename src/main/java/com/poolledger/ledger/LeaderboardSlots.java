package com.poolledger.ledger;

import com.poolledger.common.Address;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Persistent form of a leaderboard: three account identifiers, {@code null} marking an empty slot.
 * Balances are never stored here.
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardSlots {

    @Column(name = "leader_first")
    private Address first;

    @Column(name = "leader_second")
    private Address second;

    @Column(name = "leader_third")
    private Address third;

    public static LeaderboardSlots of(List<Address> slots) {
        if (slots.size() != Leaderboard.CAPACITY) {
            throw new IllegalArgumentException("Expected " + Leaderboard.CAPACITY + " slots, got " + slots.size());
        }
        return new LeaderboardSlots(slots.get(0), slots.get(1), slots.get(2));
    }

    public List<Address> toList() {
        return Arrays.asList(first, second, third);
    }
}

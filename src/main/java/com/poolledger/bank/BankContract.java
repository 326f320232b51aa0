package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.ledger.AuthorityRole;
import com.poolledger.ledger.LeaderboardSlots;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A deployed bank: the pool of deposited value, its authority and its leaderboard.
 *
 * The pooled balance is not stored here; it is the value held by the bank's address.
 * Per-account contributions live in {@link com.poolledger.ledger.DepositBalance}.
 */
@Entity
@Table(name = "banks", indexes = {
    @Index(name = "idx_bank_address", columnList = "address", unique = true)
})
@Data
@NoArgsConstructor
public class BankContract {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true, updatable = false)
    private Address address;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private BankVariant variant;

    /**
     * The only address allowed to withdraw pooled value or hand the role over.
     */
    @Embedded
    @AttributeOverride(name = "holder", column = @Column(name = "authority", nullable = false))
    private AuthorityRole authority;

    @Embedded
    private LeaderboardSlots leaderboard;

    @Column(nullable = false, updatable = false)
    private Address deployer;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public BankContract(Address address, Address deployer, BankVariant variant) {
        this.address = address;
        this.deployer = deployer;
        this.variant = variant;
        this.authority = new AuthorityRole(deployer);
        this.leaderboard = new LeaderboardSlots();
        this.createdAt = Instant.now();
    }

    /**
     * An empty leaderboard loads as {@code null}; expose it as empty slots instead.
     */
    public LeaderboardSlots getLeaderboard() {
        return leaderboard != null ? leaderboard : new LeaderboardSlots();
    }
}

package com.poolledger.ledger;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cumulative deposits of one account into one bank.
 *
 * This is a record of contribution, not a claim: withdrawals drain the bank's pool
 * without being attributed to any account, so a recorded balance never decreases.
 */
@Entity
@Table(name = "deposit_balances", uniqueConstraints = {
    @UniqueConstraint(name = "uk_deposit_bank_account", columnNames = {"bank_address", "account"})
})
@Data
@NoArgsConstructor
public class DepositBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "bank_address", nullable = false, updatable = false)
    private Address bankAddress;

    @Column(nullable = false, updatable = false)
    private Address account;

    @Column(nullable = false, precision = 78, scale = 0)
    private Amount balance;

    @Column(name = "first_deposit_at", nullable = false, updatable = false)
    private Instant firstDepositAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public DepositBalance(Address bankAddress, Address account) {
        this.bankAddress = bankAddress;
        this.account = account;
        this.balance = Amount.ZERO;
        this.firstDepositAt = Instant.now();
        this.updatedAt = this.firstDepositAt;
    }

    public void increase(Amount amount) {
        this.balance = this.balance.add(amount);
        this.updatedAt = Instant.now();
    }
}

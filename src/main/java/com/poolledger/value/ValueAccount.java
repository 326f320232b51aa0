package com.poolledger.value;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Value held by a single address: an external account, a bank or an agent.
 *
 * A bank's pooled balance is the balance of the bank's own value account.
 */
@Entity
@Table(name = "value_accounts", indexes = {
    @Index(name = "idx_value_account_address", columnList = "address", unique = true)
})
@Data
@NoArgsConstructor
public class ValueAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true, updatable = false)
    private Address address;

    @Column(nullable = false, precision = 78, scale = 0)
    private Amount balance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ValueAccount(Address address) {
        this.address = address;
        this.balance = Amount.ZERO;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void credit(Amount amount) {
        this.balance = this.balance.add(amount);
        this.updatedAt = Instant.now();
    }

    /**
     * Callers verify the balance covers the amount before debiting.
     */
    public void debit(Amount amount) {
        this.balance = this.balance.subtract(amount);
        this.updatedAt = Instant.now();
    }
}

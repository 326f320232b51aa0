package com.poolledger.events;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable event emitted by a bank or agent contract.
 *
 * Events are append-only. They are never updated or deleted.
 */
@Entity
@Table(name = "contract_events", indexes = {
    @Index(name = "idx_event_contract", columnList = "contract_address"),
    @Index(name = "idx_event_type", columnList = "event_type")
})
@Data
@NoArgsConstructor
public class ContractEvent {

    /**
     * Monotonic sequence number; orders events globally.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "event_sequence")
    private Long sequence;

    /**
     * The contract that emitted this event.
     */
    @Column(name = "contract_address", nullable = false, updatable = false)
    private Address contractAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private ContractEventType eventType;

    /**
     * Primary party of the event: depositor, authority, sender, target or previous role holder.
     */
    @Column(nullable = false, updatable = false)
    private Address subject;

    /**
     * Secondary party, only set for role transfers.
     */
    @Column(updatable = false)
    private Address counterparty;

    @Column(precision = 78, scale = 0, updatable = false)
    private Amount amount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public ContractEvent(Address contractAddress, ContractEventType eventType,
                         Address subject, Address counterparty, Amount amount) {
        this.contractAddress = contractAddress;
        this.eventType = eventType;
        this.subject = subject;
        this.counterparty = counterparty;
        this.amount = amount;
        this.createdAt = Instant.now();
    }
}

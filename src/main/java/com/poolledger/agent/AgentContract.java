package com.poolledger.agent;

import com.poolledger.common.Address;
import com.poolledger.ledger.AuthorityRole;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A deployed agent: an owner-gated contract that can hold the authority of any number of banks.
 *
 * Which banks an agent controls is never stored; it is read from each bank when needed.
 * The agent's own held value is the balance of its address.
 */
@Entity
@Table(name = "agents", indexes = {
    @Index(name = "idx_agent_address", columnList = "address", unique = true)
})
@Data
@NoArgsConstructor
public class AgentContract {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true, updatable = false)
    private Address address;

    @Embedded
    @AttributeOverride(name = "holder", column = @Column(name = "owner", nullable = false))
    private AuthorityRole owner;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public AgentContract(Address address, Address owner) {
        this.address = address;
        this.owner = new AuthorityRole(owner);
        this.createdAt = Instant.now();
    }
}

package com.poolledger.ledger;

import com.poolledger.common.Address;
import com.poolledger.common.exception.InvalidRequestException;
import com.poolledger.common.exception.UnauthorizedCallerException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A single-holder role: the authority of a bank or the owner of an agent.
 *
 * Hand-over is immediate and single-step. Transferring to an address nobody controls
 * permanently locks every operation gated on the role.
 */
@Embeddable
@Getter
@NoArgsConstructor
public class AuthorityRole {

    @Column(nullable = false)
    private Address holder;

    public AuthorityRole(Address holder) {
        if (holder == null || holder.isZero()) {
            throw new InvalidRequestException("Role holder cannot be the zero address");
        }
        this.holder = holder;
    }

    public boolean isHeldBy(Address caller) {
        return holder.equals(caller);
    }

    /**
     * @throws UnauthorizedCallerException if the caller does not hold the role
     */
    public void requireHolder(Address caller, String roleName, Address contract) {
        if (!isHeldBy(caller)) {
            throw new UnauthorizedCallerException(caller, roleName, contract);
        }
    }

    /**
     * Hand the role to a new holder.
     *
     * @return the previous holder
     * @throws UnauthorizedCallerException if the caller does not hold the role
     * @throws InvalidRequestException if the new holder is the zero address or the current holder
     */
    public Address transfer(Address caller, Address newHolder, String roleName, Address contract) {
        requireHolder(caller, roleName, contract);
        if (newHolder == null || newHolder.isZero()) {
            throw new InvalidRequestException("New " + roleName + " cannot be the zero address");
        }
        if (newHolder.equals(holder)) {
            throw new InvalidRequestException("New " + roleName + " is already the current " + roleName);
        }

        Address previous = holder;
        holder = newHolder;
        return previous;
    }
}

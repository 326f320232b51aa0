package com.poolledger.ledger;

import com.poolledger.common.Address;
import com.poolledger.common.exception.InvalidRequestException;
import com.poolledger.common.exception.UnauthorizedCallerException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthorityRoleTest {

    private final Address contract = Address.random();
    private final Address holder = Address.random();
    private final Address other = Address.random();

    @Test
    void testTransferSwapsHolder() {
        AuthorityRole role = new AuthorityRole(holder);

        Address previous = role.transfer(holder, other, "authority", contract);

        assertEquals(holder, previous);
        assertTrue(role.isHeldBy(other));
        assertFalse(role.isHeldBy(holder));
    }

    @Test
    void testTransferByNonHolderRejected() {
        AuthorityRole role = new AuthorityRole(holder);

        UnauthorizedCallerException e = assertThrows(UnauthorizedCallerException.class,
            () -> role.transfer(other, other, "authority", contract));
        assertEquals(other, e.getCaller());
        assertTrue(role.isHeldBy(holder));
    }

    @Test
    void testTransferToZeroAddressRejected() {
        AuthorityRole role = new AuthorityRole(holder);

        assertThrows(InvalidRequestException.class,
            () -> role.transfer(holder, Address.ZERO, "authority", contract));
        assertTrue(role.isHeldBy(holder));
    }

    @Test
    void testTransferToCurrentHolderRejected() {
        AuthorityRole role = new AuthorityRole(holder);

        assertThrows(InvalidRequestException.class,
            () -> role.transfer(holder, holder, "owner", contract));
    }

    @Test
    void testZeroAddressCannotHoldRole() {
        assertThrows(InvalidRequestException.class, () -> new AuthorityRole(Address.ZERO));
    }
}

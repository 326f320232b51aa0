package com.poolledger.common;

import com.poolledger.common.exception.AmountOverflowException;
import com.poolledger.common.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class AmountTest {

    @Test
    void testAdditionOverflowIsRejected() {
        assertThrows(AmountOverflowException.class, () -> Amount.MAX.add(Amount.of(1)));
        assertEquals(Amount.MAX, Amount.of(Amount.MAX_VALUE.subtract(BigInteger.ONE)).add(Amount.of(1)));
    }

    @Test
    void testNegativeAndOutOfRangeValuesRejected() {
        assertThrows(InvalidRequestException.class, () -> Amount.of(-1));
        assertThrows(InvalidRequestException.class, () -> Amount.of(Amount.MAX_VALUE.add(BigInteger.ONE)));
        assertThrows(InvalidRequestException.class, () -> Amount.of("12abc"));
    }

    @Test
    void testSubtractBelowZeroIsAnError() {
        assertThrows(IllegalStateException.class, () -> Amount.of(3).subtract(Amount.of(4)));
        assertEquals(Amount.ZERO, Amount.of(4).subtract(Amount.of(4)));
    }

    @Test
    void testMinAndComparisons() {
        assertEquals(Amount.of(3), Amount.of(3).min(Amount.of(7)));
        assertEquals(Amount.of(3), Amount.of(7).min(Amount.of(3)));
        assertTrue(Amount.of(7).isGreaterThan(Amount.of(3)));
        assertTrue(Amount.ZERO.isZero());
        assertFalse(Amount.ZERO.isPositive());
    }

    @Test
    void testAddressesCompareByNormalizedValue() {
        assertEquals(Address.of("0xABCDEF"), Address.of(" 0xabcdef "));
        assertTrue(Address.of("0x0000000000000000000000000000000000000000").isZero());
        assertNotEquals(Address.random(), Address.random());
        assertThrows(InvalidRequestException.class, () -> Address.of(" "));
    }
}

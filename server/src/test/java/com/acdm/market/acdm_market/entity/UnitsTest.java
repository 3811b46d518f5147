package com.acdm.market.acdm_market.entity;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class UnitsTest {

    @Test
    void parsesDecimalStringsIntoBaseUnits() {
        assertEquals(new BigInteger("10000000000000"), Units.parseNative("0.00001"));
        assertEquals(new BigInteger("4000000000000"), Units.parseNative("0.000004"));
        assertEquals(new BigInteger("1000000000000000000"), Units.parseNative("1"));
        assertEquals(BigInteger.valueOf(1_500_000), Units.parse("1.5", 6));
    }

    @Test
    void rejectsAmountsThatCannotBeRepresented() {
        assertThrows(IllegalArgumentException.class, () -> Units.parse("0.0000001", 6));
        assertThrows(IllegalArgumentException.class, () -> Units.parse("-1", 6));
        assertThrows(IllegalArgumentException.class, () -> Units.parse("abc", 6));
        assertThrows(IllegalArgumentException.class, () -> Units.parse(" ", 6));
    }

    @Test
    void formatsWithoutTrailingZeros() {
        assertEquals("0.00001", Units.formatNative(new BigInteger("10000000000000")));
        assertEquals("100000", Units.format(new BigInteger("100000000000"), 6));
    }
}

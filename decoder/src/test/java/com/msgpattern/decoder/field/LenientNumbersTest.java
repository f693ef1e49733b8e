package com.msgpattern.decoder.field;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pins down the prefix-parsing rules numeric fields decode with.
 */
class LenientNumbersTest {

    @Test
    void parseLong_wellFormed() {
        assertEquals(42, LenientNumbers.parseLong("42"));
        assertEquals(-17, LenientNumbers.parseLong("-17"));
        assertEquals(5, LenientNumbers.parseLong("+5"));
        assertEquals(0, LenientNumbers.parseLong("0"));
    }

    @Test
    void parseLong_usesLongestPrefix() {
        assertEquals(12, LenientNumbers.parseLong("12abc"));
        assertEquals(3, LenientNumbers.parseLong("3.99"));
        assertEquals(-8, LenientNumbers.parseLong("  \t-8 units"));
    }

    @Test
    void parseLong_noDigitsIsZero() {
        assertEquals(0, LenientNumbers.parseLong("abc"));
        assertEquals(0, LenientNumbers.parseLong(""));
        assertEquals(0, LenientNumbers.parseLong("-"));
        assertEquals(0, LenientNumbers.parseLong(" x12"));
    }

    @Test
    void parseLong_saturatesOnOverflow() {
        assertEquals(Long.MAX_VALUE, LenientNumbers.parseLong("9223372036854775807"));
        assertEquals(Long.MIN_VALUE, LenientNumbers.parseLong("-9223372036854775808"));
        assertEquals(Long.MAX_VALUE, LenientNumbers.parseLong("9223372036854775808"));
        assertEquals(Long.MIN_VALUE, LenientNumbers.parseLong("-99999999999999999999999"));
    }

    @Test
    void parseUnsignedLong_fullRange() {
        assertEquals(1700000000L, LenientNumbers.parseUnsignedLong("1700000000"));
        assertEquals("18446744073709551615",
                Long.toUnsignedString(LenientNumbers.parseUnsignedLong("18446744073709551615")));
        assertEquals("18446744073709551615",
                Long.toUnsignedString(LenientNumbers.parseUnsignedLong("18446744073709551616")));
    }

    @Test
    void parseUnsignedLong_negativeWraps() {
        assertEquals("18446744073709551615", Long.toUnsignedString(LenientNumbers.parseUnsignedLong("-1")));
        assertEquals(0, LenientNumbers.parseUnsignedLong("ts"));
        assertEquals(99, LenientNumbers.parseUnsignedLong("99ms"));
    }

    @Test
    void parseDouble_prefixes() {
        assertEquals(3.14, LenientNumbers.parseDouble("3.14"));
        assertEquals(350.0, LenientNumbers.parseDouble("3.5e2x"));
        assertEquals(0.5, LenientNumbers.parseDouble(".5"));
        assertEquals(7.0, LenientNumbers.parseDouble("7."));
        assertEquals(2.0, LenientNumbers.parseDouble("2e"));
        assertEquals(-1.25, LenientNumbers.parseDouble(" -1.25kg"));
    }

    @Test
    void parseDouble_specialWords() {
        assertEquals(Double.POSITIVE_INFINITY, LenientNumbers.parseDouble("inf"));
        assertEquals(Double.NEGATIVE_INFINITY, LenientNumbers.parseDouble("-Infinity"));
        assertTrue(Double.isNaN(LenientNumbers.parseDouble("NaN")));
    }

    @Test
    void parseDouble_noPrefixIsZero() {
        assertEquals(0.0, LenientNumbers.parseDouble("abc"));
        assertEquals(0.0, LenientNumbers.parseDouble("."));
        assertEquals(0.0, LenientNumbers.parseDouble(""));
        assertEquals(0.0, LenientNumbers.parseDouble("-e5"));
    }

    @Test
    void wholeTokenChecks() {
        assertTrue(LenientNumbers.isInteger("42"));
        assertTrue(LenientNumbers.isInteger(" -42 "));
        assertFalse(LenientNumbers.isInteger("42x"));
        assertFalse(LenientNumbers.isInteger(""));
        assertFalse(LenientNumbers.isInteger("4.2"));

        assertTrue(LenientNumbers.isDecimal("4.2"));
        assertTrue(LenientNumbers.isDecimal("1e-3"));
        assertTrue(LenientNumbers.isDecimal("inf"));
        assertFalse(LenientNumbers.isDecimal("4.2.1"));
        assertFalse(LenientNumbers.isDecimal("abc"));
    }
}

package com.stylgebra.numeric;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NumberTheoryTest {

    @Test
    public void testIsPrime() {
        assertFalse(NumberTheory.isPrime(-7));
        assertFalse(NumberTheory.isPrime(1));
        assertTrue(NumberTheory.isPrime(2));
        assertTrue(NumberTheory.isPrime(101));
        assertFalse(NumberTheory.isPrime(91));
        assertFalse(NumberTheory.isPrime(4294967296L));
    }

    @Test
    public void testTotient() {
        assertEquals(1, NumberTheory.totient(1));
        assertEquals(6, NumberTheory.totient(7));
        assertEquals(4, NumberTheory.totient(12));
        assertEquals(12, NumberTheory.totient(36));
        assertEquals(96, NumberTheory.totient(97));
        assertEquals(1L << 29, NumberTheory.totient(1L << 30));
        assertThrows(IllegalArgumentException.class, () -> NumberTheory.totient(0));
        assertThrows(ArithmeticException.class, () -> NumberTheory.totient(3_000_000_000L));
    }

    @Test
    public void testPrimitiveRoots() {
        assertEquals(3, NumberTheory.primitiveRoot(7));
        assertEquals(2, NumberTheory.primitiveRoot(13));
        assertEquals(3, NumberTheory.primitiveRoot(10));
        assertEquals(5, NumberTheory.primitiveRoot(23));
        assertEquals(2, NumberTheory.primitiveRoot(25));
        assertThrows(IllegalArgumentException.class, () -> NumberTheory.primitiveRoot(8));
    }

    @Test
    public void testPickPrimitiveRoot() {
        assertEquals(2, NumberTheory.pickPrimitiveRoot(13, 0));
        assertEquals(6, NumberTheory.pickPrimitiveRoot(13, 1));
        assertEquals(11, NumberTheory.pickPrimitiveRoot(13, 2));
        assertEquals(7, NumberTheory.pickPrimitiveRoot(13, 3));
        assertEquals(2, NumberTheory.pickPrimitiveRoot(13, 4));
    }

    @Test
    public void testPowMod() {
        assertEquals(7, NumberTheory.powMod(2, 11, 13));
    }
}

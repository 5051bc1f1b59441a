package com.stylgebra.numeric;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.random.Well19937c;
import org.eclipse.collections.api.set.primitive.MutableLongSet;
import org.eclipse.collections.impl.factory.primitive.LongSets;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class NiceRandomTest {
    private static final int DRAWS = 2000;

    @Test
    public void testDefaultIntegersReachOneAndTwoDigits() {
        NiceRandom random = new NiceRandom(7L, false);
        MutableLongSet seen = LongSets.mutable.empty();
        for (int i = 0; i < DRAWS; i++) {
            long n = random.niceInteger();
            assertTrue(n > -100 && n < 100, "out of range: " + n);
            seen.add(n);
        }
        assertTrue(seen.contains(0));
        assertTrue(seen.anySatisfy(n -> n >= 10));
        assertTrue(seen.anySatisfy(n -> n <= -10));
        assertTrue(seen.anySatisfy(n -> n > 0 && n < 10));
    }

    @Test
    public void testNoZeroWhenNotOk() {
        NiceRandom random = new NiceRandom(new Well19937c(3L), false).withZeroOk(false);
        for (int i = 0; i < DRAWS; i++) {
            assertNotEquals(0, random.niceInteger());
        }
    }

    @Test
    public void testDigitLikelihoods() {
        NiceRandom threeDigits = new NiceRandom(11L, false).withDigitLikelihoods(0, 0, 1);
        for (int i = 0; i < DRAWS; i++) {
            long n = Math.abs(threeDigits.niceInteger());
            assertTrue(n >= 100 && n < 1000, "not three digits: " + n);
        }
        assertThrows(IllegalArgumentException.class, () -> threeDigits.withDigitLikelihoods());
    }

    @Test
    public void testNegativeLikelihood() {
        NiceRandom positive = new NiceRandom(5L, false).withNegativeLikelihood(0);
        NiceRandom negative = new NiceRandom(5L, false).withNegativeLikelihood(1).withZeroOk(false);
        for (int i = 0; i < DRAWS; i++) {
            assertTrue(positive.niceInteger() >= 0);
            assertTrue(negative.niceInteger() < 0);
        }
    }

    @Test
    public void testRationals() {
        NiceRandom random = new NiceRandom(7L, true);
        boolean sawInteger = false;
        boolean sawFraction = false;
        for (int i = 0; i < DRAWS; i++) {
            BigFraction f = random.coefficient(i);
            assertEquals(1, f.getDenominator().signum());
            assertTrue(f.getDenominator().compareTo(BigInteger.valueOf(100)) < 0);
            if (f.getDenominator().equals(BigInteger.ONE)) {
                sawInteger = true;
            } else {
                sawFraction = true;
            }
        }
        assertTrue(sawInteger);
        assertTrue(sawFraction);
    }

    @Test
    public void testIntegerLikelihoodOneGivesIntegers() {
        NiceRandom random = new NiceRandom(9L, true).withIntegerLikelihood(1);
        for (int i = 0; i < DRAWS; i++) {
            assertEquals(BigInteger.ONE, random.niceRational().getDenominator());
        }
    }

    @Test
    public void testSeedsReproduce() {
        NiceRandom first = new NiceRandom(42L, true);
        NiceRandom second = new NiceRandom(42L, true);
        for (int i = 0; i < 20; i++) {
            assertEquals(first.coefficient(i), second.coefficient(i));
        }
    }
}

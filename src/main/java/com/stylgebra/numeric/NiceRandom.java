package com.stylgebra.numeric;

import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Draws integers and rationals of the kind one writes on a chalkboard when making up an
 * example: both signs, a few digits, now and then a plain integer among the fractions.
 * Seed it for reproducible output.
 *
 * <p>Likelihoods are probabilities in {@code [0, 1]}. The digit likelihoods give the relative
 * chances of drawing a number with 1, 2, 3, ... digits, at most nine.
 */
public class NiceRandom implements CoefficientSource {
    private static final double[] DEFAULT_DIGIT_LIKELIHOODS = {0.5, 0.5};
    private static final int MAX_DIGITS = 9;

    private final RandomGenerator random;
    private final boolean rationals;
    private final double[] digitLikelihoods;
    private final double negativeLikelihood;
    private final boolean zeroOk;
    private final double integerLikelihood;
    private final EnumeratedIntegerDistribution digits;

    public NiceRandom(long seed, boolean rationals) {
        this(new Well19937c(seed), rationals);
    }

    public NiceRandom(RandomGenerator random, boolean rationals) {
        this(random, rationals, DEFAULT_DIGIT_LIKELIHOODS, 0.5, true, 0.5);
    }

    private NiceRandom(RandomGenerator random, boolean rationals, double[] digitLikelihoods,
                       double negativeLikelihood, boolean zeroOk, double integerLikelihood) {
        if (digitLikelihoods.length == 0 || digitLikelihoods.length > MAX_DIGITS) {
            throw new IllegalArgumentException("Need between 1 and " + MAX_DIGITS + " digit likelihoods, got "
                + digitLikelihoods.length);
        }
        this.random = random;
        this.rationals = rationals;
        this.digitLikelihoods = digitLikelihoods.clone();
        this.negativeLikelihood = negativeLikelihood;
        this.zeroOk = zeroOk;
        this.integerLikelihood = integerLikelihood;
        int[] counts = new int[digitLikelihoods.length];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = i + 1;
        }
        this.digits = new EnumeratedIntegerDistribution(random, counts, this.digitLikelihoods);
    }

    public NiceRandom withDigitLikelihoods(double... likelihoods) {
        return new NiceRandom(random, rationals, likelihoods, negativeLikelihood, zeroOk, integerLikelihood);
    }

    public NiceRandom withNegativeLikelihood(double likelihood) {
        return new NiceRandom(random, rationals, digitLikelihoods, likelihood, zeroOk, integerLikelihood);
    }

    public NiceRandom withZeroOk(boolean ok) {
        return new NiceRandom(random, rationals, digitLikelihoods, negativeLikelihood, ok, integerLikelihood);
    }

    /**
     * @param likelihood chance that a rational is drawn as a plain integer; reducing to
     *                   lowest terms makes integers somewhat more frequent than this
     */
    public NiceRandom withIntegerLikelihood(double likelihood) {
        return new NiceRandom(random, rationals, digitLikelihoods, negativeLikelihood, zeroOk, likelihood);
    }

    public long niceInteger() {
        return niceInteger(negativeLikelihood, zeroOk);
    }

    /**
     * A nice numerator over a positive nice denominator. The denominator is 1 when the
     * numerator is zero or the draw calls for an integer.
     */
    public BigFraction niceRational() {
        long n = niceInteger(negativeLikelihood, zeroOk);
        long d = 1;
        if (n != 0 && random.nextDouble() >= integerLikelihood) {
            d = niceInteger(0, false);
        }
        return new BigFraction(n, d);
    }

    @Override
    public BigFraction coefficient(int index) {
        return rationals ? niceRational() : new BigFraction(niceInteger());
    }

    private long niceInteger(double negative, boolean zero) {
        int d = digits.sample();
        int upper = (int) Math.pow(10, d);
        int lower = d == 1 && zero ? 0 : upper / 10;
        long n = lower + random.nextInt(upper - lower);
        return random.nextDouble() < negative ? -n : n;
    }
}

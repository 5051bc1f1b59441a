package com.stylgebra.numeric;

import org.apache.commons.math3.primes.Primes;
import org.apache.commons.math3.util.ArithmeticUtils;
import org.eclipse.collections.api.list.primitive.MutableLongList;
import org.eclipse.collections.impl.factory.primitive.LongLists;

import java.math.BigInteger;

/**
 * Integer helpers for cyclotomic constructions.
 */
public final class NumberTheory {
    private NumberTheory() {
    }

    public static boolean isPrime(long n) {
        if (n < 2) {
            return false;
        }
        if (n <= Integer.MAX_VALUE) {
            return Primes.isPrime((int) n);
        }
        return BigInteger.valueOf(n).isProbablePrime(64);
    }

    /**
     * Euler's totient, for {@code n} up to {@link Integer#MAX_VALUE}.
     *
     * @throws ArithmeticException if {@code n} does not fit in an int
     */
    public static long totient(long n) {
        if (n < 1) {
            throw new IllegalArgumentException("totient is defined for positive integers, got " + n);
        }
        long result = n;
        MutableLongList factors = primeFactors(n);
        for (int i = 0; i < factors.size(); i++) {
            result -= result / factors.get(i);
        }
        return result;
    }

    /**
     * The smallest primitive root modulo {@code m}.
     *
     * @throws IllegalArgumentException if {@code m} has no primitive root
     */
    public static long primitiveRoot(long m) {
        if (m == 1 || m == 2) {
            return m - 1;
        }
        long phi = totient(m);
        MutableLongList factors = primeFactors(phi);
        for (long g = 2; g < m; g++) {
            if (ArithmeticUtils.gcd(g, m) != 1) {
                continue;
            }
            boolean generates = true;
            for (int i = 0; i < factors.size(); i++) {
                if (powMod(g, phi / factors.get(i), m) == 1) {
                    generates = false;
                    break;
                }
            }
            if (generates) {
                return g;
            }
        }
        throw new IllegalArgumentException("No primitive root modulo " + m);
    }

    /**
     * Picks the {@code k}-th primitive root modulo {@code m}, counting in the order
     * {@code g^u mod m} where {@code g} is the smallest primitive root and {@code u} runs
     * through the units modulo {@code phi(m)}. The index wraps around.
     */
    public static long pickPrimitiveRoot(long m, int k) {
        long g = primitiveRoot(m);
        long phi = totient(m);
        MutableLongList units = LongLists.mutable.empty();
        for (long u = 1; u <= phi; u++) {
            if (ArithmeticUtils.gcd(u, phi) == 1) {
                units.add(u);
            }
        }
        int index = Math.floorMod(k, units.size());
        return powMod(g, units.get(index), m);
    }

    public static long powMod(long base, long exponent, long modulus) {
        return BigInteger.valueOf(base)
            .modPow(BigInteger.valueOf(exponent), BigInteger.valueOf(modulus))
            .longValue();
    }

    /**
     * The distinct prime factors of {@code n}, ascending.
     */
    private static MutableLongList primeFactors(long n) {
        MutableLongList factors = LongLists.mutable.empty();
        if (n < 2) {
            return factors;
        }
        for (int p : Primes.primeFactors(Math.toIntExact(n))) {
            if (factors.isEmpty() || factors.getLast() != p) {
                factors.add(p);
            }
        }
        return factors;
    }
}

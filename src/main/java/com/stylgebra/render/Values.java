package com.stylgebra.render;

import com.stylgebra.error.StylgebraException;
import com.stylgebra.node.Node;
import com.stylgebra.node.Structure;
import org.apache.commons.math3.fraction.BigFraction;

import java.math.BigInteger;

/**
 * Exact values of nodes. Numbers are carried as {@link BigFraction}; values bound to
 * variables that are not numbers pass through as they are. A node with no known value
 * yields null.
 */
public final class Values {
    private Values() {
    }

    public static Object of(Node node, Bindings bindings) {
        if (node instanceof Node.IntegerLiteral i) {
            return i.hasValue() ? new BigFraction(i.value()) : null;
        }
        if (node instanceof Node.Variable || node instanceof Node.Lookup) {
            return normalize(bindings.get(node));
        }
        if (node instanceof Structure.IntResidue r) {
            return new BigFraction(r.value());
        }
        if (node instanceof Node.Summand s) {
            BigFraction term = number(s.term(), bindings);
            return s.sign() == -1 ? term.negate() : term;
        }
        if (node instanceof Node.Sum sum) {
            BigFraction total = BigFraction.ZERO;
            for (Node.Summand s : sum.summands()) {
                total = total.add(number(s, bindings));
            }
            return total;
        }
        if (node instanceof Node.Product p) {
            BigFraction total = BigFraction.ONE;
            for (Node f : p.factors()) {
                total = total.multiply(number(f, bindings));
            }
            return total;
        }
        if (node instanceof Node.Quotient q) {
            BigFraction bottom = number(q.bottom(), bindings);
            if (bottom.equals(BigFraction.ZERO)) {
                throw new StylgebraException("Division by zero in the value of a quotient");
            }
            return number(q.top(), bindings).divide(bottom);
        }
        if (node instanceof Node.Power pw) {
            BigFraction base = number(pw.base(), bindings);
            BigFraction exponent = number(pw.exponent(), bindings);
            if (!exponent.getDenominator().equals(BigInteger.ONE)) {
                throw new StylgebraException("Only integer powers have exact values, got exponent " + display(exponent));
            }
            if (base.equals(BigFraction.ZERO) && exponent.compareTo(BigFraction.ZERO) < 0) {
                throw new StylgebraException("Zero raised to a negative power");
            }
            return base.pow(exponent.intValue());
        }
        return null;
    }

    /**
     * The node's value, or null when it is a compound that depends on a number nobody has
     * supplied. Bound variables and lookups use this, so that substituting {@code 2 y} for
     * {@code x} leaves {@code x} without a value instead of failing.
     */
    public static Object ofComputable(Node node, Bindings bindings) {
        return isComputable(node, bindings) ? of(node, bindings) : null;
    }

    private static boolean isComputable(Node node, Bindings bindings) {
        if (node instanceof Node.Summand s) {
            return isNumeric(s.term(), bindings);
        }
        if (node instanceof Node.Sum sum) {
            return sum.summands().allSatisfy(s -> isNumeric(s, bindings));
        }
        if (node instanceof Node.Product p) {
            return p.factors().allSatisfy(f -> isNumeric(f, bindings));
        }
        if (node instanceof Node.Quotient q) {
            return isNumeric(q.top(), bindings) && isNumeric(q.bottom(), bindings);
        }
        if (node instanceof Node.Power pw) {
            return isNumeric(pw.base(), bindings) && isNumeric(pw.exponent(), bindings);
        }
        return true;
    }

    private static boolean isNumeric(Node node, Bindings bindings) {
        if (node instanceof Node.IntegerLiteral i) {
            return i.hasValue();
        }
        if (node instanceof Node.Variable || node instanceof Node.Lookup) {
            return normalize(bindings.get(node)) instanceof BigFraction;
        }
        if (node instanceof Structure.IntResidue) {
            return true;
        }
        return !isLeaf(node) && isComputable(node, bindings);
    }

    private static boolean isLeaf(Node node) {
        return !(node instanceof Node.Summand || node instanceof Node.Sum || node instanceof Node.Product
            || node instanceof Node.Quotient || node instanceof Node.Power);
    }

    /**
     * The node's value as a number.
     *
     * @throws StylgebraException if the node has no numeric value
     */
    public static BigFraction number(Node node, Bindings bindings) {
        Object v = of(node, bindings);
        if (v instanceof BigFraction f) {
            return f;
        }
        throw new StylgebraException("No numeric value for " + node.kind().tag()
            + (node.name() != null ? " " + node.name() : "") + ": " + v);
    }

    /**
     * Integers print as {@code n}, other rationals as {@code n/d}.
     */
    public static String display(Object value) {
        if (value instanceof BigFraction f) {
            if (f.getDenominator().equals(BigInteger.ONE)) {
                return f.getNumerator().toString();
            }
            return f.getNumerator() + "/" + f.getDenominator();
        }
        return String.valueOf(value);
    }

    /**
     * Integral values as {@code Long}, other numbers as they are. This is the form handed
     * to lookup functions and used to index lookup tables.
     */
    public static Object plain(Object value) {
        if (value instanceof BigFraction f && f.getDenominator().equals(BigInteger.ONE)) {
            return f.getNumerator().longValueExact();
        }
        return value;
    }

    static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return new BigFraction(((Number) value).longValue());
        }
        if (value instanceof BigInteger b) {
            return new BigFraction(b);
        }
        return value;
    }
}

package com.stylgebra.node;

import org.apache.commons.math3.fraction.BigFraction;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;

public final class Nodes {
    /**
     * Marks the omitted run in a range or list of terms.
     */
    public static final Node.Ellipsis ELLIPSIS = new Node.Ellipsis(Meta.NONE);

    private Nodes() {
    }

    /**
     * Lifts a plain value into the expression tree. Integers become integer literals,
     * fractions become quotients and strings become math-mode string literals. Nodes are
     * returned as they are.
     */
    public static Node wrap(Object value) {
        if (value instanceof Node n) {
            return n;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return Node.IntegerLiteral.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger b) {
            return Node.IntegerLiteral.of(b.longValueExact());
        }
        if (value instanceof BigFraction f) {
            return new Node.Quotient(
                Node.IntegerLiteral.of(f.getNumerator().longValueExact()),
                Node.IntegerLiteral.of(f.getDenominator().longValueExact()));
        }
        if (value instanceof String s) {
            return new Node.StringLiteral(s);
        }
        throw new IllegalArgumentException("Cannot make an expression node from " + value);
    }

    public static ImmutableList<Node> wrapAll(Iterable<?> values) {
        MutableList<Node> nodes = Lists.mutable.empty();
        for (Object v : values) {
            nodes.add(wrap(v));
        }
        return nodes.toImmutable();
    }

    public static Node.Variable var(String name) {
        return new Node.Variable(name);
    }

    public static Node.IntegerLiteral integer(long value) {
        return Node.IntegerLiteral.of(value);
    }

    public static Node.IntegerLiteral integer(long value, String name) {
        return Node.IntegerLiteral.of(value, name);
    }

    public static Node.StringLiteral str(String text) {
        return new Node.StringLiteral(text);
    }
}

package com.stylgebra.adapt;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * An expression tree as produced by an outside computer algebra system, before it is
 * adapted into renderable nodes.
 */
public sealed interface SymbolicExpr {
    record Add(ImmutableList<SymbolicExpr> args) implements SymbolicExpr {}

    record Mul(ImmutableList<SymbolicExpr> args) implements SymbolicExpr {}

    record Pow(SymbolicExpr base, SymbolicExpr exponent) implements SymbolicExpr {}

    record Symbol(String name) implements SymbolicExpr {}

    record IntegerLit(long value) implements SymbolicExpr {}

    record RationalLit(long numerator, long denominator) implements SymbolicExpr {
        public RationalLit {
            if (denominator == 0) {
                throw new IllegalArgumentException("Zero denominator in rational " + numerator + "/0");
            }
        }
    }

    /**
     * Whether this is a numeric literal below zero.
     */
    default boolean isNegativeNumber() {
        if (this instanceof IntegerLit i) {
            return i.value() < 0;
        }
        if (this instanceof RationalLit r) {
            return (r.numerator() < 0) != (r.denominator() < 0) && r.numerator() != 0;
        }
        return false;
    }

    default boolean isMinusOne() {
        return this instanceof IntegerLit i && i.value() == -1;
    }
}

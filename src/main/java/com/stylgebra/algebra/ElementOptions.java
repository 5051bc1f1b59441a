package com.stylgebra.algebra;

import com.stylgebra.node.Node;
import com.stylgebra.numeric.CoefficientSource;

/**
 * How {@link CyclotomicFields#buildElement} writes a field element.
 *
 * @param coeffForm general form of the coefficients, written in terms of {@code coeffIndex};
 *                  null to use {@code coefficients} or {@code coeffBase}
 * @param coeffIndex the bound variable; null for a fresh {@code i}
 * @param coefficients source of random coefficients; null for subscripted letters
 * @param coeffBase letter the coefficients are written with, as in {@code a_{i}}
 * @param elideAfter number of terms before the ellipsis, 0 for none
 * @param fallingPowers whether powers of the generator decrease from left to right
 */
public record ElementOptions(Node coeffForm, Node.Variable coeffIndex, CoefficientSource coefficients,
                             String coeffBase, int elideAfter, boolean fallingPowers) {
    public static final ElementOptions DEFAULTS = new ElementOptions(null, null, null, "a", 3, false);

    public ElementOptions withCoeffForm(Node form, Node.Variable index) {
        return new ElementOptions(form, index, coefficients, coeffBase, elideAfter, fallingPowers);
    }

    public ElementOptions withCoeffIndex(Node.Variable index) {
        return new ElementOptions(coeffForm, index, coefficients, coeffBase, elideAfter, fallingPowers);
    }

    public ElementOptions withCoefficients(CoefficientSource source) {
        return new ElementOptions(coeffForm, coeffIndex, source, coeffBase, elideAfter, fallingPowers);
    }

    public ElementOptions withCoeffBase(String base) {
        return new ElementOptions(coeffForm, coeffIndex, coefficients, base, elideAfter, fallingPowers);
    }

    public ElementOptions withElideAfter(int terms) {
        return new ElementOptions(coeffForm, coeffIndex, coefficients, coeffBase, terms, fallingPowers);
    }

    public ElementOptions withFallingPowers(boolean falling) {
        return new ElementOptions(coeffForm, coeffIndex, coefficients, coeffBase, elideAfter, falling);
    }
}

package com.stylgebra.numeric;

import org.apache.commons.math3.fraction.BigFraction;

/**
 * Supplies the coefficient at a given index when building a field element.
 */
@FunctionalInterface
public interface CoefficientSource {
    BigFraction coefficient(int index);
}

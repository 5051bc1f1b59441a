package com.stylgebra.node;

import java.util.List;
import java.util.function.Function;

/**
 * Where a {@link Node.Lookup} gets its value from once its arguments have values.
 */
public sealed interface LookupSource {
    /**
     * A computable function of the argument values, called with one value per argument.
     */
    record Computed(Function<List<Object>, Object> function) implements LookupSource {}

    /**
     * Nested lists or maps, indexed successively by each argument's value.
     */
    record Indexed(Object table) implements LookupSource {}
}

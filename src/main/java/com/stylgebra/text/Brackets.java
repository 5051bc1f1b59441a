package com.stylgebra.text;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.tuple.Tuples;

public final class Brackets {
    public static final String NONE = "none";
    public static final String ROUND = "round";
    public static final String AUTO = "auto";

    private static final ImmutableMap<String, Pair<String, String>> STYLES = Maps.immutable.of(
        ROUND, Tuples.pair("(", ")"),
        "square", Tuples.pair("\\[", "\\]"),
        "curly", Tuples.pair("\\lbrace", "\\rbrace"));

    private Brackets() {
    }

    /**
     * Surrounds {@code expression} with sized brackets of the named style. Unknown styles,
     * {@code none} included, leave the expression as it is.
     */
    public static Text wrap(String style, Text expression) {
        Pair<String, String> b = style == null ? null : STYLES.get(style);
        if (b == null) {
            return expression;
        }
        return Text.math("\\left").plusMath(b.getOne())
            .plus(expression)
            .plusMath("\\right").plusMath(b.getTwo());
    }
}

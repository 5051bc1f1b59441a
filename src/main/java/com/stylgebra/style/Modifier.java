package com.stylgebra.style;

import java.util.function.UnaryOperator;

/**
 * Adjusts a resolved style after the precedence protocol has picked it.
 */
public sealed interface Modifier {
    Style apply(Style style);

    record Merge(Style.Options options) implements Modifier {
        @Override
        public Style apply(Style style) {
            if (style instanceof Style.Options o) {
                return o.merge(options);
            }
            Style.Substitution s = (Style.Substitution) style;
            return new Style.Substitution(s.value(), s.extra().merge(options));
        }
    }

    record Transform(UnaryOperator<Style> function) implements Modifier {
        @Override
        public Style apply(Style style) {
            return function.apply(style);
        }
    }

    static Merge merge(String key, Object value) {
        return new Merge(Style.of(key, value));
    }

    static Merge merge(Style.Options options) {
        return new Merge(options);
    }
}

package com.stylgebra.range;

import com.stylgebra.error.InvalidStyleException;

/**
 * Values of the {@code range} option.
 */
public enum RangeMode {
    /** List when there are at least three entries or a step is given, else bind. */
    AUTO("auto"),
    /** Write out every item. */
    LIST("list"),
    /** Write the general form once with a condition on the bound variable. */
    BIND("bind");

    public static final String KEY = "range";

    private final String option;

    RangeMode(String option) {
        this.option = option;
    }

    public static RangeMode of(String option) {
        for (RangeMode m : values()) {
            if (m.option.equals(option)) {
                return m;
            }
        }
        throw new InvalidStyleException(KEY, option);
    }
}

package com.stylgebra.style;

import com.stylgebra.error.InvalidStyleException;

/**
 * Values of the {@code form} option shared by most node kinds.
 */
public enum Form {
    NAME("name"),
    VALUE("value"),
    SYMBOLIC("symbolic"),
    VERBAL("verbal");

    public static final String KEY = "form";

    private final String option;

    Form(String option) {
        this.option = option;
    }

    public String option() {
        return option;
    }

    public static Form of(Style.Options style, Form defaultForm) {
        Object v = style.get(KEY);
        if (v == null) {
            return defaultForm;
        }
        for (Form f : values()) {
            if (f.option.equals(v.toString())) {
                return f;
            }
        }
        throw new InvalidStyleException(KEY, v);
    }
}

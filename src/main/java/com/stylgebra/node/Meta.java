package com.stylgebra.node;

import com.stylgebra.style.Style;

/**
 * Attributes every node carries.
 *
 * @param name the markup used when the node is written by name; may be null
 * @param id token that identity selectors ({@code #id}) match; defaults to the name
 * @param defaultStyle style used when neither an explicit style nor a rule applies
 */
public record Meta(String name, String id, Style defaultStyle) {
    public static final Meta NONE = new Meta(null, null, null);

    public Meta {
        if (id == null) {
            id = name;
        }
        if (defaultStyle == null) {
            defaultStyle = Style.NONE;
        }
    }

    public static Meta named(String name) {
        return new Meta(name, null, null);
    }

    public static Meta of(String name, String id) {
        return new Meta(name, id, null);
    }

    public Meta withDefaultStyle(Style style) {
        return new Meta(name, id, style);
    }
}

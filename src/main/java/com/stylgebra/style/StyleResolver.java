package com.stylgebra.style;

import com.stylgebra.node.Node;
import com.stylgebra.path.ExpressionPath;
import com.stylgebra.rules.RuleTable;

/**
 * Picks the style a node renders with: the explicit style if one was passed, else the first
 * matching rule, else the node's own default. A modifier, if any, is applied to whichever
 * was picked.
 */
public final class StyleResolver {
    private StyleResolver() {
    }

    public static Style decide(Node node, Style explicit, RuleTable rules, ExpressionPath path, Modifier modifier) {
        Style style = explicit;
        if (style == null && rules != null) {
            style = rules.resolve(node, path).orElse(null);
        }
        if (style == null) {
            style = node.meta().defaultStyle();
        }
        if (modifier != null) {
            style = modifier.apply(style);
        }
        return style;
    }
}

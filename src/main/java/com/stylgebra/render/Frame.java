package com.stylgebra.render;

import com.stylgebra.node.Node;
import com.stylgebra.path.ExpressionPath;
import com.stylgebra.rules.RuleTable;
import com.stylgebra.style.Modifier;
import com.stylgebra.style.Style;
import com.stylgebra.style.StyleResolver;
import com.stylgebra.text.Text;

/**
 * Everything a formatter needs while rendering one node: its resolved style, where it sits
 * in the tree, the rules in force and the bindings of the current pass. Children are
 * rendered through {@link #forward}, which extends the path by the child's role.
 */
public final class Frame {
    private final Renderer renderer;
    private final Node node;
    private final Style style;
    private final Modifier modifier;
    private final RuleTable rules;
    private final ExpressionPath path;
    private final Bindings bindings;

    Frame(Renderer renderer, Node node, Style style, Modifier modifier, RuleTable rules,
          ExpressionPath path, Bindings bindings) {
        this.renderer = renderer;
        this.node = node;
        this.style = style;
        this.modifier = modifier;
        this.rules = rules;
        this.path = path;
        this.bindings = bindings;
    }

    public Text forward(Node child, String role) {
        return forward(child, role, null);
    }

    public Text forward(Node child, String role, Modifier childModifier) {
        return renderer.format(child, null, rules, path.append(node, role), childModifier, bindings);
    }

    /**
     * Forwards nodes; anything else is written out as math text.
     */
    public Text forwardValue(Object value, String role, Modifier childModifier) {
        if (value instanceof Node child) {
            return forward(child, role, childModifier);
        }
        if (value instanceof Text t) {
            return Text.math(t);
        }
        return Text.math(Values.display(value));
    }

    public Text forwardValue(Object value, String role) {
        return forwardValue(value, role, null);
    }

    /**
     * The style {@code child} would resolve to if forwarded under {@code role}.
     */
    public Style forwardStyle(Node child, String role, Modifier childModifier) {
        return StyleResolver.decide(child, null, rules, path.append(node, role), childModifier);
    }

    public Style forwardStyle(Node child, String role) {
        return forwardStyle(child, role, null);
    }

    /**
     * Renders {@code standIn} in this node's place: same path, given style and rules, and
     * this frame's modifier.
     */
    public Text renderInPlace(Node standIn, Style explicit, RuleTable standInRules) {
        return renderer.format(standIn, explicit, standInRules, path, modifier, bindings);
    }

    public Node node() {
        return node;
    }

    public Style style() {
        return style;
    }

    /**
     * The option map of the resolved style. A substitution contributes its extra options.
     */
    public Style.Options options() {
        if (style instanceof Style.Options o) {
            return o;
        }
        return ((Style.Substitution) style).extra();
    }

    public Modifier modifier() {
        return modifier;
    }

    public RuleTable rules() {
        return rules;
    }

    public ExpressionPath path() {
        return path;
    }

    public Object valueOf(Node n) {
        return Values.of(n, bindings);
    }

    public Object computableValueOf(Node n) {
        return Values.ofComputable(n, bindings);
    }

    public void bind(Node n, Object value) {
        bindings.bind(n, value);
    }

    public Text name() {
        return Text.math(node.name());
    }
}

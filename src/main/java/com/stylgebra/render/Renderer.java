package com.stylgebra.render;

import com.stylgebra.algebra.StructureFormatter;
import com.stylgebra.error.MissingHandlerException;
import com.stylgebra.node.Node;
import com.stylgebra.node.Structure;
import com.stylgebra.path.ExpressionPath;
import com.stylgebra.range.RangeFormatter;
import com.stylgebra.rules.RuleTable;
import com.stylgebra.style.Modifier;
import com.stylgebra.style.Style;
import com.stylgebra.style.StyleResolver;
import com.stylgebra.text.Text;

/**
 * Renders expression trees to markup. Each call is one pass with its own bindings, so a
 * renderer may be shared.
 */
public class Renderer {
    private final AtomFormatter atoms = new AtomFormatter();
    private final OperatorFormatter operators = new OperatorFormatter();
    private final CollectionFormatter collections = new CollectionFormatter();
    private final RangeFormatter ranges = new RangeFormatter();
    private final StructureFormatter structures = new StructureFormatter();

    public String render(Node root) {
        return render(root, null, RuleTable.EMPTY);
    }

    public String render(Node root, Style style) {
        return render(root, style, RuleTable.EMPTY);
    }

    public String render(Node root, RuleTable rules) {
        return render(root, null, rules);
    }

    public String render(Node root, Style style, RuleTable rules) {
        return renderText(root, style, rules).content();
    }

    public Text renderText(Node root, Style style, RuleTable rules) {
        return format(root, style, rules, ExpressionPath.ROOT, null, new Bindings());
    }

    Text format(Node node, Style explicit, RuleTable rules, ExpressionPath path, Modifier modifier, Bindings bindings) {
        Style style = StyleResolver.decide(node, explicit, rules, path, modifier);
        Frame frame = new Frame(this, node, style, modifier, rules, path, bindings);
        return dispatch(node, frame);
    }

    private Text dispatch(Node node, Frame frame) {
        if (node instanceof Node.IntegerLiteral n) {
            return atoms.integer(n, frame);
        } else if (node instanceof Node.StringLiteral n) {
            return atoms.string(n, frame);
        } else if (node instanceof Node.Variable n) {
            return atoms.variable(n, frame);
        } else if (node instanceof Node.Lookup n) {
            return atoms.lookup(n, frame);
        } else if (node instanceof Node.Ellipsis) {
            return atoms.ellipsis(frame);
        } else if (node instanceof Node.Infinity n) {
            return atoms.infinity(n);
        } else if (node instanceof Node.Subscripted n) {
            return atoms.subscripted(n, frame);
        } else if (node instanceof Node.Superscripted n) {
            return atoms.superscripted(n, frame);
        } else if (node instanceof Node.Summand n) {
            return operators.summand(n, frame);
        } else if (node instanceof Node.Sum n) {
            return operators.sum(n, frame);
        } else if (node instanceof Node.Product n) {
            return operators.product(n, frame);
        } else if (node instanceof Node.Quotient n) {
            return operators.quotient(n, frame);
        } else if (node instanceof Node.Power n) {
            return operators.power(n, frame);
        } else if (node instanceof Node.SetLiteral n) {
            return collections.set(n, frame);
        } else if (node instanceof Node.Mapping n) {
            return collections.mapping(n, frame);
        } else if (node instanceof Node.Relation n) {
            return collections.relation(n, frame);
        } else if (node instanceof Node.RelationChain n) {
            return collections.relationChain(n, frame);
        } else if (node instanceof Node.Range n) {
            return ranges.format(n, frame);
        } else if (node instanceof Structure n) {
            return structures.format(n, frame);
        }
        throw new MissingHandlerException(node.getClass());
    }
}

package com.stylgebra.range;

import com.stylgebra.node.Meta;
import com.stylgebra.node.Node;
import com.stylgebra.node.Nodes;
import com.stylgebra.node.RelationKind;
import com.stylgebra.render.Frame;
import com.stylgebra.rules.RuleTable;
import com.stylgebra.style.Style;
import com.stylgebra.text.Text;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders range builders either as a written-out list of items or as a single general
 * form bound by a condition.
 *
 * <p>In list mode the items become the operands of an ordinary sum, product or set that
 * renders in the builder's place. A rule appended to the table substitutes the range's
 * {@code i}-th entry for the bound variable inside the {@code i}-th item, so rules written by
 * the caller take precedence over it.
 */
public class RangeFormatter {
    private static final Logger logger = LoggerFactory.getLogger(RangeFormatter.class);

    public Text format(Node.Range range, Frame frame) {
        Style.Options o = frame.options();
        RangeMode mode = RangeMode.of(o.getString(RangeMode.KEY, "auto"));
        int step = o.getInt("step", 0);
        int size = range.range().size();

        if (mode == RangeMode.AUTO) {
            mode = size >= 3 || step != 0 ? RangeMode.LIST : RangeMode.BIND;
        }

        if (mode == RangeMode.LIST) {
            return list(range, frame);
        }

        if (range.condition() == null && size >= 2) {
            Node first = range.range().getFirst();
            Node last = range.range().getLast();
            Node lower = first instanceof Node.Ellipsis ? new Node.Infinity(-1) : first;
            Node upper = last instanceof Node.Ellipsis ? new Node.Infinity(1) : last;
            return boundByRange(range, lower, upper, frame);
        }

        Node cond = range.condition();
        if (cond == null && !(range instanceof Node.RangeSet)) {
            cond = range.boundVar();
        }
        return boundByCondition(range, cond, frame);
    }

    private Text list(Node.Range range, Frame frame) {
        ImmutableList<Node> items = range.range()
            .collect(entry -> entry instanceof Node.Ellipsis ? Nodes.ELLIPSIS : range.genForm());

        Node standIn;
        if (range instanceof Node.RangeSum) {
            standIn = new Node.Sum(items.collect(Node.Summand::of), Meta.NONE);
        } else if (range instanceof Node.RangeProduct) {
            standIn = new Node.Product(items, Meta.NONE);
        } else {
            standIn = new Node.SetLiteral(items, range.condition(), Meta.NONE);
        }

        String basepath = frame.path().rolepath();
        // anchored, so that an item role nested inside the general form cannot capture i
        String selectorChain = "@/" + (basepath.isEmpty() ? "" : basepath + "-")
            + itemRole(range) + "[i] #" + range.boundVar().id();
        RuleTable rules = frame.rules() == null ? RuleTable.EMPTY : frame.rules();
        rules = rules.with(selectorChain, "i", i -> Style.subst(range.range().get(i)));
        logger.debug("Listing {} items of {} with rule '{}'", items.size(), range.kind().tag(), selectorChain);

        return frame.renderInPlace(standIn, frame.style(), rules);
    }

    private Text boundByRange(Node.Range range, Node lower, Node upper, Frame frame) {
        if (range instanceof Node.RangeSet set) {
            RelationKind left = lower instanceof Node.Infinity ? RelationKind.LT : RelationKind.LEQ;
            RelationKind right = upper instanceof Node.Infinity ? RelationKind.LT : RelationKind.LEQ;
            Node.RelationChain cond = new Node.RelationChain(lower, Lists.immutable.of(
                new Node.RelationChain.Link(left, true, set.boundVar()),
                new Node.RelationChain.Link(right, true, upper)), Meta.NONE);
            return boundByCondition(range, cond, frame);
        }

        Text form = frame.forward(range.genForm(), "form");
        Text var = frame.forward(range.boundVar(), "var");
        Text lowerText = frame.forward(lower, "lower");
        Text upperText = frame.forward(upper, "upper");
        return Text.math(operatorSymbol(range))
            .plusMath("_{").plus(var).plusMath(" = ").plus(lowerText).plusMath("}")
            .plusMath("^{").plus(upperText).plusMath("} ")
            .plus(form);
    }

    private Text boundByCondition(Node.Range range, Node cond, Frame frame) {
        if (range instanceof Node.RangeSet) {
            Node.SetLiteral set = new Node.SetLiteral(Lists.immutable.of(range.genForm()), cond, Meta.NONE);
            return frame.renderInPlace(set, frame.style(), frame.rules());
        }
        Text form = frame.forward(range.genForm(), "form");
        Text condText = frame.forward(cond, "cond");
        return Text.math(operatorSymbol(range)).plusMath("_{").plus(condText).plusMath("} ").plus(form);
    }

    private static String itemRole(Node.Range range) {
        if (range instanceof Node.RangeSum) {
            return "term";
        }
        if (range instanceof Node.RangeProduct) {
            return "factor";
        }
        return "elt";
    }

    private static String operatorSymbol(Node.Range range) {
        return range instanceof Node.RangeProduct ? "\\prod" : "\\sum";
    }
}

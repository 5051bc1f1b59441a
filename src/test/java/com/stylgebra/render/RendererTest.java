package com.stylgebra.render;

import com.stylgebra.node.Node;
import com.stylgebra.node.Nodes;
import com.stylgebra.path.ExpressionPath;
import com.stylgebra.rules.RuleTable;
import com.stylgebra.style.Modifier;
import com.stylgebra.style.Style;
import com.stylgebra.text.Text;
import org.apache.commons.math3.fraction.BigFraction;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RendererTest {
    private final Renderer renderer = new Renderer();

    @Test
    public void testRenderingTwiceGivesTheSameText() {
        Node.Variable i = Nodes.var("i");
        Node.Variable k = Nodes.var("k");
        Node table = Node.Lookup.indexed(k, List.of(5, 7, 11));
        Node expr = Node.Sum.of(new Node.RangeSum(List.of(1, 2, 3), Nodes.str("a").sub(i), i), table, k.times(2));
        RuleTable rules = RuleTable.of("#k", Style.subst(2)).with("@term2", Style.of("form", "value"));

        String first = renderer.render(expr, Style.NONE, rules);
        assertEquals("a_{1} + a_{2} + a_{3} + 11 + 4", first);
        assertEquals(first, renderer.render(expr, Style.NONE, rules));
        assertEquals(first, renderer.render(expr, Style.NONE, rules));
    }

    @Test
    public void testSharedNodeRendersTheSameInEachPass() {
        Node.Variable x = Nodes.var("x");
        Node expr = x.plus(x.times(3));
        RuleTable rules = RuleTable.of("@term1", Style.of("form", "value")).with("#x", Style.subst(4));
        assertEquals("4 + 12", renderer.render(expr, Style.NONE, rules));
        assertEquals("4 + 12", renderer.render(expr, Style.NONE, rules));
    }

    @Test
    public void testVariableIsBoundBeforeItsSubstitutionRenders() {
        Node.Variable x = Nodes.var("x");
        Node seven = Nodes.integer(7);
        MutableList<Object> seen = Lists.mutable.empty();
        Renderer watching = new Renderer() {
            @Override
            Text format(Node node, Style explicit, RuleTable rules, ExpressionPath path, Modifier modifier,
                        Bindings bindings) {
                if (node == seven) {
                    seen.add(bindings.get(x));
                }
                return super.format(node, explicit, rules, path, modifier, bindings);
            }
        };
        assertEquals("7", watching.render(x, Style.subst(seven)));
        assertEquals(List.of(new BigFraction(7)), seen);
    }
}

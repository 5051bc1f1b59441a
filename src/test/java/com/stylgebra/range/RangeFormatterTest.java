package com.stylgebra.range;

import com.stylgebra.error.InvalidStyleException;
import com.stylgebra.node.Node;
import com.stylgebra.node.Nodes;
import com.stylgebra.node.Relations;
import com.stylgebra.render.Renderer;
import com.stylgebra.rules.RuleTable;
import com.stylgebra.style.Style;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RangeFormatterTest {
    private final Renderer renderer = new Renderer();

    private final Node a = Nodes.str("a");
    private final Node.Variable i = Nodes.var("i");
    private final Node p = Nodes.integer(13, "p");

    @Test
    public void testListedSumAddressesItems() {
        Node.RangeSum s = new Node.RangeSum(List.of(0, 1, Nodes.ELLIPSIS, p.minus(2)), a.sub(i), i);
        assertEquals("a_{0} + a_{1} + \\cdots + a_{p - 2}", renderer.render(s));
        assertEquals("a_{0} + a_{1} + \\cdots + a_{1}", renderer.render(s, Style.NONE, RuleTable.of("@term3-sub", Style.subst(1))));
        assertEquals("a_{0} + a_{1} + \\cdots + a_{13 - 2}", renderer.render(s, Style.NONE, RuleTable.of("#p", Style.of("form", "value"))));
        assertEquals("a_{0} + a_{1} + \\cdots + a_{11}",
            renderer.render(s, Style.NONE, RuleTable.of("@term3-sub-subst", Style.of("form", "value"))));
        assertEquals("\\sum_{i = 0}^{p - 2} a_{i}", renderer.render(s, Style.of("range", "bind")));
    }

    @Test
    public void testListedSumBelowMapping() {
        Node.RangeSum s = new Node.RangeSum(List.of(0, 1, Nodes.ELLIPSIS, p.minus(2)), a.sub(i), i);
        Node f = new Node.Mapping(Nodes.str("f"), null, null, List.of(p), s);
        assertEquals("f: p \\mapsto a_{0} + a_{1} + \\cdots + a_{p - 2}", renderer.render(f, Style.of("form", "name-mapsto")));
    }

    @Test
    public void testFiniteRanges() {
        Node.RangeSum su = new Node.RangeSum(List.of(0, 1, Nodes.ELLIPSIS, p.minus(2)), a.sub(i), i);
        Node.RangeSet se = new Node.RangeSet(List.of(0, 1, Nodes.ELLIPSIS, p.minus(2)), a.sub(i), i);
        assertEquals("a_{0} + a_{1} + \\cdots + a_{p - 2}", renderer.render(su));
        assertEquals("\\left\\{ a_{0}, a_{1}, \\ldots, a_{p - 2} \\right\\}", renderer.render(se));
        assertEquals("\\sum_{i = 0}^{p - 2} a_{i}", renderer.render(su, Style.of("range", "bind")));
        assertEquals("\\left\\{ a_{i} : 0 \\leq i \\leq p - 2 \\right\\}", renderer.render(se, Style.of("range", "bind")));
    }

    @Test
    public void testRangesOpenAbove() {
        List<Object> range = List.of(0, 1, Nodes.ELLIPSIS, p.minus(2), Nodes.ELLIPSIS);
        Node.RangeSum su = new Node.RangeSum(range, a.sub(i), i);
        Node.RangeSet se = new Node.RangeSet(range, a.sub(i), i);
        assertEquals("a_{0} + a_{1} + \\cdots + a_{p - 2} + \\cdots", renderer.render(su));
        assertEquals("\\left\\{ a_{0}, a_{1}, \\ldots, a_{p - 2}, \\ldots \\right\\}", renderer.render(se));
        assertEquals("\\sum_{i = 0}^{\\infty} a_{i}", renderer.render(su, Style.of("range", "bind")));
        assertEquals("\\left\\{ a_{i} : 0 \\leq i < \\infty \\right\\}", renderer.render(se, Style.of("range", "bind")));
    }

    @Test
    public void testRangesOpenBothWays() {
        List<Object> range = List.of(Nodes.ELLIPSIS, -2, -1, 0, 1, 2, Nodes.ELLIPSIS);
        Node.RangeSum su = new Node.RangeSum(range, a.sub(i), i);
        Node.RangeSet se = new Node.RangeSet(range, a.sub(i), i);
        assertEquals("\\cdots + a_{-2} + a_{-1} + a_{0} + a_{1} + a_{2} + \\cdots", renderer.render(su));
        assertEquals("\\left\\{ \\ldots, a_{-2}, a_{-1}, a_{0}, a_{1}, a_{2}, \\ldots \\right\\}", renderer.render(se));
        assertEquals("\\sum_{i = -\\infty}^{\\infty} a_{i}", renderer.render(su, Style.of("range", "bind")));
        assertEquals("\\left\\{ a_{i} : -\\infty < i < \\infty \\right\\}", renderer.render(se, Style.of("range", "bind")));
    }

    @Test
    public void testDefaultGeneralFormIsTheBoundVariable() {
        Node.RangeSum su = new Node.RangeSum(List.of(2, -3, 5, -7), null, null);
        Node.RangeSet se = new Node.RangeSet(List.of(2, -3, 5, -7), null, null);
        assertEquals("2 - 3 + 5 - 7", renderer.render(su));
        assertEquals("\\left\\{ 2, -3, 5, -7 \\right\\}", renderer.render(se));
    }

    @Test
    public void testBoundByCondition() {
        Node s = Node.SetLiteral.of().named("S");
        Node.RangeSum su = new Node.RangeSum(List.of(), a.sub(i), i).where(i.in(s));
        Node.RangeSet se = new Node.RangeSet(List.of(), a.sub(i), i).where(i.in(s));
        RuleTable byName = RuleTable.of("#S", Style.of("form", "name"));
        assertEquals("\\sum_{i \\in S} a_{i}", renderer.render(su, Style.of("range", "bind"), byName));
        assertEquals("\\left\\{ a_{i} : i \\in S \\right\\}", renderer.render(se, Style.of("range", "bind"), byName));
    }

    @Test
    public void testProductsOverPrimes() {
        Node.Variable q = Nodes.var("p");
        Node f = Nodes.integer(1).minus(Nodes.integer(1).over(q)).pow(-1);

        Node.RangeProduct pr0 = new Node.RangeProduct(List.of(), f, q);
        assertEquals("\\prod_{p} \\left(1 - \\frac{1}{p}\\right)^{-1}", renderer.render(pr0));
        assertEquals("\\prod_{p} \\frac{1}{1 - \\frac{1}{p}}",
            renderer.render(pr0, RuleTable.of("@form", Style.of("negative", "frac"))));

        Node.RangeSet s0 = new Node.RangeSet(List.of(), f, q);
        assertEquals("\\left\\{ \\left(1 - \\frac{1}{p}\\right)^{-1} \\right\\}", renderer.render(s0));

        Node.RangeProduct pr1 = new Node.RangeProduct(List.of(2, 3, 5, 7), f, q);
        assertEquals("\\left(1 - \\frac{1}{2}\\right)^{-1} \\left(1 - \\frac{1}{3}\\right)^{-1} "
            + "\\left(1 - \\frac{1}{5}\\right)^{-1} \\left(1 - \\frac{1}{7}\\right)^{-1}", renderer.render(pr1));

        Node.RangeProduct pr2 = new Node.RangeProduct(List.of(), f, q).where(Relations.in(q, List.of(2, 3, 5, 7)));
        assertEquals("\\prod_{p \\in \\left\\{ 2, 3, 5, 7 \\right\\}} \\left(1 - \\frac{1}{p}\\right)^{-1}", renderer.render(pr2));
    }

    @Test
    public void testListModeForcedOnShortRange() {
        Node.RangeSum su = new Node.RangeSum(List.of(0, p), a.sub(i), i);
        assertEquals("\\sum_{i = 0}^{p} a_{i}", renderer.render(su));
        assertEquals("a_{0} + a_{p}", renderer.render(su, Style.of("range", "list")));
    }

    @Test
    public void testUnknownRangeMode() {
        Node.RangeSum su = new Node.RangeSum(List.of(0, 1, 2), a.sub(i), i);
        assertThrows(InvalidStyleException.class, () -> renderer.render(su, Style.of("range", "sideways")));
    }

    @Test
    public void testListedSumOfSumsTakesIndexFromOwnTerms() {
        Node x = Nodes.str("x");
        Node.RangeSum s = new Node.RangeSum(List.of(1, 2, 3), x.sub(i).plus(1), i);
        assertEquals("\\left(x_{1} + 1\\right) + \\left(x_{2} + 1\\right) + \\left(x_{3} + 1\\right)",
            renderer.render(s, Style.of("range", "list")));
    }

    @Test
    public void testListedProductOfProductsTakesIndexFromOwnFactors() {
        Node x = Nodes.str("x");
        Node y = Nodes.str("y");
        Node.RangeProduct pr = new Node.RangeProduct(List.of(1, 2, 3), y.times(x.sub(i)), i);
        assertEquals("\\left(y x_{1}\\right) \\left(y x_{2}\\right) \\left(y x_{3}\\right)",
            renderer.render(pr, Style.of("range", "list")));
    }

    @Test
    public void testListedRangeBelowAnotherSum() {
        Node.RangeSum s = new Node.RangeSum(List.of(1, 2, 3), a.sub(i).plus(1), i);
        Node outer = Nodes.str("b").plus(s);
        assertEquals("b + \\left(a_{1} + 1\\right) + \\left(a_{2} + 1\\right) + \\left(a_{3} + 1\\right)",
            renderer.render(outer));
    }
}

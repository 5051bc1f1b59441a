package com.stylgebra.algebra;

import com.stylgebra.error.NotYetSupportedException;
import com.stylgebra.node.Node;
import com.stylgebra.node.Nodes;
import com.stylgebra.node.Structure;
import com.stylgebra.numeric.NiceRandom;
import com.stylgebra.render.Renderer;
import com.stylgebra.rules.RuleTable;
import com.stylgebra.style.Style;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class CyclotomicFieldsTest {
    private final Renderer renderer = new Renderer();
    private final Structure.CyclotomicField k = Structure.CyclotomicField.ofOrder(Nodes.integer(7, "p"), "K");

    private Node.RangeSum element(ElementOptions options) {
        return CyclotomicFields.buildElement(k, options);
    }

    @Test
    public void testElementElision() {
        assertEquals("a_{0} + a_{1} \\zeta + a_{2} \\zeta^{2} + \\cdots + a_{p - 2} \\zeta^{p - 2}",
            renderer.render(element(ElementOptions.DEFAULTS)));
        assertEquals("a_{0} + a_{1} \\zeta + \\cdots + a_{p - 2} \\zeta^{p - 2}",
            renderer.render(element(ElementOptions.DEFAULTS.withElideAfter(2))));
        assertEquals("a_{p - 2} \\zeta^{p - 2} + a_{p - 3} \\zeta^{p - 3} + \\cdots + a_{0}",
            renderer.render(element(ElementOptions.DEFAULTS.withElideAfter(2).withFallingPowers(true))));
        assertEquals("a_{0} + a_{1} \\zeta + a_{2} \\zeta^{2} + a_{3} \\zeta^{3} + a_{4} \\zeta^{4} + a_{5} \\zeta^{5}",
            renderer.render(element(ElementOptions.DEFAULTS.withElideAfter(0))));
        assertEquals("a_{5} \\zeta^{5} + a_{4} \\zeta^{4} + a_{3} \\zeta^{3} + a_{2} \\zeta^{2} + a_{1} \\zeta + a_{0}",
            renderer.render(element(ElementOptions.DEFAULTS.withElideAfter(0).withFallingPowers(true))));
    }

    @Test
    public void testElisionIsCappedBySmallOrder() {
        Structure.CyclotomicField k5 = Structure.CyclotomicField.ofOrder(5, null);
        assertEquals("a_{0} + \\cdots + a_{5 - 2} \\zeta^{5 - 2}",
            renderer.render(CyclotomicFields.buildElement(k5, ElementOptions.DEFAULTS)));
        Structure.CyclotomicField k3 = Structure.CyclotomicField.ofOrder(3, null);
        // two terms are too few to list
        assertEquals("\\sum_{i = 0}^{1} a_{i} \\zeta^{i}",
            renderer.render(CyclotomicFields.buildElement(k3, ElementOptions.DEFAULTS)));
    }

    @Test
    public void testAddressingTheLastTerm() {
        Node.RangeSum elt = element(ElementOptions.DEFAULTS.withCoeffBase("c"));
        String lastTermValues = "c_{0} + c_{1} \\zeta + c_{2} \\zeta^{2} + \\cdots + c_{5} \\zeta^{5}";

        assertEquals("c_{0} + c_{1} \\zeta + c_{2} \\zeta^{2} + \\cdots + c_{p - 2} \\zeta^{p - 2}", renderer.render(elt));
        assertEquals("c_{0} + c_{1} \\zeta + c_{2} \\zeta^{2} + \\cdots + c_{7 - 2} \\zeta^{7 - 2}",
            renderer.render(elt, RuleTable.of("#p", Style.of("form", "value"))));
        assertEquals(lastTermValues, renderer.render(elt, RuleTable
            .of("@term4-factor0-sub-subst", Style.of("form", "value"))
            .with("@term4-factor1-power-subst", Style.of("form", "value"))));
        assertEquals(lastTermValues, renderer.render(elt, RuleTable.of("@term4 Sum", Style.of("form", "value"))));
        assertEquals(lastTermValues, renderer.render(elt, RuleTable.of("Variable @subst", Style.of("form", "value"))));

        Node.RangeSum byJ = element(ElementOptions.DEFAULTS.withCoeffIndex(Nodes.var("j")).withCoeffBase("c"));
        assertEquals(lastTermValues, renderer.render(byJ, RuleTable.of("#j @subst", Style.of("form", "value"))));
    }

    @Test
    public void testCoefficientsFromTable() {
        Node.Variable i = Nodes.var("i");
        Node f = Node.Lookup.indexed(i, Arrays.asList(2, 3, 5, null, null, 13));
        Node.RangeSum elt = element(ElementOptions.DEFAULTS.withCoeffForm(f, i));
        assertEquals("2 + 3 \\zeta + 5 \\zeta^{2} + \\cdots + 13 \\zeta^{p - 2}", renderer.render(elt));
    }

    @Test
    public void testRandomCoefficients() {
        Node.RangeSum elt = element(ElementOptions.DEFAULTS.withElideAfter(0)
            .withCoefficients(new NiceRandom(42L, false).withZeroOk(false)));
        String rendered = renderer.render(elt);
        // six terms, none with a zero coefficient
        assertEquals(6, rendered.split(" [+-] ").length);
        assertFalse(Pattern.compile("(^|[+-] )0 ").matcher(rendered).find());
    }

    @Test
    public void testNonPrimeOrder() {
        Structure.CyclotomicField k8 = Structure.CyclotomicField.ofOrder(8, null);
        assertThrows(NotYetSupportedException.class, () -> CyclotomicFields.buildElement(k8, ElementOptions.DEFAULTS));
    }

    @Test
    public void testUnderlyingSet() {
        Node s = CyclotomicFields.buildSet(k, ElementOptions.DEFAULTS);
        String elt = "a_{0} + a_{1} \\zeta + a_{2} \\zeta^{2} + \\cdots + a_{p - 2} \\zeta^{p - 2}";

        assertEquals("\\left\\{ " + elt + " : a_{i} \\in \\mathbb{Q} \\right\\}",
            renderer.render(s, Style.of("form", "symbolic")));
        assertEquals("\\left\\{ " + elt + " : \\mbox{$a_{i}$ is an element of $\\mathbb{Q}$} \\right\\}",
            renderer.render(s, Style.of("form", "symbolic"), RuleTable.of("@cond", Style.of("form", "verbal"))));
        assertEquals("$\\left\\{ " + elt + " \\right\\}$ where $a_{i}$ is an element of $\\mathbb{Q}$",
            renderer.render(s, Style.of("form", "symbolic", "cond", "where"), RuleTable.of("@cond", Style.of("form", "verbal"))));
    }

    @Test
    public void testGaloisSetRequiresCyclotomicExtension() {
        assertThrows(NotYetSupportedException.class,
            () -> CyclotomicFields.buildGaloisUnderlyingSet(Structure.QQ, Style.NONE));
    }

    @Test
    public void testGaloisSetGeneratorChoice() {
        Node.RangeSet uset = CyclotomicFields.buildGaloisUnderlyingSet(k, Style.of("generator", "auto", "auto-power", 1));
        Node.Mapping elt = (Node.Mapping) uset.genForm();
        Node.Power value = (Node.Power) elt.valueForm();
        Structure.IntResidue gamma = (Structure.IntResidue) ((Node.Power) value.exponent()).base();
        assertEquals(5, gamma.value());
        assertEquals("k", uset.boundVar().name());
    }
}

package com.stylgebra.style;

import com.stylgebra.error.InvalidStyleException;
import com.stylgebra.node.Node;
import com.stylgebra.node.Nodes;
import com.stylgebra.path.ExpressionPath;
import com.stylgebra.rules.RuleTable;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StyleResolverTest {
    private final Node.Variable x = Nodes.var("x");
    private final RuleTable rules = RuleTable.of("#x", Style.subst(3));

    @Test
    public void testPrecedence() {
        assertEquals(Style.subst(5), StyleResolver.decide(x, Style.subst(5), rules, ExpressionPath.ROOT, null));
        assertEquals(Style.subst(3), StyleResolver.decide(x, null, rules, ExpressionPath.ROOT, null));
        assertEquals(Style.subst("x"), StyleResolver.decide(x, null, null, ExpressionPath.ROOT, null));
        assertEquals(Style.subst("x"), StyleResolver.decide(x, null, RuleTable.EMPTY, ExpressionPath.ROOT, null));
    }

    @Test
    public void testModifierAppliesToWhateverWasPicked() {
        Modifier ordinal = Modifier.merge("ordinal", true);
        assertEquals(Style.subst(3, Style.of("ordinal", true)),
            StyleResolver.decide(x, null, rules, ExpressionPath.ROOT, ordinal));
        assertEquals(Style.of("form", "value", "ordinal", true),
            StyleResolver.decide(Nodes.integer(2), Style.of("form", "value"), null, ExpressionPath.ROOT, ordinal));

        Modifier verbal = new Modifier.Transform(s -> Style.of("form", "verbal"));
        assertEquals(Style.of("form", "verbal"), StyleResolver.decide(x, null, rules, ExpressionPath.ROOT, verbal));
    }

    @Test
    public void testOptions() {
        Style.Options o = Style.of("elide", "3", "show-zeros", "TRUE", "form", "value");
        assertEquals(3, o.getInt("elide", 0));
        assertTrue(o.getBoolean("show-zeros", false));
        assertEquals(7, o.getInt("missing", 7));
        assertEquals(Form.VALUE, Form.of(o, Form.SYMBOLIC));
        assertEquals(Form.SYMBOLIC, Form.of(Style.NONE, Form.SYMBOLIC));
        assertThrows(InvalidStyleException.class, () -> o.getBoolean("form", false));
        assertThrows(InvalidStyleException.class, () -> o.with("elide", "many").getInt("elide", 0));
        assertThrows(InvalidStyleException.class, () -> Form.of(Style.of("form", "loud"), Form.NAME));
    }

    @Test
    public void testMergeOverridesKeyByKey() {
        Style.Options merged = Style.of("form", "value", "elide", 2).merge(Style.of("elide", 4));
        assertEquals(Style.of("form", "value", "elide", 4), merged);
        assertEquals(Style.of("a", 1).without("a"), Style.NONE);
    }

    @Test
    public void testOptionsWithSubstBecomeSubstitution() {
        assertEquals(Style.subst(1, Style.of("form", "verbal")), Style.options(Map.of("subst", 1, "form", "verbal")));
        assertEquals(Style.of("form", "verbal"), Style.options(Map.of("form", "verbal")));
    }
}

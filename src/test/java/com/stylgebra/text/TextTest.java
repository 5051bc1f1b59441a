package com.stylgebra.text;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextTest {

    @Test
    public void testConcatenation() {
        assertEquals(new Text.Math("ab"), Text.math("a").plus(Text.math("b")));
        assertEquals(new Text.Plain("$x$ is odd"), Text.math("x").plus(" is odd"));
        assertEquals(new Text.Plain("the set $S$"), Text.plain("the set ").plus(Text.math("S")));
        assertEquals(new Text.Plain("ab"), Text.plain("a").plus("b"));
    }

    @Test
    public void testEmptySidesKeepTheOtherKind() {
        assertEquals(new Text.Math("S"), Text.plain("").plus(Text.math("S")));
        assertEquals(new Text.Math("x"), Text.math("x").plus(Text.EMPTY));
    }

    @Test
    public void testJoin() {
        assertEquals(new Text.Math("a + b"),
            Text.join(Text.math(" + "), Lists.immutable.of(Text.math("a"), Text.math("b"))));
        assertEquals(new Text.Plain("$1$, $2$"),
            Text.join(Text.plain(", "), Lists.immutable.of(Text.math("1"), Text.math("2"))));
        assertEquals(Text.EMPTY, Text.join(Text.plain(", "), Lists.immutable.<Text>empty()));
        assertEquals(new Text.Plain("a, b"),
            Text.joinPlain(", ", Lists.immutable.of(Text.math("a"), Text.plain("b"))));
    }

    @Test
    public void testMbox() {
        assertEquals(new Text.Math("\\mbox{if}"), Text.mbox(Text.plain("if")));
        assertEquals(new Text.Math("x"), Text.mbox(Text.math("x")));
    }

    @Test
    public void testNegation() {
        assertEquals(new Text.Math("3"), Text.math("-3").negated());
        assertEquals(new Text.Math("-x"), Text.math("x").negated());
        assertTrue(Text.math("-0").isZero());
        assertEquals(new Text.Plain("bc"), Text.plain("abc").dropFirst());
    }

    @Test
    public void testBrackets() {
        Text sum = Text.math("a + b");
        assertEquals("\\left(a + b\\right)", Brackets.wrap(Brackets.ROUND, sum).content());
        assertEquals("\\left\\[a + b\\right\\]", Brackets.wrap("square", sum).content());
        assertEquals("\\left\\lbracea + b\\right\\rbrace", Brackets.wrap("curly", sum).content());
        assertSame(sum, Brackets.wrap(Brackets.NONE, sum));
        assertSame(sum, Brackets.wrap(null, sum));
    }
}

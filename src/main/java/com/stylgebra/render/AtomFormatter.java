package com.stylgebra.render;

import com.stylgebra.error.InvalidStyleException;
import com.stylgebra.error.LookupIndexException;
import com.stylgebra.node.LookupSource;
import com.stylgebra.node.Node;
import com.stylgebra.style.Form;
import com.stylgebra.style.Modifier;
import com.stylgebra.style.Style;
import com.stylgebra.text.Text;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Map;

/**
 * Leaves and near-leaves: integers, strings, variables, lookups, ellipses, infinities and
 * sub/superscripts.
 */
class AtomFormatter {

    /**
     * Options: {@code form} (by default the name if there is one, else the value, else a
     * verbal description) and {@code ordinal}, which appends a superscript suffix.
     */
    Text integer(Node.IntegerLiteral n, Frame frame) {
        Style.Options o = frame.options();
        Form form;
        if (o.has(Form.KEY)) {
            form = Form.of(o, Form.NAME);
        } else if (n.name() != null) {
            form = Form.NAME;
        } else if (n.hasValue()) {
            form = Form.VALUE;
        } else {
            form = Form.VERBAL;
        }

        Text s = switch (form) {
            case NAME -> frame.name();
            case VALUE, SYMBOLIC -> Text.math(n.value());
            case VERBAL -> Text.plain(verbal(n));
        };

        if (o.getBoolean("ordinal", false) && form != Form.VERBAL) {
            s = Text.math(s.content() + "^{\\mathrm{" + ordinalSuffix(s.content()) + "}}");
        }
        return s;
    }

    // 11th, 12th and 13th, but 21st, 22nd and 23rd
    static String ordinalSuffix(String number) {
        int len = number.length();
        char last = len > 0 ? number.charAt(len - 1) : ' ';
        boolean teen = len > 1 && number.charAt(len - 2) == '1';
        if (teen) {
            return "th";
        }
        return switch (last) {
            case '1' -> "st";
            case '2' -> "nd";
            case '3' -> "rd";
            default -> "th";
        };
    }

    static String verbal(Node.IntegerLiteral n) {
        MutableList<String> adjectives = Lists.mutable.empty();
        if (n.odd() != null) {
            adjectives.add(n.odd() ? "odd" : "even");
        }
        if (n.positive() != null) {
            adjectives.add(n.positive() ? "positive" : "negative");
        }
        String noun;
        if (n.prime() == null) {
            noun = "integer";
        } else {
            noun = n.prime() ? "prime" : "composite integer";
        }
        String phrase = (adjectives.makeString(", ") + " " + noun).trim();
        String article = "aeiou".indexOf(phrase.charAt(0)) >= 0 ? "an" : "a";
        return article + " " + phrase;
    }

    Text string(Node.StringLiteral n, Frame frame) {
        return n.mathMode() ? Text.math(n.text()) : Text.plain(n.text());
    }

    /**
     * A variable renders whatever its style substitutes for it, under the role
     * {@code subst}, and takes on that thing's value for the rest of the pass. The value is
     * bound before the substitution renders and bound again afterwards, once any variables
     * inside the substitution have values of their own.
     */
    Text variable(Node.Variable v, Frame frame) {
        Object subst;
        Modifier substModifier = null;
        if (frame.style() instanceof Style.Substitution s) {
            subst = s.value();
            if (!s.extra().values().isEmpty()) {
                substModifier = Modifier.merge(s.extra());
            }
        } else {
            subst = v.name();
        }

        frame.bind(v, subst instanceof Node n ? frame.computableValueOf(n) : subst);
        Text out = frame.forwardValue(subst, "subst", substModifier);
        if (subst instanceof Node n) {
            frame.bind(v, frame.computableValueOf(n));
        }
        return out;
    }

    /**
     * Arguments are rendered first, under {@code arg0}, {@code arg1}, ..., so that variables
     * among them take on their values. The looked-up value renders under {@code value}.
     */
    Text lookup(Node.Lookup lookup, Frame frame) {
        MutableList<Object> args = Lists.mutable.empty();
        for (int i = 0; i < lookup.args().size(); i++) {
            Node arg = lookup.args().get(i);
            frame.forward(arg, "arg" + i);
            args.add(Values.plain(frame.valueOf(arg)));
        }

        Object v;
        if (lookup.source() instanceof LookupSource.Computed c) {
            v = c.function().apply(args);
        } else {
            v = ((LookupSource.Indexed) lookup.source()).table();
            for (Object key : args) {
                v = index(v, key);
            }
        }

        frame.bind(lookup, v instanceof Node n ? frame.computableValueOf(n) : v);
        Text out = frame.forwardValue(v, "value");
        if (v instanceof Node n) {
            frame.bind(lookup, frame.computableValueOf(n));
        }
        return out;
    }

    /**
     * Lists take integer keys, a negative key counting back from the end. Maps are tried with
     * the key itself, then as an int, then as a string.
     */
    private static Object index(Object table, Object key) {
        if (table instanceof List<?> list) {
            if (key instanceof Long k && k >= -list.size() && k < list.size()) {
                return list.get((int) (k < 0 ? list.size() + k : k));
            }
            throw new LookupIndexException(key, table);
        }
        if (table instanceof Map<?, ?> map) {
            if (map.containsKey(key)) {
                return map.get(key);
            }
            if (key instanceof Long k && k == k.intValue() && map.containsKey(k.intValue())) {
                return map.get(k.intValue());
            }
            if (map.containsKey(String.valueOf(key))) {
                return map.get(String.valueOf(key));
            }
        }
        throw new LookupIndexException(key, table);
    }

    /**
     * Option {@code style}: {@code l} (default), {@code c} or {@code v}.
     */
    Text ellipsis(Frame frame) {
        String style = frame.options().getString("style", "l");
        if (!style.equals("l") && !style.equals("c") && !style.equals("v")) {
            throw new InvalidStyleException("style", style);
        }
        return Text.math("\\" + style + "dots");
    }

    Text infinity(Node.Infinity n) {
        Text sign = n.sign() == -1 ? Text.math("-") : Text.EMPTY;
        return sign.plusMath("\\infty");
    }

    Text subscripted(Node.Subscripted n, Frame frame) {
        Text b = frame.forward(n.base(), "base");
        Text s = frame.forward(n.subscript(), "sub");
        return Text.math(b.content() + "_{" + s.content() + "}");
    }

    Text superscripted(Node.Superscripted n, Frame frame) {
        Text b = frame.forward(n.base(), "base");
        Text s = frame.forward(n.superscript(), "sup");
        return Text.math(b.content() + "^{" + s.content() + "}");
    }
}

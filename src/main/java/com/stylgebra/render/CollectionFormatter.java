package com.stylgebra.render;

import com.stylgebra.error.InvalidStyleException;
import com.stylgebra.error.NotYetSupportedException;
import com.stylgebra.node.Meta;
import com.stylgebra.node.Node;
import com.stylgebra.style.Form;
import com.stylgebra.style.Modifier;
import com.stylgebra.style.Style;
import com.stylgebra.text.Text;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Sets, mappings and relations.
 */
class CollectionFormatter {
    private static final Modifier OMIT_LEFT = Modifier.merge("omit-left", true);

    /**
     * Options: {@code form} [symbolic], {@code empty} ({@code slashzero|braces})
     * [slashzero], {@code cond} ({@code colon|vbar|where|with}) [colon]. Elements render
     * under {@code elt0}, {@code elt1}, ... with the set's own modifier; the condition under
     * {@code cond}.
     */
    Text set(Node.SetLiteral set, Frame frame) {
        MutableList<Text> elements = Lists.mutable.empty();
        for (int i = 0; i < set.elements().size(); i++) {
            elements.add(frame.forward(set.elements().get(i), "elt" + i, frame.modifier()));
        }
        Text cond = set.condition() == null ? null : frame.forward(set.condition(), "cond");

        Style.Options o = frame.options();
        Form form = Form.of(o, Form.SYMBOLIC);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            throw new NotYetSupportedException("Sets have no value form");
        }
        if (form == Form.VERBAL) {
            return verbalSet(elements, cond);
        }

        if (elements.isEmpty()) {
            return o.getString("empty", "slashzero").equals("braces")
                ? Text.math("\\{\\}")
                : Text.math("\\varnothing");
        }

        Text inner = Text.EMPTY;
        Text outer = Text.EMPTY;
        if (cond != null) {
            String condStyle = o.getString("cond", "colon");
            switch (condStyle) {
                case "colon" -> inner = Text.math(" : ").plus(Text.mbox(cond));
                case "vbar" -> inner = Text.math(" \\mid ").plus(Text.mbox(cond));
                case "where", "with" -> outer = Text.plain(" " + condStyle + " ").plus(cond);
                default -> throw new InvalidStyleException("cond", condStyle);
            }
        }

        return Text.math("\\left\\{ ")
            .plus(Text.join(Text.math(", "), elements))
            .plus(inner)
            .plusMath(" \\right\\}")
            .plus(outer);
    }

    private static Text verbalSet(MutableList<Text> elements, Text cond) {
        if (elements.isEmpty()) {
            return Text.plain("the empty set");
        }
        if (elements.size() > 1) {
            return Text.plain("the set containing ").plus(Text.joinPlain(", ", elements));
        }
        Text s = Text.plain("the set of all ").plus(elements.getFirst());
        if (cond != null) {
            s = s.plus(Text.plain(" such that ").plus(cond));
        }
        return s;
    }

    /**
     * Option {@code form}: {@code name} (default) {@code f}, {@code name-args} {@code f(x)},
     * {@code value}, {@code map} {@code f: D -> C}, {@code mapsto} {@code x |-> v},
     * {@code name-mapsto} {@code f: x |-> v}. Only the parts the form shows are rendered.
     */
    Text mapping(Node.Mapping mapping, Frame frame) {
        String form = frame.options().getString(Form.KEY, "name");
        boolean showsName = !form.equals("value") && !form.equals("mapsto");
        boolean showsArgs = form.equals("name-args") || form.equals("mapsto") || form.equals("name-mapsto");
        boolean showsValue = form.equals("value") || form.equals("mapsto") || form.equals("name-mapsto");

        Text f = showsName ? frame.forward(mapping.nameForm(), "name") : null;
        Text a = null;
        if (showsArgs) {
            MutableList<Text> args = Lists.mutable.empty();
            for (int i = 0; i < mapping.args().size(); i++) {
                args.add(frame.forward(mapping.args().get(i), "arg" + i));
            }
            a = Text.join(Text.math(", "), args);
        }
        Text v = showsValue ? frame.forward(mapping.valueForm(), "value") : null;

        return switch (form) {
            case "name" -> f;
            case "name-args" -> Text.math(f.content() + "(" + a.content() + ")");
            case "value" -> v;
            case "map" -> {
                Text domain = frame.forward(mapping.domain(), "domain");
                Text codomain = frame.forward(mapping.codomain(), "codomain");
                yield Text.math(f.content() + ": " + domain.content() + " \\rightarrow " + codomain.content());
            }
            case "mapsto" -> Text.math(a.content() + " \\mapsto " + v.content());
            case "name-mapsto" -> Text.math(f.content() + ": " + a.content() + " \\mapsto " + v.content());
            default -> throw new InvalidStyleException(Form.KEY, form);
        };
    }

    /**
     * Options: {@code form} ({@code symbolic|verbal|name}) [symbolic], {@code omit-left}
     * [false]. Roles {@code left} and {@code right}.
     */
    Text relation(Node.Relation relation, Frame frame) {
        Style.Options o = frame.options();
        Form form = Form.of(o, Form.SYMBOLIC);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            throw new NotYetSupportedException("Relations have no value form");
        }

        Text left = o.getBoolean("omit-left", false) ? Text.EMPTY : frame.forward(relation.left(), "left");
        Text right = frame.forward(relation.right(), "right");

        if (form == Form.VERBAL) {
            return left.plus(" " + relation.relationKind().phrase(relation.valence()) + " ").plus(right);
        }
        return left.plusMath(" " + relation.relationKind().symbol(relation.valence()) + " ").plus(right);
    }

    /**
     * The first term renders under {@code left}; each link renders as a relation under
     * {@code reln0}, {@code reln1}, ... with its left side omitted.
     */
    Text relationChain(Node.RelationChain chain, Frame frame) {
        Text s = frame.forward(chain.first(), "left");
        for (int i = 0; i < chain.links().size(); i++) {
            Node.RelationChain.Link link = chain.links().get(i);
            Node.Relation relation = new Node.Relation(link.kind(), chain.leftOf(i), link.right(), link.valence(), Meta.NONE);
            s = s.plus(frame.forward(relation, "reln" + i, OMIT_LEFT));
        }
        return s;
    }
}

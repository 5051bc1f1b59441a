package com.stylgebra.algebra;

import com.stylgebra.error.InvalidStyleException;
import com.stylgebra.error.MissingHandlerException;
import com.stylgebra.error.NotYetSupportedException;
import com.stylgebra.error.StylgebraException;
import com.stylgebra.node.Structure;
import com.stylgebra.render.Frame;
import com.stylgebra.style.Form;
import com.stylgebra.style.Modifier;
import com.stylgebra.style.Style;
import com.stylgebra.text.Text;

/**
 * Renders algebraic structures. Every structure defaults to its name.
 */
public class StructureFormatter {
    private static final Modifier ORDINAL = Modifier.merge("ordinal", true);

    public Text format(Structure s, Frame frame) {
        if (s instanceof Structure.RationalNumbers) {
            return frame.name();
        } else if (s instanceof Structure.PrimitiveRootOfUnity n) {
            return rootOfUnity(n, frame);
        } else if (s instanceof Structure.CyclotomicField n) {
            return cyclotomicField(n, frame);
        } else if (s instanceof Structure.GaloisGroup n) {
            return galoisGroup(n, frame);
        } else if (s instanceof Structure.IntResidue n) {
            return residue(n, frame);
        }
        throw new MissingHandlerException(s.getClass());
    }

    /**
     * Defaults to the name if there is one, else the least non-negative representative.
     */
    private Text residue(Structure.IntResidue residue, Frame frame) {
        Form form = Form.of(frame.options(), residue.name() != null ? Form.NAME : Form.VALUE);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            return Text.math(residue.value());
        }
        throw new InvalidStyleException(Form.KEY, form.option());
    }

    /**
     * {@code symbolic} puts the order on as a subscript, {@code value} writes the complex
     * exponential. Role: {@code order}.
     */
    private Text rootOfUnity(Structure.PrimitiveRootOfUnity root, Frame frame) {
        Form form = Form.of(frame.options(), Form.NAME);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VERBAL) {
            if (root.order() == null) {
                return Text.plain("a primitive root of unity");
            }
            Text ordinal = frame.forward(root.order(), "order", ORDINAL);
            return Text.plain("a primitive ").plus(ordinal).plus(" root of unity");
        }
        if (root.order() == null) {
            throw new StylgebraException("A root of unity of unknown order has no " + form.option() + " form");
        }
        Text order = frame.forward(root.order(), "order");
        if (form == Form.SYMBOLIC) {
            return frame.name().plusMath("_{").plus(order).plusMath("}");
        }
        return Text.math("\\mathrm{e}^{2\\pi i/" + order.content() + "}");
    }

    /**
     * {@code value} and {@code symbolic} both write the base field adjoined the generator.
     * Roles: {@code basefield}, {@code gen}, {@code order}.
     */
    private Text cyclotomicField(Structure.CyclotomicField field, Frame frame) {
        return switch (Form.of(frame.options(), Form.NAME)) {
            case NAME -> frame.name();
            case VALUE, SYMBOLIC -> {
                if (field.generator() == null) {
                    throw new StylgebraException("An unspecified cyclotomic field has no symbolic form");
                }
                Text base = frame.forward(field.baseField(), "basefield");
                Text gen = frame.forward(field.generator(), "gen");
                yield base.plusMath("(").plus(gen).plusMath(")");
            }
            case VERBAL -> {
                if (field.order() == null) {
                    yield Text.plain("a cyclotomic field");
                }
                Text ordinal = frame.forward(field.order(), "order", ORDINAL);
                yield Text.plain("the ").plus(ordinal).plus(" cyclotomic field");
            }
        };
    }

    /**
     * {@code value} renders the group's underlying set under role {@code uset}; the style
     * that set would get there also configures how it is built. Other roles: {@code ext},
     * {@code base}.
     */
    private Text galoisGroup(Structure.GaloisGroup group, Frame frame) {
        Form form = Form.of(frame.options(), Form.NAME);
        if (form == Form.NAME) {
            return frame.name();
        }
        if (form == Form.VALUE) {
            Style usetStyle = frame.forwardStyle(group, "uset");
            Style.Options options = usetStyle instanceof Style.Options o ? o : Style.NONE;
            if (!(group.extension() instanceof Structure.CyclotomicField)) {
                throw new NotYetSupportedException("The elements of a Galois group can only be listed "
                    + "for cyclotomic extensions");
            }
            return frame.forward(CyclotomicFields.buildGaloisUnderlyingSet(group.extension(), options), "uset");
        }

        Text ext = frame.forward(group.extension(), "ext");
        Text base = frame.forward(group.baseField(), "base");
        if (form == Form.SYMBOLIC) {
            return Text.math("\\Gal(").plus(ext).plusMath("/").plus(base).plusMath(")");
        }
        return Text.plain("the Galois group of ").plus(ext).plus(" over ").plus(base);
    }
}

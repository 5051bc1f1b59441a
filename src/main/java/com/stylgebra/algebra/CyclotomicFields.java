package com.stylgebra.algebra;

import com.stylgebra.error.InvalidStyleException;
import com.stylgebra.error.NotYetSupportedException;
import com.stylgebra.node.Meta;
import com.stylgebra.node.Node;
import com.stylgebra.node.Nodes;
import com.stylgebra.node.Relations;
import com.stylgebra.node.Structure;
import com.stylgebra.numeric.CoefficientSource;
import com.stylgebra.numeric.NumberTheory;
import com.stylgebra.style.Style;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Builds expressions for the elements and automorphisms of a cyclotomic field
 * {@code Q(zeta_p)} of prime order {@code p}. An element is written in the power basis
 * {@code 1, zeta, ..., zeta^(p-2)}.
 */
public final class CyclotomicFields {
    private static final String SIGMA = "\\sigma";

    private CyclotomicFields() {
    }

    /**
     * A range sum {@code a_0 + a_1 zeta + ... + a_(p-2) zeta^(p-2)}.
     *
     * <p>When the order has a value the number of terms before the ellipsis is capped at
     * {@code p - 4}, and a cap below one writes out every term. When it has none an ellipsis
     * is needed, so a non-positive {@code elideAfter} falls back to three terms.
     */
    public static Node.RangeSum buildElement(Structure.CyclotomicField field, ElementOptions options) {
        requirePrime(field);

        Node.Variable i = options.coeffIndex() != null ? options.coeffIndex() : new Node.Variable("i");
        Node coeff = options.coeffForm();
        if (coeff == null) {
            CoefficientSource source = options.coefficients();
            if (source != null) {
                coeff = Node.Lookup.computed(List.of(i), args -> Nodes.wrap(
                    source.coefficient(args.get(0) instanceof Long k ? k.intValue() : -1)));
            } else {
                coeff = new Node.StringLiteral(options.coeffBase()).sub(i);
            }
        }
        Node term = coeff.times(field.generator().pow(i));

        Long m = field.orderValue();
        int elideAfter = options.elideAfter();
        if (m != null) {
            elideAfter = (int) Math.min(elideAfter, m - 4);
        } else if (elideAfter < 1) {
            elideAfter = 3;
        }

        MutableList<Object> range = Lists.mutable.empty();
        if (elideAfter > 0) {
            Node order = field.order();
            if (options.fallingPowers()) {
                for (int k = 0; k < elideAfter; k++) {
                    range.add(order.minus(k + 2));
                }
                range.with(Nodes.ELLIPSIS).with(0);
            } else {
                for (int k = 0; k < elideAfter; k++) {
                    range.add(k);
                }
                range.with(Nodes.ELLIPSIS).with(order.minus(2));
            }
        } else {
            for (long k = 0; k < m - 1; k++) {
                range.add(k);
            }
            if (options.fallingPowers()) {
                range.reverseThis();
            }
        }
        return new Node.RangeSum(range, term, i);
    }

    /**
     * The field's underlying set, written as {@code {a_0 + ... : a_i in Q}}. Coefficients are
     * never random here.
     */
    public static Node.SetLiteral buildSet(Structure.CyclotomicField field, ElementOptions options) {
        Node.RangeSum alpha = buildElement(field, options.withCoefficients(null));
        Node coeff = ((Node.Product) alpha.genForm()).factors().get(0);
        return new Node.SetLiteral(Lists.immutable.of(alpha), Relations.in(coeff, Structure.QQ), Meta.NONE);
    }

    /**
     * The automorphisms {@code sigma_r: zeta -> zeta^r} for {@code r = 1, ..., p - 1}.
     *
     * <p>Option {@code generator}: when absent the automorphisms are indexed by the exponent
     * {@code r}. When {@code auto}, or an integer, they are indexed as powers of a generator
     * {@code gamma} of the units mod {@code p}: {@code sigma_k: zeta -> zeta^(gamma^k)}.
     * {@code auto} picks a primitive root; option {@code auto-power} [0] selects which one.
     */
    public static Node.RangeSet buildGaloisUnderlyingSet(Structure extension, Style.Options style) {
        if (!(extension instanceof Structure.CyclotomicField field)) {
            throw new NotYetSupportedException("Galois groups are only supported over cyclotomic fields, not "
                + extension.kind().tag());
        }
        requirePrime(field);

        Node sigma = new Node.StringLiteral(SIGMA);
        Node gen = field.generator();
        List<Object> range = List.of(1, 2, Nodes.ELLIPSIS, field.order().minus(1));
        Object generator = style.get("generator");

        if (generator == null) {
            Node.Variable r = new Node.Variable("r");
            Node.Mapping elt = new Node.Mapping(sigma.sub(r), field, field, List.of(gen), gen.pow(r));
            return new Node.RangeSet(range, elt, r);
        }

        Long m = field.orderValue();
        if (m == null) {
            throw new NotYetSupportedException("A generator of the units needs a numerical order");
        }
        long g;
        if ("auto".equals(generator)) {
            g = NumberTheory.pickPrimitiveRoot(m, style.getInt("auto-power", 0));
        } else if (generator instanceof Number n) {
            g = n.longValue();
        } else {
            try {
                g = Long.parseLong(generator.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidStyleException("generator", generator);
            }
        }

        Node gamma = new Structure.IntResidue(g, m, Meta.of("\\gamma", "gamma"));
        Node.Variable k = new Node.Variable("k");
        Node.Mapping elt = new Node.Mapping(sigma.sub(k), field, field, List.of(gen), gen.pow(gamma.pow(k)));
        return new Node.RangeSet(range, elt, k);
    }

    private static void requirePrime(Structure.CyclotomicField field) {
        if (!field.isPrime()) {
            throw new NotYetSupportedException("Cyclotomic fields are only supported for prime order");
        }
    }
}

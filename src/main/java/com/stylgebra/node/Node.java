package com.stylgebra.node;

import com.stylgebra.numeric.NumberTheory;
import com.stylgebra.style.Style;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.function.Function;

/**
 * A node of a formal expression tree. Nodes are immutable; restructuring and the
 * operator-style builders below always return new nodes.
 */
public sealed interface Node
    permits Node.IntegerLiteral, Node.StringLiteral, Node.Variable, Node.Summand, Node.Sum,
    Node.Product, Node.Quotient, Node.Power, Node.SetLiteral, Node.Mapping, Node.Lookup,
    Node.Ellipsis, Node.Infinity, Node.Subscripted, Node.Superscripted, Node.Relation,
    Node.RelationChain, Node.Range, Structure {

    Meta meta();

    NodeKind kind();

    Node withMeta(Meta meta);

    default String name() {
        return meta().name();
    }

    default String id() {
        return meta().id();
    }

    default Node named(String name) {
        return withMeta(new Meta(name, null, meta().defaultStyle()));
    }

    default Node named(String name, String id) {
        return withMeta(new Meta(name, id, meta().defaultStyle()));
    }

    default Node withDefaultStyle(Style style) {
        return withMeta(meta().withDefaultStyle(style));
    }

    default Sum plus(Object other) {
        return Sum.of(this, other);
    }

    default Sum minus(Object other) {
        return Sum.of(this, Summand.of(Nodes.wrap(other)).negate());
    }

    default Summand negate() {
        Summand s = Summand.of(this);
        return new Summand(s.term(), -s.sign(), Meta.NONE);
    }

    default Product times(Object other) {
        return Product.of(this, other);
    }

    default Quotient over(Object other) {
        return new Quotient(this, Nodes.wrap(other));
    }

    default Power pow(Object exponent) {
        return new Power(this, Nodes.wrap(exponent));
    }

    default Subscripted sub(Object subscript) {
        return new Subscripted(this, Nodes.wrap(subscript));
    }

    default Superscripted sup(Object superscript) {
        return new Superscripted(this, Nodes.wrap(superscript));
    }

    default Relation in(Object right) {
        return Relations.in(this, right);
    }

    default Relation leq(Object right) {
        return Relations.leq(this, right);
    }

    default Relation lt(Object right) {
        return Relations.lt(this, right);
    }

    /**
     * An integer, either with a known value or described only by what is known of it.
     * When the value is known the positive, odd and prime facts are derived from it.
     */
    record IntegerLiteral(Long value, Boolean positive, Boolean odd, Boolean prime, Meta meta) implements Node {
        public IntegerLiteral {
            if (value != null) {
                positive = value > 0;
                odd = value % 2 != 0;
                prime = NumberTheory.isPrime(value);
            }
            if (meta == null) {
                meta = Meta.NONE;
            }
        }

        public static IntegerLiteral of(long value) {
            return new IntegerLiteral(value, null, null, null, Meta.NONE);
        }

        public static IntegerLiteral of(long value, String name) {
            return new IntegerLiteral(value, null, null, null, Meta.named(name));
        }

        /**
         * An integer of unknown value, e.g. the {@code p} in "let p be an odd prime".
         */
        public static IntegerLiteral unknown(String name, Boolean positive, Boolean odd, Boolean prime) {
            return new IntegerLiteral(null, positive, odd, prime, Meta.named(name));
        }

        public static IntegerLiteral unknown(String name) {
            return unknown(name, null, null, null);
        }

        public boolean hasValue() {
            return value != null;
        }

        public boolean isPrime() {
            return Boolean.TRUE.equals(prime);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INTEGER;
        }

        @Override
        public IntegerLiteral withMeta(Meta meta) {
            return new IntegerLiteral(value, positive, odd, prime, meta);
        }
    }

    /**
     * Literal markup, rendered as math text unless {@code mathMode} is off.
     */
    record StringLiteral(String text, boolean mathMode, Meta meta) implements Node {
        public StringLiteral(String text) {
            this(text, true, Meta.NONE);
        }

        public static StringLiteral plain(String text) {
            return new StringLiteral(text, false, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STRING;
        }

        @Override
        public StringLiteral withMeta(Meta meta) {
            return new StringLiteral(text, mathMode, meta);
        }
    }

    /**
     * A placeholder rendered through its substitution. Unless told otherwise a variable
     * substitutes its own name.
     */
    record Variable(Meta meta) implements Node {
        public Variable(String name) {
            this(new Meta(name, null, Style.subst(name)));
        }

        public Variable(String name, String id) {
            this(new Meta(name, id, Style.subst(name)));
        }

        /**
         * A variable standing for {@code value} unless a rule substitutes something else.
         */
        public static Variable standingFor(String name, Object value) {
            return new Variable(new Meta(name, null, Style.subst(value)));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.VARIABLE;
        }

        @Override
        public Variable withMeta(Meta meta) {
            return new Variable(meta);
        }
    }

    /**
     * A term of a sum together with the sign it enters with.
     */
    record Summand(Node term, int sign, Meta meta) implements Node {
        public Summand {
            if (sign != 1 && sign != -1) {
                throw new IllegalArgumentException("A summand's sign must be 1 or -1, got " + sign);
            }
        }

        public Summand(Node term, int sign) {
            this(term, sign, Meta.NONE);
        }

        public static Summand of(Node node) {
            if (node instanceof Summand s) {
                return s;
            }
            return new Summand(node, 1, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUMMAND;
        }

        @Override
        public Summand withMeta(Meta meta) {
            return new Summand(term, sign, meta);
        }
    }

    record Sum(ImmutableList<Summand> summands, Meta meta) implements Node, AssociativeOperator<Summand, Sum> {
        /**
         * A sum of the given terms. Anything that is not already a summand is wrapped as
         * one with a positive sign.
         */
        public static Sum of(Object... terms) {
            return ofAll(List.of(terms));
        }

        public static Sum ofAll(Iterable<?> terms) {
            MutableList<Summand> summands = Lists.mutable.empty();
            for (Object t : terms) {
                summands.add(Summand.of(Nodes.wrap(t)));
            }
            return new Sum(summands.toImmutable(), Meta.NONE);
        }

        @Override
        public ImmutableList<Summand> operands() {
            return summands;
        }

        @Override
        public Sum withOperands(ImmutableList<Summand> operands) {
            return new Sum(operands, Meta.NONE);
        }

        @Override
        public Summand operandOf(Node node) {
            return Summand.of(node);
        }

        /**
         * Nested sums are spliced in; a nested sum entering with a minus sign has each of
         * its summands negated.
         */
        @Override
        public ImmutableList<Summand> flatOperands() {
            MutableList<Summand> flat = Lists.mutable.empty();
            for (Summand s : summands) {
                if (s.term() instanceof Sum inner) {
                    ImmutableList<Summand> nested = inner.flatOperands();
                    flat.addAllIterable(s.sign() == -1 ? nested.collect(Summand::negate) : nested);
                } else {
                    flat.add(s);
                }
            }
            return flat.toImmutable();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUM;
        }

        @Override
        public Sum withMeta(Meta meta) {
            return new Sum(summands, meta);
        }
    }

    record Product(ImmutableList<Node> factors, Meta meta) implements Node, AssociativeOperator<Node, Product> {
        public static Product of(Object... factors) {
            return ofAll(List.of(factors));
        }

        public static Product ofAll(Iterable<?> factors) {
            MutableList<Node> nodes = Lists.mutable.empty();
            for (Object f : factors) {
                nodes.add(Nodes.wrap(f));
            }
            return new Product(nodes.toImmutable(), Meta.NONE);
        }

        @Override
        public ImmutableList<Node> operands() {
            return factors;
        }

        @Override
        public Product withOperands(ImmutableList<Node> operands) {
            return new Product(operands, Meta.NONE);
        }

        @Override
        public Node operandOf(Node node) {
            return node;
        }

        @Override
        public ImmutableList<Node> flatOperands() {
            MutableList<Node> flat = Lists.mutable.empty();
            for (Node f : factors) {
                if (f instanceof Product inner) {
                    flat.addAllIterable(inner.flatOperands());
                } else {
                    flat.add(f);
                }
            }
            return flat.toImmutable();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PRODUCT;
        }

        @Override
        public Product withMeta(Meta meta) {
            return new Product(factors, meta);
        }
    }

    record Quotient(Node top, Node bottom, Meta meta) implements Node {
        public Quotient(Node top, Node bottom) {
            this(top, bottom, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.QUOTIENT;
        }

        @Override
        public Quotient withMeta(Meta meta) {
            return new Quotient(top, bottom, meta);
        }
    }

    record Power(Node base, Node exponent, Meta meta) implements Node {
        public Power(Node base, Node exponent) {
            this(base, exponent, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.POWER;
        }

        @Override
        public Power withMeta(Meta meta) {
            return new Power(base, exponent, meta);
        }
    }

    /**
     * A set given by its elements, optionally with a condition on them.
     *
     * @param condition may be null
     */
    record SetLiteral(ImmutableList<Node> elements, Node condition, Meta meta) implements Node {
        public static SetLiteral of(Object... elements) {
            return new SetLiteral(Nodes.wrapAll(List.of(elements)), null, Meta.NONE);
        }

        public static SetLiteral ofAll(Iterable<?> elements) {
            return new SetLiteral(Nodes.wrapAll(elements), null, Meta.NONE);
        }

        public SetLiteral where(Node condition) {
            return new SetLiteral(elements, condition, meta);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SET;
        }

        @Override
        public SetLiteral withMeta(Meta meta) {
            return new SetLiteral(elements, condition, meta);
        }
    }

    /**
     * A function. Any of the parts a given form does not use may be null.
     *
     * @param nameForm how the function is named, e.g. {@code \sigma_{i}}
     * @param args the formal arguments
     * @param valueForm the value at the formal arguments
     */
    record Mapping(Node nameForm, Node domain, Node codomain, ImmutableList<Node> args, Node valueForm, Meta meta)
        implements Node {
        public Mapping {
            if (args == null) {
                args = Lists.immutable.empty();
            }
        }

        public Mapping(Node nameForm, Node domain, Node codomain, List<? extends Node> args, Node valueForm) {
            this(nameForm, domain, codomain, Lists.immutable.withAll(args), valueForm, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MAPPING;
        }

        @Override
        public Mapping withMeta(Meta meta) {
            return new Mapping(nameForm, domain, codomain, args, valueForm, meta);
        }
    }

    /**
     * A value obtained from its arguments' values at render time.
     */
    record Lookup(ImmutableList<Node> args, LookupSource source, Meta meta) implements Node {
        public static Lookup indexed(Node arg, Object table) {
            return new Lookup(Lists.immutable.of(arg), new LookupSource.Indexed(table), Meta.NONE);
        }

        public static Lookup indexed(List<? extends Node> args, Object table) {
            return new Lookup(Lists.immutable.withAll(args), new LookupSource.Indexed(table), Meta.NONE);
        }

        public static Lookup computed(List<? extends Node> args, Function<List<Object>, Object> function) {
            return new Lookup(Lists.immutable.withAll(args), new LookupSource.Computed(function), Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LOOKUP;
        }

        @Override
        public Lookup withMeta(Meta meta) {
            return new Lookup(args, source, meta);
        }
    }

    record Ellipsis(Meta meta) implements Node {
        @Override
        public NodeKind kind() {
            return NodeKind.ELLIPSIS;
        }

        @Override
        public Ellipsis withMeta(Meta meta) {
            return new Ellipsis(meta);
        }
    }

    record Infinity(int sign, Meta meta) implements Node {
        public Infinity(int sign) {
            this(sign, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INFINITY;
        }

        @Override
        public Infinity withMeta(Meta meta) {
            return new Infinity(sign, meta);
        }
    }

    record Subscripted(Node base, Node subscript, Meta meta) implements Node {
        public Subscripted(Node base, Node subscript) {
            this(base, subscript, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUBSCRIPTED;
        }

        @Override
        public Subscripted withMeta(Meta meta) {
            return new Subscripted(base, subscript, meta);
        }
    }

    record Superscripted(Node base, Node superscript, Meta meta) implements Node {
        public Superscripted(Node base, Node superscript) {
            this(base, superscript, Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SUPERSCRIPTED;
        }

        @Override
        public Superscripted withMeta(Meta meta) {
            return new Superscripted(base, superscript, meta);
        }
    }

    /**
     * A binary relation. A false valence asserts the negation.
     */
    record Relation(RelationKind relationKind, Node left, Node right, boolean valence, Meta meta) implements Node {
        public Relation(RelationKind relationKind, Node left, Node right) {
            this(relationKind, left, right, true, Meta.NONE);
        }

        public Relation negated() {
            return new Relation(relationKind, left, right, !valence, meta);
        }

        /**
         * Continues this relation into a chain such as {@code a < b <= c}.
         */
        public RelationChain then(RelationKind next, Object right) {
            return new RelationChain(left, Lists.immutable.of(
                new RelationChain.Link(relationKind, valence, this.right),
                new RelationChain.Link(next, true, Nodes.wrap(right))), Meta.NONE);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RELATION;
        }

        @Override
        public Relation withMeta(Meta meta) {
            return new Relation(relationKind, left, right, valence, meta);
        }
    }

    record RelationChain(Node first, ImmutableList<Link> links, Meta meta) implements Node {
        public record Link(RelationKind kind, boolean valence, Node right) {}

        public RelationChain then(RelationKind next, Object right) {
            return then(next, true, right);
        }

        public RelationChain then(RelationKind next, boolean valence, Object right) {
            return new RelationChain(first, links.newWith(new Link(next, valence, Nodes.wrap(right))), meta);
        }

        /**
         * The left-hand side of the {@code i}-th link.
         */
        public Node leftOf(int i) {
            return i == 0 ? first : links.get(i - 1).right();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RELATION_CHAIN;
        }

        @Override
        public RelationChain withMeta(Meta meta) {
            return new RelationChain(first, links, meta);
        }
    }

    /**
     * An expression built over a range of indices. A range lists integers, possibly with
     * one {@link Nodes#ELLIPSIS} standing for the omitted run between its neighbours.
     *
     * <p>The general form is written in terms of the bound variable. If neither is given,
     * the bound variable is {@code i} and the general form a variable {@code j} standing for
     * it.
     */
    sealed interface Range extends Node permits RangeSum, RangeSet, RangeProduct {
        ImmutableList<Node> range();

        Node genForm();

        Variable boundVar();

        /**
         * Optional condition on the bound variable; may be null.
         */
        Node condition();

        static Variable defaultBoundVar(Variable boundVar) {
            return boundVar != null ? boundVar : new Variable("i");
        }

        static Node defaultGenForm(Node genForm, Variable boundVar) {
            return genForm != null ? genForm : Variable.standingFor("j", boundVar);
        }
    }

    record RangeSum(ImmutableList<Node> range, Node genForm, Variable boundVar, Node condition, Meta meta)
        implements Range {
        public RangeSum {
            if (range == null) {
                range = Lists.immutable.empty();
            }
            boundVar = Range.defaultBoundVar(boundVar);
            genForm = Range.defaultGenForm(genForm, boundVar);
        }

        public RangeSum(List<?> range, Node genForm, Variable boundVar) {
            this(Nodes.wrapAll(range), genForm, boundVar, null, Meta.NONE);
        }

        public RangeSum where(Node condition) {
            return new RangeSum(range, genForm, boundVar, condition, meta);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RANGE_SUM;
        }

        @Override
        public RangeSum withMeta(Meta meta) {
            return new RangeSum(range, genForm, boundVar, condition, meta);
        }
    }

    record RangeSet(ImmutableList<Node> range, Node genForm, Variable boundVar, Node condition, Meta meta)
        implements Range {
        public RangeSet {
            if (range == null) {
                range = Lists.immutable.empty();
            }
            boundVar = Range.defaultBoundVar(boundVar);
            genForm = Range.defaultGenForm(genForm, boundVar);
        }

        public RangeSet(List<?> range, Node genForm, Variable boundVar) {
            this(Nodes.wrapAll(range), genForm, boundVar, null, Meta.NONE);
        }

        public RangeSet where(Node condition) {
            return new RangeSet(range, genForm, boundVar, condition, meta);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RANGE_SET;
        }

        @Override
        public RangeSet withMeta(Meta meta) {
            return new RangeSet(range, genForm, boundVar, condition, meta);
        }
    }

    record RangeProduct(ImmutableList<Node> range, Node genForm, Variable boundVar, Node condition, Meta meta)
        implements Range {
        public RangeProduct {
            if (range == null) {
                range = Lists.immutable.empty();
            }
            boundVar = Range.defaultBoundVar(boundVar);
            genForm = Range.defaultGenForm(genForm, boundVar);
        }

        public RangeProduct(List<?> range, Node genForm, Variable boundVar) {
            this(Nodes.wrapAll(range), genForm, boundVar, null, Meta.NONE);
        }

        public RangeProduct where(Node condition) {
            return new RangeProduct(range, genForm, boundVar, condition, meta);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RANGE_PRODUCT;
        }

        @Override
        public RangeProduct withMeta(Meta meta) {
            return new RangeProduct(range, genForm, boundVar, condition, meta);
        }
    }
}

package com.stylgebra.adapt;

import com.stylgebra.node.Meta;
import com.stylgebra.node.Node;
import com.stylgebra.node.Nodes;
import com.stylgebra.error.StylgebraException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Turns an outside symbolic expression into a node tree.
 *
 * <p>A product of exactly {@code -1} and one other factor becomes a negative summand, so
 * that {@code x + (-1)*y} renders as {@code x - y}. Inside a product, powers with a negative
 * numeric exponent move to the denominator of a quotient.
 */
public class SymbolicAdapter {

    public Node adapt(SymbolicExpr expr) {
        if (expr instanceof SymbolicExpr.Symbol s) {
            return Nodes.var(s.name());
        }
        if (expr instanceof SymbolicExpr.IntegerLit i) {
            return Nodes.integer(i.value());
        }
        if (expr instanceof SymbolicExpr.RationalLit r) {
            return new Node.Quotient(Nodes.integer(r.numerator()), Nodes.integer(r.denominator()));
        }
        if (expr instanceof SymbolicExpr.Add add) {
            return Node.Sum.ofAll(add.args().collect(this::adapt));
        }
        if (expr instanceof SymbolicExpr.Mul mul) {
            return adaptProduct(mul);
        }
        if (expr instanceof SymbolicExpr.Pow pow) {
            return new Node.Power(adapt(pow.base()), adapt(pow.exponent()));
        }
        throw new StylgebraException("No adapter for " + expr);
    }

    private Node adaptProduct(SymbolicExpr.Mul mul) {
        if (mul.args().size() == 2 && mul.args().get(0).isMinusOne()) {
            return new Node.Summand(adapt(mul.args().get(1)), -1, Meta.NONE);
        }
        MutableList<Node> upstairs = Lists.mutable.empty();
        MutableList<Node> downstairs = Lists.mutable.empty();
        for (SymbolicExpr arg : mul.args()) {
            if (arg instanceof SymbolicExpr.Pow pow && pow.exponent().isNegativeNumber()) {
                downstairs.add(adapt(new SymbolicExpr.Pow(pow.base(), negate(pow.exponent()))));
            } else {
                upstairs.add(adapt(arg));
            }
        }
        Node top = factorsOf(upstairs);
        if (downstairs.isEmpty()) {
            return top;
        }
        return new Node.Quotient(top, factorsOf(downstairs));
    }

    private static Node factorsOf(MutableList<Node> factors) {
        if (factors.size() > 1) {
            return Node.Product.ofAll(factors);
        }
        if (factors.size() == 1) {
            return factors.getFirst();
        }
        return Nodes.integer(1);
    }

    private static SymbolicExpr negate(SymbolicExpr number) {
        if (number instanceof SymbolicExpr.IntegerLit i) {
            return new SymbolicExpr.IntegerLit(-i.value());
        }
        SymbolicExpr.RationalLit r = (SymbolicExpr.RationalLit) number;
        return new SymbolicExpr.RationalLit(-r.numerator(), r.denominator());
    }
}

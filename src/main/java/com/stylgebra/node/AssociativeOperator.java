package com.stylgebra.node;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.function.Function;

/**
 * A node combining a list of operands under one associative operation. Restructuring
 * always returns a new node and drops the name.
 *
 * @param <I> operand type
 * @param <S> the operator's own node type
 */
public interface AssociativeOperator<I, S extends Node & AssociativeOperator<I, S>> {
    ImmutableList<I> operands();

    S withOperands(ImmutableList<I> operands);

    /**
     * Wraps a node so that it can stand as one operand of this operator.
     */
    I operandOf(Node node);

    /**
     * Operands with nested operators of the same kind spliced in.
     */
    ImmutableList<I> flatOperands();

    default S flattened() {
        return withOperands(flatOperands());
    }

    /**
     * Reorders the operands: position {@code i} of the result takes operand
     * {@code perm[i]}.
     */
    default S permuted(int... perm) {
        MutableList<I> items = Lists.mutable.empty();
        for (int p : perm) {
            items.add(operands().get(p));
        }
        return withOperands(items.toImmutable());
    }

    /**
     * Groups the operands into inner operators of this kind, each part listing the operand
     * indices it takes and in which order, and combines the groups with this operator.
     */
    default S split(List<? extends List<Integer>> parts) {
        return withOperands(groups(parts).collect(this::operandOf));
    }

    /**
     * Like {@link #split(List)}, but the groups are combined by {@code outer}.
     */
    default Node split(List<? extends List<Integer>> parts, Function<ImmutableList<Node>, ? extends Node> outer) {
        return outer.apply(groups(parts));
    }

    private ImmutableList<Node> groups(List<? extends List<Integer>> parts) {
        MutableList<Node> groups = Lists.mutable.empty();
        for (List<Integer> part : parts) {
            MutableList<I> items = Lists.mutable.empty();
            for (Integer i : part) {
                items.add(operands().get(i));
            }
            groups.add(withOperands(items.toImmutable()));
        }
        return groups.toImmutable();
    }
}

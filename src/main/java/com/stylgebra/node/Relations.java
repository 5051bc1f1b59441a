package com.stylgebra.node;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Builders for relations. A list on the right of a membership becomes a set literal.
 */
public final class Relations {
    private Relations() {
    }

    public static Node.Relation in(Object left, Object right) {
        return new Node.Relation(RelationKind.MEMBERSHIP, Nodes.wrap(left), setOrNode(right));
    }

    public static Node.Relation notIn(Object left, Object right) {
        return in(left, right).negated();
    }

    public static Node.Relation leq(Object left, Object right) {
        return new Node.Relation(RelationKind.LEQ, Nodes.wrap(left), Nodes.wrap(right));
    }

    public static Node.Relation lt(Object left, Object right) {
        return new Node.Relation(RelationKind.LT, Nodes.wrap(left), Nodes.wrap(right));
    }

    /**
     * A chain {@code a R1 b R2 c ...} from alternating terms and relation kinds.
     */
    public static Node.RelationChain chain(Object first, RelationKind kind, Object second, Object... rest) {
        if (rest.length % 2 != 0) {
            throw new IllegalArgumentException("A relation chain alternates kinds and terms");
        }
        Node.RelationChain c = new Node.RelationChain(Nodes.wrap(first),
            Lists.immutable.of(new Node.RelationChain.Link(kind, true, Nodes.wrap(second))), Meta.NONE);
        for (int i = 0; i < rest.length; i += 2) {
            c = c.then((RelationKind) rest[i], rest[i + 1]);
        }
        return c;
    }

    private static Node setOrNode(Object right) {
        if (right instanceof List<?> list) {
            ImmutableList<Node> elements = Nodes.wrapAll(list);
            return new Node.SetLiteral(elements, null, Meta.NONE);
        }
        return Nodes.wrap(right);
    }
}

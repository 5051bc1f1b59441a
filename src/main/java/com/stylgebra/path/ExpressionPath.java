package com.stylgebra.path;

import com.stylgebra.node.Node;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The alternating sequence of nodes and roles leading down from the root of an expression
 * tree to the node currently being rendered. Each segment pairs an ancestor with the role
 * its child plays, so a path always holds as many ancestors as roles. The empty path is the
 * root.
 *
 * <p>Roles must not contain {@link #DELIMITER}; suffix matching on {@link #rolepath()} relies
 * on it.
 */
public final class ExpressionPath {
    public static final char DELIMITER = '-';

    public static final ExpressionPath ROOT = new ExpressionPath(Lists.immutable.empty());

    public record Segment(Node ancestor, String role) {
        @Override
        public String toString() {
            return "(" + ancestor.kind().tag() + ")-" + role;
        }
    }

    private final ImmutableList<Segment> segments;

    private ExpressionPath(ImmutableList<Segment> segments) {
        this.segments = segments;
    }

    public static ExpressionPath of(Node parent, String role) {
        return ROOT.append(parent, role);
    }

    public ExpressionPath append(Node parent, String role) {
        return new ExpressionPath(segments.newWith(new Segment(parent, role)));
    }

    public Segment last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("The root path has no segments");
        }
        return segments.getLast();
    }

    /**
     * The path with its last segment popped off.
     */
    public ExpressionPath withoutLast() {
        return slice(0, Math.max(0, segments.size() - 1));
    }

    public ExpressionPath slice(int from, int to) {
        return new ExpressionPath(Lists.immutable.withAll(segments.castToList().subList(from, to)));
    }

    public ExpressionPath concat(ExpressionPath other) {
        return new ExpressionPath(segments.newWithAll(other.segments));
    }

    public Segment get(int index) {
        return segments.get(index);
    }

    public int length() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public String rolepath() {
        return segments.collect(Segment::role).makeString(String.valueOf(DELIMITER));
    }

    @Override
    public String toString() {
        return segments.collect(s -> s + "-").makeString("");
    }
}

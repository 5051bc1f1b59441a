package com.stylgebra.rules;

import com.stylgebra.node.Node;
import com.stylgebra.path.ExpressionPath;
import com.stylgebra.path.PathMatch;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.map.MutableMap;

import java.util.Optional;

/**
 * Matches a selector chain against a node and its path, right to left.
 *
 * <p>The last selector is tried on the node itself. Each earlier selector is tried on
 * successively higher ancestors. Between an id or type selector and the selector before it
 * any number of ancestors may be skipped; after a path selector matches, the selector before
 * it must match the ancestor found right where the matched span begins.
 */
public final class SelectorMatcher {
    private SelectorMatcher() {
    }

    /**
     * @param remaining how many selectors of {@code chain}, counted from the left, are still to
     *                  be matched
     * @param indices receives the integers captured by path selectors
     * @param deferOnFail whether a failed match may be retried one ancestor up
     */
    public static boolean matches(Node node, ListIterable<Selector> chain, int remaining,
                                  ExpressionPath path, MutableMap<String, Integer> indices,
                                  boolean deferOnFail) {
        Selector sel = chain.get(remaining - 1);
        boolean matched;
        boolean defer = true;
        ExpressionPath next = path;

        if (sel instanceof Selector.Id id) {
            matched = id.id().equals(node.id());
        } else if (sel instanceof Selector.Path p) {
            Optional<PathMatch> pm = PathMatch.match(p.pattern(), path, p.anchored());
            matched = pm.isPresent();
            if (matched) {
                indices.putAll(pm.get().indices().castToMap());
                next = pm.get().prefix();
                defer = false;
            }
        } else {
            matched = ((Selector.Type) sel).tag().equals(node.kind().tag());
        }

        int left = matched ? remaining - 1 : remaining;
        if ((left > 0 && matched) || (deferOnFail && !matched)) {
            if (next.isEmpty()) {
                return false;
            }
            ExpressionPath.Segment parent = next.last();
            return matches(parent.ancestor(), chain, left, next.withoutLast(), indices, defer);
        }
        return matched;
    }

    public static boolean matches(Node node, ListIterable<Selector> chain, ExpressionPath path,
                                  MutableMap<String, Integer> indices) {
        return matches(node, chain, chain.size(), path, indices, false);
    }
}

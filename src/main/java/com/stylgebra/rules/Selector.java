package com.stylgebra.rules;

/**
 * One whitespace-separated token of a rule key.
 */
public sealed interface Selector {
    /**
     * {@code #token}: the node's id.
     */
    record Id(String id) implements Selector {}

    /**
     * A bare word: the node's kind tag, e.g. {@code Sum}.
     */
    record Type(String tag) implements Selector {}

    /**
     * {@code @pattern}: the tail of the node's path. {@code @/pattern} is anchored at the
     * root, so the pattern must span the whole path.
     */
    record Path(String pattern, boolean anchored) implements Selector {
        public Path(String pattern) {
            this(pattern, false);
        }
    }
}

package com.stylgebra.text;

import org.eclipse.collections.api.list.ListIterable;

/**
 * Rendered output. {@link Math} is content meant for a math-mode context, {@link Plain} is
 * ordinary prose. Mixing the two during concatenation switches math segments into inline
 * {@code $...$} delimiters inside a plain result.
 */
public sealed interface Text {
    Text EMPTY = new Plain("");

    String content();

    record Math(String content) implements Text {
        @Override
        public Text plus(Text other) {
            if (other.isEmpty()) {
                return new Math(content);
            }
            if (other instanceof Math m) {
                return new Math(content + m.content());
            }
            return new Plain("$" + content + "$" + other.content());
        }

        @Override
        public Text withContent(String content) {
            return new Math(content);
        }

        @Override
        public String toString() {
            return content;
        }
    }

    record Plain(String content) implements Text {
        @Override
        public Text plus(Text other) {
            if (other instanceof Math m) {
                if (content.isEmpty()) {
                    return new Math(m.content());
                }
                return new Plain(content + "$" + m.content() + "$");
            }
            return new Plain(content + other.content());
        }

        @Override
        public Text withContent(String content) {
            return new Plain(content);
        }

        @Override
        public String toString() {
            return content;
        }
    }

    Text plus(Text other);

    /**
     * Same kind of text, different content.
     */
    Text withContent(String content);

    default Text plus(String plain) {
        return plus(new Plain(plain));
    }

    default Text plusMath(String math) {
        return plus(new Math(math));
    }

    default boolean isEmpty() {
        return content().isEmpty();
    }

    default boolean startsWith(String prefix) {
        return content().startsWith(prefix);
    }

    default boolean is(String s) {
        return content().equals(s);
    }

    default boolean isZero() {
        return is("0") || is("-0");
    }

    /**
     * Strips a leading minus sign if there is one, otherwise adds one.
     */
    default Text negated() {
        if (startsWith("-")) {
            return math(content().substring(1));
        }
        return math("-").plus(this);
    }

    default Text dropFirst() {
        return withContent(content().substring(1));
    }

    static Text math(Object value) {
        if (value instanceof Text t) {
            return new Math(t.content());
        }
        return new Math(String.valueOf(value));
    }

    static Text plain(String value) {
        return new Plain(value);
    }

    /**
     * Concatenates {@code items} with {@code separator} between them, building each step
     * as {@code s + (separator + item)}.
     */
    static Text join(Text separator, ListIterable<? extends Text> items) {
        Text s = EMPTY;
        boolean first = true;
        for (Text t : items) {
            if (first) {
                s = t;
                first = false;
            } else {
                s = s.plus(separator.plus(t));
            }
        }
        return s;
    }

    /**
     * Joins the raw contents, producing plain text with no math delimiters.
     */
    static Text joinPlain(String separator, ListIterable<? extends Text> items) {
        return new Plain(items.collect(Text::content).makeString(separator));
    }

    static Text mbox(Text t) {
        if (t instanceof Math) {
            return t;
        }
        return new Math("\\mbox{" + t.content() + "}");
    }
}

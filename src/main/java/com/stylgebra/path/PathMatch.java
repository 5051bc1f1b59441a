package com.stylgebra.path;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Result of matching a path selector's pattern against the tail of an expression path.
 *
 * <p>A pattern is a run of roles separated by {@code -}, and may use bracket names to capture
 * non-negative integers. For example {@code cat-foo[i]bar[j]} matches the rolepath
 * {@code baz3-cat-foo17bar81} with {@code i=17, j=81}. The pattern must start at the
 * beginning of the rolepath or just after a delimiter, and must reach its end. An anchored
 * pattern must start at the beginning. Captures hold at most nine digits.
 *
 * @param indices captured bracket names
 * @param prefix the path that remains once the matched span is set aside, ending with the
 *               segment whose role is the first one matched
 */
public record PathMatch(ImmutableMap<String, Integer> indices, ExpressionPath prefix) {
    private static final Pattern BRACKET = Pattern.compile("\\[([a-zA-Z]\\w*)]");

    public static Optional<PathMatch> match(String endPattern, ExpressionPath path) {
        return match(endPattern, path, false);
    }

    public static Optional<PathMatch> match(String endPattern, ExpressionPath path, boolean anchored) {
        MutableList<String> names = Lists.mutable.empty();
        Pattern pattern = compile(endPattern, names, anchored);
        Matcher m = pattern.matcher(path.rolepath());
        if (!m.find()) {
            return Optional.empty();
        }
        MutableMap<String, Integer> indices = Maps.mutable.empty();
        for (int g = 0; g < names.size(); g++) {
            indices.put(names.get(g), Integer.parseInt(m.group("g" + g)));
        }
        int n = endPattern.split(String.valueOf(ExpressionPath.DELIMITER), -1).length;
        ExpressionPath prefix = n == 1 ? path : path.slice(0, Math.max(0, path.length() - n + 1));
        return Optional.of(new PathMatch(indices.toImmutable(), prefix));
    }

    /**
     * Java group names cannot hold underscores, so captures get positional group names and
     * {@code names} records which bracket name each one stands for.
     */
    private static Pattern compile(String endPattern, MutableList<String> names, boolean anchored) {
        StringBuilder regex = new StringBuilder(anchored ? "^" : "(?:^|" + ExpressionPath.DELIMITER + ")");
        Matcher brackets = BRACKET.matcher(endPattern);
        int last = 0;
        while (brackets.find()) {
            regex.append(quote(endPattern.substring(last, brackets.start())));
            regex.append("(?<g").append(names.size()).append(">\\d{1,9})");
            names.add(brackets.group(1));
            last = brackets.end();
        }
        regex.append(quote(endPattern.substring(last))).append('$');
        return Pattern.compile(regex.toString());
    }

    private static String quote(String literal) {
        return literal.isEmpty() ? "" : Pattern.quote(literal);
    }
}

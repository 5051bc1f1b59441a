package com.stylgebra.rules;

import com.stylgebra.node.Node;
import com.stylgebra.path.ExpressionPath;
import com.stylgebra.style.Style;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * An ordered table of rules, each keyed by a selector chain such as
 * {@code "Sum @term[i] #x"}. The first rule whose chain matches a node decides its style.
 *
 * <p>Tables are immutable. {@link #with} replaces a rule with the same key where it stands,
 * or appends a new one at the end.
 */
public final class RuleTable {
    private static final Logger logger = LoggerFactory.getLogger(RuleTable.class);

    public static final RuleTable EMPTY = new RuleTable(Lists.immutable.empty());

    public record Rule(String selectorChain, StyleSource source) {}

    /**
     * What a matching rule yields.
     */
    public sealed interface StyleSource {
        Style styleFor(MutableMap<String, Integer> indices);

        record Literal(Style style) implements StyleSource {
            @Override
            public Style styleFor(MutableMap<String, Integer> indices) {
                return style;
            }
        }

        /**
         * A style computed from the integers captured by bracket names in path selectors.
         * The function gets one argument per parameter name, in order, null where the name
         * was not captured.
         */
        record Derived(ImmutableList<String> params, Function<List<Integer>, Style> function)
            implements StyleSource {
            @Override
            public Style styleFor(MutableMap<String, Integer> indices) {
                MutableList<Integer> args = Lists.mutable.empty();
                for (String p : params) {
                    args.add(indices.get(p));
                }
                return function.apply(args);
            }
        }
    }

    private final ImmutableList<Rule> rules;
    private final SelectorParser parser = new SelectorParser();

    private RuleTable(ImmutableList<Rule> rules) {
        this.rules = rules;
    }

    public static RuleTable of(String selectorChain, Style style) {
        return EMPTY.with(selectorChain, style);
    }

    public RuleTable with(String selectorChain, StyleSource source) {
        Rule rule = new Rule(selectorChain, source);
        int at = rules.detectIndex(r -> r.selectorChain().equals(selectorChain));
        if (at < 0) {
            return new RuleTable(rules.newWith(rule));
        }
        MutableList<Rule> copy = rules.toList();
        copy.set(at, rule);
        return new RuleTable(copy.toImmutable());
    }

    public RuleTable with(String selectorChain, Style style) {
        return with(selectorChain, new StyleSource.Literal(style));
    }

    public RuleTable with(String selectorChain, String param, Function<Integer, Style> function) {
        return with(selectorChain, new StyleSource.Derived(
            Lists.immutable.of(param), args -> function.apply(args.get(0))));
    }

    public RuleTable with(String selectorChain, String param1, String param2,
                          BiFunction<Integer, Integer, Style> function) {
        return with(selectorChain, new StyleSource.Derived(
            Lists.immutable.of(param1, param2), args -> function.apply(args.get(0), args.get(1))));
    }

    /**
     * The style of the first rule matching {@code node} at {@code path}.
     *
     * @throws com.stylgebra.error.MalformedSelectorException when a key tried before the
     *         match is not a space-separated list of selectors
     */
    public Optional<Style> resolve(Node node, ExpressionPath path) {
        for (Rule rule : rules) {
            ImmutableList<Selector> chain = parser.parse(rule.selectorChain());
            MutableMap<String, Integer> indices = Maps.mutable.empty();
            if (SelectorMatcher.matches(node, chain, path, indices)) {
                logger.debug("Rule '{}' matched {} at '{}'", rule.selectorChain(), node.kind().tag(), path.rolepath());
                return Optional.ofNullable(rule.source().styleFor(indices));
            }
        }
        return Optional.empty();
    }

    public ImmutableList<Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }
}

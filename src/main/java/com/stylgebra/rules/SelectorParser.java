package com.stylgebra.rules;

import com.stylgebra.error.MalformedSelectorException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.regex.Pattern;

public class SelectorParser {
    private static final Pattern SELECTOR_CHAIN = Pattern.compile("^\\S+(\\s+\\S+)*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ImmutableList<Selector> parse(String selectorChain) {
        if (selectorChain == null || !SELECTOR_CHAIN.matcher(selectorChain).matches()) {
            throw new MalformedSelectorException(selectorChain);
        }
        MutableList<Selector> selectors = Lists.mutable.empty();
        for (String token : WHITESPACE.split(selectorChain)) {
            selectors.add(parseSelector(token));
        }
        return selectors.toImmutable();
    }

    private Selector parseSelector(String token) {
        if (token.startsWith("#")) {
            return new Selector.Id(token.substring(1));
        }
        if (token.startsWith("@/")) {
            return new Selector.Path(token.substring(2), true);
        }
        if (token.startsWith("@")) {
            return new Selector.Path(token.substring(1));
        }
        return new Selector.Type(token);
    }
}

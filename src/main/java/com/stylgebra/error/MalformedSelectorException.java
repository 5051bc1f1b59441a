package com.stylgebra.error;

/**
 * A rule table key that is not a space-separated sequence of non-empty selectors.
 */
public class MalformedSelectorException extends StylgebraException {
    private final String selectorChain;

    public MalformedSelectorException(String selectorChain) {
        super("Malformed selector: " + selectorChain);
        this.selectorChain = selectorChain;
    }

    public String getSelectorChain() {
        return selectorChain;
    }
}

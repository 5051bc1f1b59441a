package com.stylgebra.node;

public enum RelationKind {
    MEMBERSHIP("\\in", "\\not\\in", "is an element of", "is not an element of"),
    LEQ("\\leq", "\\not\\leq", "is less than or equal to", "is not less than or equal to"),
    LT("<", "\\nless", "is less than", "is not less than");

    private final String symbol;
    private final String negatedSymbol;
    private final String phrase;
    private final String negatedPhrase;

    RelationKind(String symbol, String negatedSymbol, String phrase, String negatedPhrase) {
        this.symbol = symbol;
        this.negatedSymbol = negatedSymbol;
        this.phrase = phrase;
        this.negatedPhrase = negatedPhrase;
    }

    public String symbol(boolean valence) {
        return valence ? symbol : negatedSymbol;
    }

    public String phrase(boolean valence) {
        return valence ? phrase : negatedPhrase;
    }
}

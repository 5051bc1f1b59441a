package com.stylgebra.node;

/**
 * The closed set of node variants. The tag is what a bare-word type selector matches.
 */
public enum NodeKind {
    INTEGER("Integer"),
    STRING("String"),
    VARIABLE("Variable"),
    SUMMAND("Summand"),
    SUM("Sum"),
    PRODUCT("Product"),
    QUOTIENT("Quotient"),
    POWER("Power"),
    SET("Set"),
    MAPPING("Mapping"),
    LOOKUP("Lookup"),
    ELLIPSIS("Ellipsis"),
    INFINITY("Infinity"),
    SUBSCRIPTED("Subscripted"),
    SUPERSCRIPTED("Superscripted"),
    RELATION("Relation"),
    RELATION_CHAIN("RelationChain"),
    RANGE_SUM("RangeSum"),
    RANGE_SET("RangeSet"),
    RANGE_PRODUCT("RangeProduct"),
    RATIONAL_NUMBERS("RationalNumbers"),
    PRIMITIVE_ROOT_OF_UNITY("PrimitiveRootOfUnity"),
    CYCLOTOMIC_FIELD("CyclotomicField"),
    GALOIS_GROUP("GaloisGroup"),
    INT_RESIDUE("IntResidue");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

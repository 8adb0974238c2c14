package org.fangless.transpiler.frontend.parser.ast;

/**
 * Relational and membership operators, tagged with their source spelling.
 */
public enum ComparisonOperator {
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IN("in"),
    NOT_IN("not in"),
    IS("is"),
    IS_NOT("is not");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The operator as written in the source language.
     */
    public String symbol() {
        return symbol;
    }
}

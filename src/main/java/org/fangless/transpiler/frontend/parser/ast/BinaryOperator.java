package org.fangless.transpiler.frontend.parser.ast;

/**
 * Arithmetic and logical binary operators, tagged with their source spelling.
 */
public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("**"),
    FLOOR_DIV("//"),
    AND("and"),
    OR("or");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return The operator as written in the source language.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for {@code and} / {@code or}.
     */
    public boolean isLogical() {
        return this == AND || this == OR;
    }
}

package org.fangless.transpiler.frontend.parser.ast;

/**
 * Plain and augmented assignment operators. Augmented forms stay distinct in the tree;
 * they are lowered to {@code target = target op value} only during code generation.
 */
public enum AssignOperator {
    ASSIGN("=", null),
    ADD("+=", BinaryOperator.ADD),
    SUB("-=", BinaryOperator.SUB),
    MUL("*=", BinaryOperator.MUL),
    DIV("/=", BinaryOperator.DIV),
    FLOOR_DIV("//=", BinaryOperator.FLOOR_DIV),
    MOD("%=", BinaryOperator.MOD),
    POW("**=", BinaryOperator.POW);

    private final String symbol;
    private final BinaryOperator binaryOperator;

    AssignOperator(String symbol, BinaryOperator binaryOperator) {
        this.symbol = symbol;
        this.binaryOperator = binaryOperator;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return The arithmetic operator applied by an augmented form, or {@code null} for plain assignment.
     */
    public BinaryOperator binaryOperator() {
        return binaryOperator;
    }

    public boolean isAugmented() {
        return binaryOperator != null;
    }
}

package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

/**
 * A constant: an integer, float, string, boolean or {@code None}.
 *
 * @param value A {@link Long}, {@link Double}, {@link String}, {@link Boolean}, or {@code null} for {@code None}.
 * @param sourceInfo The position of the literal, or {@code null}.
 */
public record LiteralExpr(Object value, SourceInfo sourceInfo) implements Expr {

    /**
     * The runtime kind of a literal.
     */
    public enum Kind { INT, FLOAT, STRING, BOOL, NONE }

    public LiteralExpr {
        if (value != null && !(value instanceof Long) && !(value instanceof Double)
                && !(value instanceof String) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported literal value type: " + value.getClass().getName());
        }
    }

    public static LiteralExpr ofInt(long value) { return new LiteralExpr(value, null); }
    public static LiteralExpr ofFloat(double value) { return new LiteralExpr(value, null); }
    public static LiteralExpr ofString(String value) { return new LiteralExpr(value, null); }
    public static LiteralExpr ofBool(boolean value) { return new LiteralExpr(value, null); }
    public static LiteralExpr none() { return new LiteralExpr(null, null); }

    /**
     * @return The kind of this literal, derived from the value's type.
     */
    public Kind kind() {
        if (value == null) return Kind.NONE;
        if (value instanceof Long) return Kind.INT;
        if (value instanceof Double) return Kind.FLOAT;
        if (value instanceof Boolean) return Kind.BOOL;
        return Kind.STRING;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}

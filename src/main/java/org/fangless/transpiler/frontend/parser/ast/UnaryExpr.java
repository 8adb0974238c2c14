package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A unary operation: arithmetic negation or logical {@code not}.
 *
 * @param op The operator.
 * @param operand The operand.
 * @param sourceInfo The position of the operator, or {@code null}.
 */
public record UnaryExpr(Op op, Expr operand, SourceInfo sourceInfo) implements Expr {

    /**
     * The supported unary operators.
     */
    public enum Op { NEG, NOT }

    public UnaryExpr {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
    }

    public UnaryExpr(Op op, Expr operand) {
        this(op, operand, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}

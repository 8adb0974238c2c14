package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A binary arithmetic or logical operation.
 *
 * @param left The left operand.
 * @param op The operator.
 * @param right The right operand.
 * @param sourceInfo The position of the operator, or {@code null}.
 */
public record BinaryExpr(Expr left, BinaryOperator op, Expr right, SourceInfo sourceInfo) implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
    }

    public BinaryExpr(Expr left, BinaryOperator op, Expr right) {
        this(left, op, right, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}

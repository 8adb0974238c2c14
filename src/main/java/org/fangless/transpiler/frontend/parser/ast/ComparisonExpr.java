package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A single relational comparison, including membership. Always binary; chains are not represented.
 *
 * @param left The left operand.
 * @param op The operator.
 * @param right The right operand.
 * @param sourceInfo The position of the operator, or {@code null}.
 */
public record ComparisonExpr(Expr left, ComparisonOperator op, Expr right, SourceInfo sourceInfo) implements Expr {

    public ComparisonExpr {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(right, "right");
    }

    public ComparisonExpr(Expr left, ComparisonOperator op, Expr right) {
        this(left, op, right, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}

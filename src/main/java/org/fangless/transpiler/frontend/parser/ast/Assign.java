package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A binding or mutation.
 *
 * @param target An {@link Identifier}, {@link Subscript}, {@link Attribute}, or a {@link TupleExpr}/{@link ListExpr} pattern.
 * @param op The assignment operator.
 * @param value The assigned expression.
 * @param sourceInfo The position of the target, or {@code null}.
 */
public record Assign(Expr target, AssignOperator op, Expr value, SourceInfo sourceInfo) implements Stmt {

    public Assign {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(value, "value");
    }

    public Assign(Expr target, AssignOperator op, Expr value) {
        this(target, op, value, null);
    }

    public Assign(Expr target, Expr value) {
        this(target, AssignOperator.ASSIGN, value, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, value);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }
}

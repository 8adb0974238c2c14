package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * An expression evaluated for its side effects, typically a call.
 *
 * @param value The expression.
 * @param sourceInfo The position of the expression, or {@code null}.
 */
public record ExprStmt(Expr value, SourceInfo sourceInfo) implements Stmt {

    public ExprStmt {
        Objects.requireNonNull(value, "value");
    }

    public ExprStmt(Expr value) {
        this(value, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitExprStmt(this);
    }
}

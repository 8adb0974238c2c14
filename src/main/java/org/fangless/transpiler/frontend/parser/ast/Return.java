package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;

/**
 * A {@code return} statement.
 *
 * @param value The returned expression, or {@code null} for a bare {@code return}.
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record Return(Expr value, SourceInfo sourceInfo) implements Stmt {

    public Return(Expr value) {
        this(value, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(value);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}

package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;

/**
 * A set literal.
 *
 * @param elements The element expressions in source order.
 * @param sourceInfo The position of the opening delimiter, or {@code null}.
 */
public record SetExpr(List<Expr> elements, SourceInfo sourceInfo) implements Expr {

    public SetExpr {
        elements = List.copyOf(elements);
    }

    public SetExpr(List<Expr> elements) {
        this(elements, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSet(this);
    }
}

package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * Indexing ({@code a[i]}) or slicing ({@code a[start:stop:step]}, where the index is a {@link SliceExpr}).
 *
 * @param value The indexed expression.
 * @param index The index expression.
 * @param sourceInfo The position of the opening bracket, or {@code null}.
 */
public record Subscript(Expr value, Expr index, SourceInfo sourceInfo) implements Expr {

    public Subscript {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(index, "index");
    }

    public Subscript(Expr value, Expr index) {
        this(value, index, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value, index);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSubscript(this);
    }
}

package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;

/**
 * The {@code start:stop:step} index of a slicing {@link Subscript}. Every part may be omitted ({@code null}).
 *
 * @param lower The start, or {@code null}.
 * @param upper The stop, or {@code null}.
 * @param step The step, or {@code null}.
 * @param sourceInfo The position of the first colon, or {@code null}.
 */
public record SliceExpr(Expr lower, Expr upper, Expr step, SourceInfo sourceInfo) implements Expr {

    public SliceExpr(Expr lower, Expr upper, Expr step) {
        this(lower, upper, step, null);
    }

    /**
     * @return {@code true} for {@code [:]} and {@code [::]}.
     */
    public boolean isFullCopy() {
        return lower == null && upper == null && step == null;
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(lower, upper, step);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitSlice(this);
    }
}

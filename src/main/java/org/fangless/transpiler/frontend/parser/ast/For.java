package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * Iteration over an iterable. The {@code else} body runs only when the loop ends without {@code break}.
 *
 * @param target The loop variable, or a tuple/list pattern of loop variables.
 * @param iterable The iterated expression.
 * @param body The loop body.
 * @param orelse The {@code else} body, or {@code null}.
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record For(Expr target, Expr iterable, Block body, Block orelse, SourceInfo sourceInfo) implements Stmt {

    public For {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(iterable, "iterable");
        Objects.requireNonNull(body, "body");
    }

    public For(Expr target, Expr iterable, Block body, Block orelse) {
        this(target, iterable, body, orelse, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(target, iterable, body, orelse);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitFor(this);
    }
}

package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A pre-test loop. The {@code else} body runs only when the loop ends without {@code break}.
 *
 * @param condition The loop condition.
 * @param body The loop body.
 * @param orelse The {@code else} body, or {@code null}.
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record While(Expr condition, Block body, Block orelse, SourceInfo sourceInfo) implements Stmt {

    public While {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
    }

    public While(Expr condition, Block body, Block orelse) {
        this(condition, body, orelse, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(condition, body, orelse);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }
}

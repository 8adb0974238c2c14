package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;

/**
 * A nested statement sequence, such as the suite of an {@code if} or a loop.
 *
 * @param statements The statements in source order; may be empty.
 * @param sourceInfo The position of the first statement, or {@code null}.
 */
public record Block(List<Stmt> statements, SourceInfo sourceInfo) implements Stmt {

    public Block {
        statements = List.copyOf(statements);
    }

    public Block(List<Stmt> statements) {
        this(statements, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}

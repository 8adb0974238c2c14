package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

/**
 * A {@code continue} statement.
 *
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record Continue(SourceInfo sourceInfo) implements Stmt {

    public Continue() {
        this(null);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}

package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

/**
 * A {@code pass} statement.
 *
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record Pass(SourceInfo sourceInfo) implements Stmt {

    public Pass() {
        this(null);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitPass(this);
    }
}

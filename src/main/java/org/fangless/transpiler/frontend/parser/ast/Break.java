package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

/**
 * A {@code break} statement.
 *
 * @param sourceInfo The position of the keyword, or {@code null}.
 */
public record Break(SourceInfo sourceInfo) implements Stmt {

    public Break() {
        this(null);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}

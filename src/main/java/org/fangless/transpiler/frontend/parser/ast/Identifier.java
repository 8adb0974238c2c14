package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.Objects;

/**
 * A reference to a variable or function by name.
 *
 * @param name The source name.
 * @param sourceInfo The position of the name, or {@code null}.
 */
public record Identifier(String name, SourceInfo sourceInfo) implements Expr {

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    public Identifier(String name) {
        this(name, null);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}

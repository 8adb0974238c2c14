package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * Member access {@code value.attr}; as the callee of a {@link CallExpr} it names a method.
 *
 * @param value The object expression.
 * @param attr The member name.
 * @param sourceInfo The position of the dot, or {@code null}.
 */
public record Attribute(Expr value, String attr, SourceInfo sourceInfo) implements Expr {

    public Attribute {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(attr, "attr");
    }

    public Attribute(Expr value, String attr) {
        this(value, attr, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitAttribute(this);
    }
}

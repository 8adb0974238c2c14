package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A function or method invocation with positional arguments.
 *
 * @param callee The called expression, usually an {@link Identifier} or an {@link Attribute}.
 * @param args The arguments in source order.
 * @param sourceInfo The position of the call, or {@code null}.
 */
public record CallExpr(Expr callee, List<Expr> args, SourceInfo sourceInfo) implements Expr {

    public CallExpr {
        Objects.requireNonNull(callee, "callee");
        args = List.copyOf(args);
    }

    public CallExpr(Expr callee, List<Expr> args) {
        this(callee, args, null);
    }

    /**
     * @return The callee's name if it is a plain identifier, otherwise {@code null}.
     */
    public String calleeName() {
        return callee instanceof Identifier id ? id.name() : null;
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(callee, args);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}

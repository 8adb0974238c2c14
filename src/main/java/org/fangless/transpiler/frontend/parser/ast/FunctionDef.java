package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;
import java.util.Objects;

/**
 * A function declaration with positional parameters.
 *
 * @param name The function name.
 * @param params The parameters in declaration order.
 * @param body The body statements in source order.
 * @param sourceInfo The position of the {@code def} keyword, or {@code null}.
 */
public record FunctionDef(String name, List<Identifier> params, List<Stmt> body, SourceInfo sourceInfo) implements Stmt {

    public FunctionDef {
        Objects.requireNonNull(name, "name");
        params = List.copyOf(params);
        body = List.copyOf(body);
    }

    public FunctionDef(String name, List<Identifier> params, List<Stmt> body) {
        this(name, params, body, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.childrenOf(params, body);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }
}

package org.fangless.transpiler.frontend.parser.ast;

import org.fangless.transpiler.api.SourceInfo;

import java.util.List;

/**
 * The root of the tree: the whole program as an ordered sequence of statements.
 *
 * @param body The top-level statements in source order.
 * @param sourceInfo The position of the module, or {@code null}.
 */
public record Module(List<Stmt> body, SourceInfo sourceInfo) implements AstNode {

    public Module {
        body = List.copyOf(body);
    }

    public Module(List<Stmt> body) {
        this(body, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(body);
    }
}

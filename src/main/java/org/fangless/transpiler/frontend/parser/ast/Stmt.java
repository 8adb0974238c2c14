package org.fangless.transpiler.frontend.parser.ast;

/**
 * The closed family of statement nodes.
 */
public sealed interface Stmt extends AstNode
        permits Assign, ExprStmt, Return, Break, Continue, Pass, If, While, For, Block, FunctionDef, Import {

    /**
     * Dispatches this node to the matching method of the visitor.
     *
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(StmtVisitor<R> visitor);
}

package org.fangless.transpiler.frontend.parser.ast;

/**
 * The closed family of expression nodes.
 */
public sealed interface Expr extends AstNode
        permits LiteralExpr, Identifier, UnaryExpr, BinaryExpr, ComparisonExpr, CallExpr,
        ListExpr, TupleExpr, SetExpr, DictExpr, Subscript, Attribute, SliceExpr {

    /**
     * Dispatches this node to the matching method of the visitor.
     *
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @return The visitor's result.
     */
    <R> R accept(ExprVisitor<R> visitor);
}

package org.fangless.transpiler.frontend.parser.ast;

/**
 * A visitor over every expression variant. Adding a variant to {@link Expr}
 * forces every implementation to handle it.
 *
 * @param <R> The result type of the visit.
 */
public interface ExprVisitor<R> {
    R visitLiteral(LiteralExpr node);
    R visitIdentifier(Identifier node);
    R visitUnary(UnaryExpr node);
    R visitBinary(BinaryExpr node);
    R visitComparison(ComparisonExpr node);
    R visitCall(CallExpr node);
    R visitList(ListExpr node);
    R visitTuple(TupleExpr node);
    R visitSet(SetExpr node);
    R visitDict(DictExpr node);
    R visitSubscript(Subscript node);
    R visitAttribute(Attribute node);
    R visitSlice(SliceExpr node);
}

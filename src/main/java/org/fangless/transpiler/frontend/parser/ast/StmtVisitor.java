package org.fangless.transpiler.frontend.parser.ast;

/**
 * A visitor over every statement variant. Adding a variant to {@link Stmt}
 * forces every implementation to handle it.
 *
 * @param <R> The result type of the visit.
 */
public interface StmtVisitor<R> {
    R visitAssign(Assign node);
    R visitExprStmt(ExprStmt node);
    R visitReturn(Return node);
    R visitBreak(Break node);
    R visitContinue(Continue node);
    R visitPass(Pass node);
    R visitIf(If node);
    R visitWhile(While node);
    R visitFor(For node);
    R visitBlock(Block node);
    R visitFunctionDef(FunctionDef node);
    R visitImport(Import node);
}

package org.fangless.transpiler.codegen;

import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.diagnostics.TranspilerLogger;
import org.fangless.transpiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Dispatches statements to the {@link BasicStatementGenerator} or the {@link ControlFlowGenerator}.
 * Each statement yields a list of C++ lines relative to the current nesting level;
 * enclosing generators add the indentation.
 */
public class StatementGenerator implements StmtVisitor<List<String>> {

    private final BasicStatementGenerator basic;
    private final ControlFlowGenerator controlFlow;

    /**
     * @param context The shared generation context.
     * @param expressions The expression generator.
     */
    public StatementGenerator(CodegenContext context, ExprGenerator expressions) {
        this.basic = new BasicStatementGenerator(context, expressions);
        this.controlFlow = new ControlFlowGenerator(context, expressions, basic, this);
    }

    /**
     * @param stmt The statement.
     * @return The generated lines.
     */
    public List<String> generate(Stmt stmt) {
        List<String> lines = stmt.accept(this);
        TranspilerLogger.trace("Lowered {} at {} to {} line(s).",
                stmt.getClass().getSimpleName(), stmt.sourceInfo(), lines.size());
        return lines;
    }

    /**
     * Generates a sequence of statements in order.
     * @param statements The statements.
     * @return The generated lines.
     */
    public List<String> generateBlock(List<Stmt> statements) {
        List<String> lines = new ArrayList<>();
        for (Stmt stmt : statements) {
            lines.addAll(generate(stmt));
        }
        return lines;
    }

    @Override
    public List<String> visitAssign(Assign node) {
        return basic.assign(node);
    }

    @Override
    public List<String> visitExprStmt(ExprStmt node) {
        return basic.expressionStatement(node);
    }

    @Override
    public List<String> visitReturn(Return node) {
        return basic.returnStatement(node);
    }

    @Override
    public List<String> visitPass(Pass node) {
        return basic.pass(node);
    }

    @Override
    public List<String> visitImport(Import node) {
        return basic.importStatement(node);
    }

    @Override
    public List<String> visitBreak(Break node) {
        return controlFlow.breakStatement(node);
    }

    @Override
    public List<String> visitContinue(Continue node) {
        return controlFlow.continueStatement(node);
    }

    @Override
    public List<String> visitIf(If node) {
        return controlFlow.ifStatement(node);
    }

    @Override
    public List<String> visitWhile(While node) {
        return controlFlow.whileStatement(node);
    }

    @Override
    public List<String> visitFor(For node) {
        return controlFlow.forStatement(node);
    }

    @Override
    public List<String> visitBlock(Block node) {
        return generateBlock(node.statements());
    }

    @Override
    public List<String> visitFunctionDef(FunctionDef node) {
        throw new CodegenException(TranspilerErrorCode.NESTED_FUNCTION_DEFINITION, "FunctionDef",
                "function '" + node.name() + "' must be defined at module level", node.sourceInfo());
    }
}

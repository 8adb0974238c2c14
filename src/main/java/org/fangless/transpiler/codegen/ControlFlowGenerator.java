package org.fangless.transpiler.codegen;

import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.frontend.parser.ast.Assign;
import org.fangless.transpiler.frontend.parser.ast.AstNode;
import org.fangless.transpiler.frontend.parser.ast.Break;
import org.fangless.transpiler.frontend.parser.ast.CallExpr;
import org.fangless.transpiler.frontend.parser.ast.Continue;
import org.fangless.transpiler.frontend.parser.ast.ElifClause;
import org.fangless.transpiler.frontend.parser.ast.Expr;
import org.fangless.transpiler.frontend.parser.ast.For;
import org.fangless.transpiler.frontend.parser.ast.Identifier;
import org.fangless.transpiler.frontend.parser.ast.If;
import org.fangless.transpiler.frontend.parser.ast.ListExpr;
import org.fangless.transpiler.frontend.parser.ast.Stmt;
import org.fangless.transpiler.frontend.parser.ast.TupleExpr;
import org.fangless.transpiler.frontend.parser.ast.While;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generates {@code if}/{@code elif}/{@code else}, {@code while}, {@code for}, {@code break} and {@code continue}.
 * <p>
 * Conditions are coerced with {@code toBool()}. Every body is generated in a child scope.
 * Names assigned anywhere inside a compound statement are declared in the enclosing scope
 * just before it, so that they stay visible after the C++ block closes.
 * <p>
 * A loop with an {@code else} clause gets a completion flag that only a {@code break}
 * of that same loop clears; the clause runs guarded by the flag after the loop.
 */
public class ControlFlowGenerator {

    private final CodegenContext context;
    private final ExprGenerator expressions;
    private final BasicStatementGenerator basic;
    private final StatementGenerator statements;

    /**
     * @param context The shared generation context.
     * @param expressions The expression generator.
     * @param basic Binds loop targets.
     * @param statements Generates nested bodies.
     */
    public ControlFlowGenerator(CodegenContext context, ExprGenerator expressions,
                                BasicStatementGenerator basic, StatementGenerator statements) {
        this.context = context;
        this.expressions = expressions;
        this.basic = basic;
        this.statements = statements;
    }

    public List<String> ifStatement(If node) {
        List<String> lines = new ArrayList<>(hoistAssignedNames(node));
        lines.add("if (" + condition(node.condition()) + ") {");
        lines.addAll(scopedBody(node.body().statements()));
        for (ElifClause elif : node.elifs()) {
            lines.add("} else if (" + condition(elif.condition()) + ") {");
            lines.addAll(scopedBody(elif.body().statements()));
        }
        if (node.orelse() != null) {
            lines.add("} else {");
            lines.addAll(scopedBody(node.orelse().statements()));
        }
        lines.add("}");
        return lines;
    }

    public List<String> whileStatement(While node) {
        List<String> lines = new ArrayList<>(hoistAssignedNames(node));
        String flag = null;
        if (node.orelse() != null) {
            flag = "_while_completed_" + context.nextId();
            lines.add("bool " + flag + " = true;");
        }
        lines.add("while (" + condition(node.condition()) + ") {");
        lines.addAll(loopBody(node.body().statements(), flag, List.of()));
        lines.add("}");
        appendElse(lines, flag, node.orelse() == null ? null : node.orelse().statements());
        return lines;
    }

    public List<String> forStatement(For node) {
        List<String> lines = new ArrayList<>(hoistAssignedNames(node));
        String flag = null;
        if (node.orelse() != null) {
            flag = "_for_completed_" + context.nextId();
            lines.add("bool " + flag + " = true;");
        }
        if (node.iterable() instanceof CallExpr call && "range".equals(call.calleeName())) {
            lines.addAll(rangeLoop(node, call, flag));
        } else {
            lines.addAll(iterableLoop(node, flag));
        }
        appendElse(lines, flag, node.orelse() == null ? null : node.orelse().statements());
        return lines;
    }

    /**
     * Lowers {@code for x in range(...)} to a counting loop over a native integer, binding {@code x} each iteration.
     * Start, stop and step are evaluated once.
     */
    private List<String> rangeLoop(For node, CallExpr range, String flag) {
        List<Expr> args = range.args();
        if (args.isEmpty() || args.size() > 3) {
            throw new CodegenException(TranspilerErrorCode.INVALID_RANGE_ARGUMENTS, "For",
                    "range() expects 1 to 3 arguments but got " + args.size(), range.sourceInfo());
        }
        int id = context.nextId();
        String index = "_range_idx_" + id;
        String stop = "_range_stop_" + id;
        String start = args.size() == 1 ? "0" : toInt(args.get(0));
        String end = toInt(args.size() == 1 ? args.get(0) : args.get(1));

        String header;
        if (args.size() < 3) {
            header = "for (int " + index + " = " + start + ", " + stop + " = " + end + "; "
                    + index + " < " + stop + "; ++" + index + ") {";
        } else {
            String step = "_range_step_" + id;
            header = "for (int " + index + " = " + start + ", " + stop + " = " + end + ", "
                    + step + " = " + toInt(args.get(2)) + "; "
                    + step + " > 0 ? " + index + " < " + stop + " : " + index + " > " + stop + "; "
                    + index + " += " + step + ") {";
        }

        List<String> prologue = new ArrayList<>();
        basic.bind(node.target(), "DynamicType(" + index + ")", prologue);

        List<String> lines = new ArrayList<>();
        lines.add(header);
        lines.addAll(loopBody(node.body().statements(), flag, prologue));
        lines.add("}");
        return lines;
    }

    /**
     * Lowers a loop over any other iterable. The list is copied into a local first so that
     * iteration never runs over a destroyed temporary.
     */
    private List<String> iterableLoop(For node, String flag) {
        int id = context.nextId();
        String temp = "_iter_temp_" + id;
        String item = "_iter_item_" + id;

        List<String> prologue = new ArrayList<>();
        basic.bind(node.target(), item, prologue);

        List<String> inner = new ArrayList<>();
        inner.add("auto " + temp + " = (" + expressions.generate(node.iterable()) + ").getList();");
        inner.add("for (const DynamicType& " + item + " : " + temp + ") {");
        inner.addAll(loopBody(node.body().statements(), flag, prologue));
        inner.add("}");

        List<String> lines = new ArrayList<>();
        lines.add("{");
        lines.addAll(context.indent(inner));
        lines.add("}");
        return lines;
    }

    public List<String> breakStatement(Break node) {
        if (!context.isInsideLoop()) {
            throw new CodegenException(TranspilerErrorCode.BREAK_OUTSIDE_LOOP, "Break",
                    "'break' outside of a loop", node.sourceInfo());
        }
        String flag = context.innermostLoop().completionFlag();
        if (flag != null) {
            return List.of(flag + " = false;", "break;");
        }
        return List.of("break;");
    }

    public List<String> continueStatement(Continue node) {
        if (!context.isInsideLoop()) {
            throw new CodegenException(TranspilerErrorCode.CONTINUE_OUTSIDE_LOOP, "Continue",
                    "'continue' outside of a loop", node.sourceInfo());
        }
        return List.of("continue;");
    }

    private void appendElse(List<String> lines, String flag, List<Stmt> orelse) {
        if (flag == null) {
            return;
        }
        lines.add("if (" + flag + ") {");
        lines.addAll(scopedBody(orelse));
        lines.add("}");
    }

    private List<String> loopBody(List<Stmt> body, String flag, List<String> prologue) {
        context.enterLoop(new CodegenContext.LoopFrame(flag));
        try {
            List<String> lines = new ArrayList<>(prologue);
            lines.addAll(scopedStatements(body));
            return context.indent(lines);
        } finally {
            context.exitLoop();
        }
    }

    private List<String> scopedBody(List<Stmt> body) {
        return context.indent(scopedStatements(body));
    }

    private List<String> scopedStatements(List<Stmt> body) {
        context.scope().push();
        try {
            return statements.generateBlock(body);
        } finally {
            context.scope().pop();
        }
    }

    private String condition(Expr expr) {
        return "(" + expressions.generate(expr) + ").toBool()";
    }

    private String toInt(Expr expr) {
        return "(" + expressions.generate(expr) + ").toInt()";
    }

    /**
     * Declares every not yet visible name that the statement assigns or uses as a loop target.
     * @return The declaration lines, in order of first appearance.
     */
    private List<String> hoistAssignedNames(Stmt stmt) {
        Set<String> names = new LinkedHashSet<>();
        collectAssignedNames(stmt, names);
        List<String> lines = new ArrayList<>();
        for (String name : names) {
            if (!context.scope().exists(name)) {
                context.scope().declare(name);
                lines.add("DynamicType " + CppReservedWords.escape(name) + " = DynamicType();");
            }
        }
        return lines;
    }

    private static void collectAssignedNames(AstNode node, Set<String> names) {
        if (node instanceof Assign assign && !assign.op().isAugmented()) {
            collectTargetNames(assign.target(), names);
        } else if (node instanceof For loop) {
            collectTargetNames(loop.target(), names);
        }
        for (AstNode child : node.getChildren()) {
            if (child instanceof Stmt) {
                collectAssignedNames(child, names);
            }
        }
    }

    private static void collectTargetNames(Expr target, Set<String> names) {
        if (target instanceof Identifier id) {
            names.add(id.name());
        } else if (target instanceof TupleExpr tuple) {
            tuple.elements().forEach(element -> collectTargetNames(element, names));
        } else if (target instanceof ListExpr list) {
            list.elements().forEach(element -> collectTargetNames(element, names));
        }
    }
}

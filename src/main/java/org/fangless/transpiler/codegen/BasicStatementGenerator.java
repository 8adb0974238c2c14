package org.fangless.transpiler.codegen;

import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.diagnostics.TranspilerLogger;
import org.fangless.transpiler.frontend.parser.ast.AssignOperator;
import org.fangless.transpiler.frontend.parser.ast.Assign;
import org.fangless.transpiler.frontend.parser.ast.Attribute;
import org.fangless.transpiler.frontend.parser.ast.BinaryOperator;
import org.fangless.transpiler.frontend.parser.ast.Expr;
import org.fangless.transpiler.frontend.parser.ast.ExprStmt;
import org.fangless.transpiler.frontend.parser.ast.Identifier;
import org.fangless.transpiler.frontend.parser.ast.Import;
import org.fangless.transpiler.frontend.parser.ast.ListExpr;
import org.fangless.transpiler.frontend.parser.ast.Pass;
import org.fangless.transpiler.frontend.parser.ast.Return;
import org.fangless.transpiler.frontend.parser.ast.SliceExpr;
import org.fangless.transpiler.frontend.parser.ast.Subscript;
import org.fangless.transpiler.frontend.parser.ast.TupleExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates the simple statements: assignment, expression statement, {@code return}, {@code pass} and {@code import}.
 * <p>
 * Assignment to a name decides between declaration and reassignment through the shared {@link ScopeManager}:
 * the first assignment in scope declares {@code DynamicType name}, later ones reassign it.
 */
public class BasicStatementGenerator {

    private final CodegenContext context;
    private final ExprGenerator expressions;

    /**
     * @param context The shared generation context.
     * @param expressions The expression generator.
     */
    public BasicStatementGenerator(CodegenContext context, ExprGenerator expressions) {
        this.context = context;
        this.expressions = expressions;
    }

    public List<String> assign(Assign node) {
        if (node.op().isAugmented()) {
            return List.of(augmentedAssign(node));
        }
        List<String> lines = new ArrayList<>();
        bind(node.target(), expressions.generate(node.value()), lines);
        return lines;
    }

    private String augmentedAssign(Assign node) {
        Expr target = node.target();
        if (target instanceof Identifier id && !context.scope().exists(id.name())) {
            throw new CodegenException(TranspilerErrorCode.UNDECLARED_AUGMENTED_TARGET, "Assign",
                    "'" + id.name() + "' is updated with '" + node.op().symbol() + "' before it is assigned",
                    node.sourceInfo());
        }
        if (!(target instanceof Identifier) && !isMemberTarget(target)) {
            throw unsupportedTarget(target);
        }
        String lhs = expressions.generate(target);
        String value = expressions.generate(node.value());
        return lhs + " = " + combine(lhs, node.op(), value) + ";";
    }

    private static String combine(String current, AssignOperator op, String value) {
        BinaryOperator operator = op.binaryOperator();
        if (operator == BinaryOperator.FLOOR_DIV) {
            return "(" + current + ").floor_div(" + value + ")";
        }
        if (operator == BinaryOperator.POW) {
            return "(" + current + ").pow(" + value + ")";
        }
        return "(" + current + ") " + operator.symbol() + " (" + value + ")";
    }

    /**
     * Assigns an already generated value to a target, declaring names on first assignment.
     * Tuple and list patterns are destructured through a temporary.
     * @param target The assignment target.
     * @param value The generated C++ value expression.
     * @param lines The lines to append to.
     */
    public void bind(Expr target, String value, List<String> lines) {
        if (target instanceof Identifier id) {
            String name = CppReservedWords.escape(id.name());
            if (context.scope().exists(id.name())) {
                lines.add(name + " = " + value + ";");
            } else {
                context.scope().declare(id.name());
                lines.add("DynamicType " + name + " = " + value + ";");
            }
        } else if (isMemberTarget(target)) {
            lines.add(expressions.generate(target) + " = " + value + ";");
        } else if (target instanceof TupleExpr || target instanceof ListExpr) {
            List<Expr> elements = target instanceof TupleExpr tuple ? tuple.elements() : ((ListExpr) target).elements();
            String temp = "_unpack_" + context.nextId();
            lines.add("DynamicType " + temp + " = " + value + ";");
            for (int i = 0; i < elements.size(); i++) {
                bind(elements.get(i), "(" + temp + ")[DynamicType(" + i + ")]", lines);
            }
        } else {
            throw unsupportedTarget(target);
        }
    }

    private static boolean isMemberTarget(Expr target) {
        return target instanceof Attribute
                || (target instanceof Subscript subscript && !(subscript.index() instanceof SliceExpr));
    }

    private static CodegenException unsupportedTarget(Expr target) {
        return new CodegenException(TranspilerErrorCode.UNSUPPORTED_ASSIGNMENT_TARGET, "Assign",
                "cannot assign to " + target.getClass().getSimpleName(), target.sourceInfo());
    }

    public List<String> expressionStatement(ExprStmt node) {
        return List.of(expressions.generate(node.value()) + ";");
    }

    public List<String> returnStatement(Return node) {
        if (!context.isInsideFunction()) {
            throw new CodegenException(TranspilerErrorCode.RETURN_OUTSIDE_FUNCTION, "Return",
                    "'return' outside of a function", node.sourceInfo());
        }
        if (node.value() == null) {
            return List.of("return DynamicType();");
        }
        return List.of("return " + expressions.generate(node.value()) + ";");
    }

    public List<String> pass(Pass node) {
        return List.of(";  // pass");
    }

    public List<String> importStatement(Import node) {
        TranspilerLogger.debug("Ignoring import of module '{}'.", node.module());
        return List.of();
    }
}

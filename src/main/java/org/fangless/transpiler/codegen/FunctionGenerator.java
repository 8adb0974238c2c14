package org.fangless.transpiler.codegen;

import org.fangless.transpiler.diagnostics.TranspilerLogger;
import org.fangless.transpiler.frontend.parser.ast.FunctionDef;
import org.fangless.transpiler.frontend.parser.ast.Identifier;
import org.fangless.transpiler.frontend.parser.ast.Return;
import org.fangless.transpiler.frontend.parser.ast.Stmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates a module-level function as a C++ function taking and returning {@code DynamicType}.
 * The body runs in a fresh child scope holding the parameters; the scope is released even if generation fails.
 */
public class FunctionGenerator {

    private final CodegenContext context;
    private final StatementGenerator statements;

    /**
     * @param context The shared generation context.
     * @param statements Generates the function body.
     */
    public FunctionGenerator(CodegenContext context, StatementGenerator statements) {
        this.context = context;
        this.statements = statements;
    }

    /**
     * @param function The function definition.
     * @return The forward declaration, e.g. {@code DynamicType _fn_add(DynamicType a, DynamicType b);}.
     */
    public String prototype(FunctionDef function) {
        return signature(function) + ";";
    }

    /**
     * @param function The function definition.
     * @return The lines of the complete function definition.
     */
    public List<String> generate(FunctionDef function) {
        TranspilerLogger.debug("Generating function '{}' with {} parameter(s).", function.name(), function.params().size());
        List<String> body;
        context.scope().push();
        context.enterFunction();
        try {
            for (Identifier param : function.params()) {
                context.scope().declare(param.name());
            }
            body = new ArrayList<>(statements.generateBlock(function.body()));
        } finally {
            context.exitFunction();
            context.scope().pop();
        }
        if (!endsWithReturn(function.body())) {
            body.add("return DynamicType();");
        }

        List<String> lines = new ArrayList<>();
        lines.add(signature(function) + " {");
        lines.addAll(context.indent(body));
        lines.add("}");
        return lines;
    }

    private String signature(FunctionDef function) {
        List<String> params = new ArrayList<>();
        for (Identifier param : function.params()) {
            params.add("DynamicType " + CppReservedWords.escape(param.name()));
        }
        return "DynamicType " + context.options().functionPrefix() + function.name()
                + "(" + String.join(", ", params) + ")";
    }

    private static boolean endsWithReturn(List<Stmt> body) {
        return !body.isEmpty() && body.get(body.size() - 1) instanceof Return;
    }
}

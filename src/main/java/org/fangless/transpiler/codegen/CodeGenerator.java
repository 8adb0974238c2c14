package org.fangless.transpiler.codegen;

import org.fangless.transpiler.diagnostics.TranspilerLogger;
import org.fangless.transpiler.frontend.parser.ast.AstNode;
import org.fangless.transpiler.frontend.parser.ast.CallExpr;
import org.fangless.transpiler.frontend.parser.ast.ComparisonExpr;
import org.fangless.transpiler.frontend.parser.ast.ComparisonOperator;
import org.fangless.transpiler.frontend.parser.ast.Expr;
import org.fangless.transpiler.frontend.parser.ast.FunctionDef;
import org.fangless.transpiler.frontend.parser.ast.Identifier;
import org.fangless.transpiler.frontend.parser.ast.If;
import org.fangless.transpiler.frontend.parser.ast.LiteralExpr;
import org.fangless.transpiler.frontend.parser.ast.Module;
import org.fangless.transpiler.frontend.parser.ast.Stmt;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link Module} into one C++ translation unit.
 * <p>
 * Function definitions are emitted at file scope, after the runtime preamble and a block of forward
 * declarations. All other top-level statements form the body of {@code int main()}, in source order.
 * A top-level {@code if __name__ == "__main__":} guard is replaced by its body. If a function named
 * {@code main} is defined but never called from the top level, a call to it is appended.
 * <p>
 * One {@link ScopeManager} is shared by all generators and reset on every call to {@link #generate(Module)}.
 */
public class CodeGenerator {

    private final CodegenOptions options;
    private final CodegenContext context;
    private final StatementGenerator statements;
    private final FunctionGenerator functions;

    /**
     * Creates a generator with the default options.
     */
    public CodeGenerator() {
        this(CodegenOptions.defaults());
    }

    /**
     * @param options The code generation options.
     */
    public CodeGenerator(CodegenOptions options) {
        this(options, new ScopeManager());
    }

    /**
     * @param options The code generation options.
     * @param scope The scope tracker to share between the generators.
     */
    public CodeGenerator(CodegenOptions options, ScopeManager scope) {
        this.options = options;
        this.context = new CodegenContext(scope, options);
        ExprGenerator expressions = new ExprGenerator(context);
        this.statements = new StatementGenerator(context, expressions);
        this.functions = new FunctionGenerator(context, statements);
    }

    /**
     * Generates the translation unit.
     * @param module The parsed program.
     * @return The C++ source, ending with a newline.
     * @throws CodegenException if the program contains a construct that cannot be lowered.
     */
    public String generate(Module module) {
        context.reset();

        List<FunctionDef> functionDefs = new ArrayList<>();
        List<Stmt> topLevel = new ArrayList<>();
        for (Stmt stmt : module.body()) {
            if (stmt instanceof FunctionDef function) {
                functionDefs.add(function);
            } else if (stmt instanceof If guard && isMainGuard(guard)) {
                topLevel.addAll(guard.body().statements());
            } else {
                topLevel.add(stmt);
            }
        }
        TranspilerLogger.debug("Generating {} function(s) and {} top-level statement(s).",
                functionDefs.size(), topLevel.size());

        List<String> lines = new ArrayList<>(preamble());

        if (!functionDefs.isEmpty()) {
            for (FunctionDef function : functionDefs) {
                lines.add(functions.prototype(function));
            }
            lines.add("");
            for (FunctionDef function : functionDefs) {
                lines.addAll(functions.generate(function));
                lines.add("");
            }
        }

        lines.add("int main() {");
        List<String> body = new ArrayList<>();
        context.scope().push();
        try {
            body.addAll(statements.generateBlock(topLevel));
        } finally {
            context.scope().pop();
        }
        if (options.synthesizeMainCall() && definesMain(functionDefs) && !callsMain(topLevel)) {
            TranspilerLogger.debug("Appending call to main().");
            body.add(options.functionPrefix() + "main();");
        }
        body.add("return 0;");
        lines.addAll(context.indent(body));
        lines.add("}");

        return String.join("\n", lines) + "\n";
    }

    private List<String> preamble() {
        List<String> lines = new ArrayList<>();
        for (String include : options.runtimeIncludes()) {
            if (include.startsWith("<")) {
                lines.add("#include " + include);
            } else {
                lines.add("#include \"" + include + "\"");
            }
        }
        lines.add("using namespace std;");
        lines.add("");
        return lines;
    }

    /**
     * @return {@code true} for {@code if __name__ == "__main__":} (either operand order) without {@code elif}/{@code else}.
     */
    static boolean isMainGuard(If node) {
        if (!node.elifs().isEmpty() || node.orelse() != null) {
            return false;
        }
        if (!(node.condition() instanceof ComparisonExpr comparison) || comparison.op() != ComparisonOperator.EQ) {
            return false;
        }
        return (isNameDunder(comparison.left()) && isMainLiteral(comparison.right()))
                || (isMainLiteral(comparison.left()) && isNameDunder(comparison.right()));
    }

    private static boolean isNameDunder(Expr expr) {
        return expr instanceof Identifier id && "__name__".equals(id.name());
    }

    private static boolean isMainLiteral(Expr expr) {
        return expr instanceof LiteralExpr literal && "__main__".equals(literal.value());
    }

    private static boolean definesMain(List<FunctionDef> functionDefs) {
        for (FunctionDef function : functionDefs) {
            if ("main".equals(function.name())) {
                return true;
            }
        }
        return false;
    }

    private static boolean callsMain(List<Stmt> topLevel) {
        for (Stmt stmt : topLevel) {
            if (containsMainCall(stmt)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsMainCall(AstNode node) {
        if (node instanceof CallExpr call && "main".equals(call.calleeName())) {
            return true;
        }
        for (AstNode child : node.getChildren()) {
            if (containsMainCall(child)) {
                return true;
            }
        }
        return false;
    }
}

package org.fangless.transpiler.codegen;

import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.diagnostics.TranspilerLogger;
import org.fangless.transpiler.frontend.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts expression nodes into C++ expressions over the runtime value type {@code DynamicType}.
 * <p>
 * Every literal and every intermediate result is a {@code DynamicType}. Operators map onto the
 * overloaded operators of the runtime type; power and floor division become runtime calls.
 * Collection literals are delegated to the {@link DataStructureGenerator}.
 */
public class ExprGenerator implements ExprVisitor<String> {

    private static final String MAIN_MODULE_NAME = "__main__";

    private final CodegenContext context;
    private final BuiltinFunctionTable builtins;
    private final MethodCallRegistry methods;
    private final DataStructureGenerator dataStructures;

    /**
     * Creates an expression generator with the default builtin and method tables.
     * @param context The shared generation context.
     */
    public ExprGenerator(CodegenContext context) {
        this(context, BuiltinFunctionTable.initializeWithDefaults(), MethodCallRegistry.initializeWithDefaults());
    }

    /**
     * Creates an expression generator with explicit builtin and method tables.
     * @param context The shared generation context.
     * @param builtins The builtin function table.
     * @param methods The method call registry.
     */
    public ExprGenerator(CodegenContext context, BuiltinFunctionTable builtins, MethodCallRegistry methods) {
        this.context = context;
        this.builtins = builtins;
        this.methods = methods;
        this.dataStructures = new DataStructureGenerator(this, context.options());
    }

    /**
     * @param expr The expression.
     * @return The C++ expression.
     */
    public String generate(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitLiteral(LiteralExpr node) {
        Object value = node.value();
        switch (node.kind()) {
            case NONE:
                return "DynamicType()";
            case BOOL:
                return "DynamicType(" + value + ")";
            case INT:
                return intLiteral((Long) value);
            case FLOAT:
                double d = (Double) value;
                if (Double.isInfinite(d)) {
                    return d > 0 ? "DynamicType(HUGE_VAL)" : "DynamicType(-HUGE_VAL)";
                }
                return "DynamicType(" + Double.toString(d) + ")";
            default:
                return stringLiteral((String) value);
        }
    }

    private static String intLiteral(long number) {
        if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            TranspilerLogger.warn("Integer literal {} exceeds the runtime integer range; emitting it as a float.", number);
            return "DynamicType(" + (double) number + ")";
        }
        if (number == Integer.MIN_VALUE) {
            // -2147483648 is a negated long in C++
            return "DynamicType(" + (Integer.MIN_VALUE + 1) + " - 1)";
        }
        return "DynamicType(" + number + ")";
    }

    /**
     * @param text The string content.
     * @return The wrapped, escaped C++ string literal.
     */
    public static String stringLiteral(String text) {
        return "DynamicType(std::string(\"" + escape(text) + "\"))";
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\%03o", (int) c));
                    } else {
                        sb.append(c);
                    }
                    break;
            }
        }
        return sb.toString();
    }

    @Override
    public String visitIdentifier(Identifier node) {
        if ("__name__".equals(node.name())) {
            return stringLiteral(MAIN_MODULE_NAME);
        }
        if (!context.scope().exists(node.name())) {
            TranspilerLogger.debug("Identifier '{}' is read before any assignment in scope.", node.name());
        }
        return CppReservedWords.escape(node.name());
    }

    @Override
    public String visitUnary(UnaryExpr node) {
        if (node.op() == UnaryExpr.Op.NEG
                && node.operand() instanceof LiteralExpr literal && literal.kind() == LiteralExpr.Kind.INT) {
            // Folded before the range check so that the most negative int stays an int.
            return intLiteral(-((Long) literal.value()));
        }
        String operand = generate(node.operand());
        if (node.op() == UnaryExpr.Op.NEG) {
            return "(DynamicType(0) - (" + operand + "))";
        }
        return "DynamicType(!((" + operand + ").toBool()))";
    }

    @Override
    public String visitBinary(BinaryExpr node) {
        String left = generate(node.left());
        String right = generate(node.right());
        switch (node.op()) {
            case POW:
                return "DynamicType(std::pow((" + left + ").toDouble(), (" + right + ").toDouble()))";
            case FLOOR_DIV:
                return "(" + left + ").floor_div(" + right + ")";
            case AND:
                return "DynamicType((" + left + ").toBool() && (" + right + ").toBool())";
            case OR:
                return "DynamicType((" + left + ").toBool() || (" + right + ").toBool())";
            default:
                return "((" + left + ") " + node.op().symbol() + " (" + right + "))";
        }
    }

    @Override
    public String visitComparison(ComparisonExpr node) {
        String left = generate(node.left());
        String right = generate(node.right());
        switch (node.op()) {
            case IN:
                return "DynamicType((" + right + ").contains(" + left + "))";
            case NOT_IN:
                return "DynamicType(!((" + right + ").contains(" + left + ")))";
            case IS:
                return "DynamicType((" + left + ") == (" + right + "))";
            case IS_NOT:
                return "DynamicType((" + left + ") != (" + right + "))";
            default:
                return "DynamicType((" + left + ") " + node.op().symbol() + " (" + right + "))";
        }
    }

    @Override
    public String visitCall(CallExpr node) {
        if (node.callee() instanceof Identifier id) {
            return builtins.get(id.name())
                    .map(builtin -> builtin.runtimeName() + "(" + arguments(node.args(), builtin.conversion()) + ")")
                    .orElseGet(() -> context.options().functionPrefix() + id.name()
                            + "(" + arguments(node.args(), BuiltinFunctionTable.ArgumentConversion.NONE) + ")");
        }
        if (node.callee() instanceof Attribute attribute) {
            String receiver = generate(attribute.value());
            List<String> args = new ArrayList<>();
            for (Expr arg : node.args()) {
                args.add(generate(arg));
            }
            return methods.lower(receiver, attribute.attr(), args);
        }
        throw new CodegenException(TranspilerErrorCode.UNSUPPORTED_CALL_TARGET, "CallExpr",
                "callee of kind " + node.callee().getClass().getSimpleName() + " cannot be called", node.sourceInfo());
    }

    private String arguments(List<Expr> args, BuiltinFunctionTable.ArgumentConversion conversion) {
        List<String> generated = new ArrayList<>(args.size());
        for (Expr arg : args) {
            generated.add(conversion.apply(generate(arg)));
        }
        return String.join(", ", generated);
    }

    @Override
    public String visitList(ListExpr node) {
        return dataStructures.generateList(node);
    }

    @Override
    public String visitTuple(TupleExpr node) {
        return dataStructures.generateTuple(node);
    }

    @Override
    public String visitSet(SetExpr node) {
        return dataStructures.generateSet(node);
    }

    @Override
    public String visitDict(DictExpr node) {
        return dataStructures.generateDict(node);
    }

    @Override
    public String visitSubscript(Subscript node) {
        String value = generate(node.value());
        if (node.index() instanceof SliceExpr slice) {
            return slice(value, slice);
        }
        return "(" + value + ")[" + generate(node.index()) + "]";
    }

    private String slice(String value, SliceExpr slice) {
        if (slice.isFullCopy()) {
            return value;
        }
        String start = slice.lower() == null ? "DynamicType(0)" : generate(slice.lower());
        String stop = slice.upper() == null ? "len(" + value + ")" : generate(slice.upper());
        if (slice.step() == null || isUnitStep(slice.step())) {
            return "(" + value + ").sublist(" + start + ", " + stop + ")";
        }
        return "(" + value + ").sublist(" + start + ", " + stop + ", " + generate(slice.step()) + ")";
    }

    private static boolean isUnitStep(Expr step) {
        return step instanceof LiteralExpr literal && Long.valueOf(1L).equals(literal.value());
    }

    @Override
    public String visitAttribute(Attribute node) {
        return "(" + generate(node.value()) + ")." + node.attr();
    }

    @Override
    public String visitSlice(SliceExpr node) {
        throw new CodegenException(TranspilerErrorCode.UNSUPPORTED_NODE, "SliceExpr",
                "a slice is only valid as a subscript index", node.sourceInfo());
    }
}

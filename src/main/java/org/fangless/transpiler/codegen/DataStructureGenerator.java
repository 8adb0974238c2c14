package org.fangless.transpiler.codegen;

import org.fangless.transpiler.frontend.parser.ast.DictEntry;
import org.fangless.transpiler.frontend.parser.ast.DictExpr;
import org.fangless.transpiler.frontend.parser.ast.Expr;
import org.fangless.transpiler.frontend.parser.ast.ListExpr;
import org.fangless.transpiler.frontend.parser.ast.SetExpr;
import org.fangless.transpiler.frontend.parser.ast.TupleExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the runtime container for list, tuple, set and dict literals.
 * Tuples become lists. Dict keys are converted to strings because the runtime map is keyed by string.
 * Up to {@value #INLINE_LIMIT} elements are written on one line, longer literals one element per line.
 */
public class DataStructureGenerator {

    static final int INLINE_LIMIT = 3;

    private static final String LIST_TYPE = "std::vector<DynamicType>";
    private static final String SET_TYPE = "std::unordered_set<DynamicType>";
    private static final String DICT_TYPE = "std::map<std::string, DynamicType>";

    private final ExprGenerator expressions;
    private final CodegenOptions options;

    /**
     * @param expressions Generates the element expressions.
     * @param options Supplies the indentation unit for multi-line literals.
     */
    public DataStructureGenerator(ExprGenerator expressions, CodegenOptions options) {
        this.expressions = expressions;
        this.options = options;
    }

    public String generateList(ListExpr node) {
        return container(LIST_TYPE, elements(node.elements()));
    }

    public String generateTuple(TupleExpr node) {
        return container(LIST_TYPE, elements(node.elements()));
    }

    public String generateSet(SetExpr node) {
        return container(SET_TYPE, elements(node.elements()));
    }

    public String generateDict(DictExpr node) {
        List<String> pairs = new ArrayList<>(node.pairs().size());
        for (DictEntry pair : node.pairs()) {
            String key = expressions.generate(pair.key());
            String value = expressions.generate(pair.value());
            pairs.add("{(" + key + ").toString(), " + value + "}");
        }
        return container(DICT_TYPE, pairs);
    }

    private List<String> elements(List<Expr> exprs) {
        List<String> generated = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            generated.add(expressions.generate(expr));
        }
        return generated;
    }

    private String container(String type, List<String> items) {
        if (items.size() <= INLINE_LIMIT) {
            return "DynamicType(" + type + "{" + String.join(", ", items) + "})";
        }
        StringBuilder sb = new StringBuilder("DynamicType(").append(type).append("{\n");
        for (int i = 0; i < items.size(); i++) {
            String item = items.get(i).replace("\n", "\n" + options.indent());
            sb.append(options.indent()).append(item);
            sb.append(i < items.size() - 1 ? ",\n" : "\n");
        }
        return sb.append("})").toString();
    }
}

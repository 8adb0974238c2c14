package org.fangless.transpiler.codegen;

import org.fangless.transpiler.frontend.parser.ast.DictEntry;
import org.fangless.transpiler.frontend.parser.ast.DictExpr;
import org.fangless.transpiler.frontend.parser.ast.Expr;
import org.fangless.transpiler.frontend.parser.ast.ListExpr;
import org.fangless.transpiler.frontend.parser.ast.LiteralExpr;
import org.fangless.transpiler.frontend.parser.ast.SetExpr;
import org.fangless.transpiler.frontend.parser.ast.TupleExpr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DataStructureGenerator}, reached through the {@link ExprGenerator}.
 */
public class DataStructureGeneratorTest {

    private ExprGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new ExprGenerator(new CodegenContext(new ScopeManager(), CodegenOptions.defaults()));
    }

    /**
     * Verifies that lists and tuples share the vector representation.
     */
    @Test
    @Tag("unit")
    void testListAndTuple() {
        // Arrange
        List<Expr> items = List.of(LiteralExpr.ofInt(1), LiteralExpr.ofInt(2));

        // Act
        String list = generator.generate(new ListExpr(items));
        String tuple = generator.generate(new TupleExpr(items));

        // Assert
        assertThat(list).isEqualTo("DynamicType(std::vector<DynamicType>{DynamicType(1), DynamicType(2)})");
        assertThat(tuple).isEqualTo(list);
        assertThat(generator.generate(new ListExpr(List.of()))).isEqualTo("DynamicType(std::vector<DynamicType>{})");
    }

    /**
     * Verifies the set representation.
     */
    @Test
    @Tag("unit")
    void testSet() {
        // Act
        String code = generator.generate(new SetExpr(List.of(LiteralExpr.ofInt(7))));

        // Assert
        assertThat(code).isEqualTo("DynamicType(std::unordered_set<DynamicType>{DynamicType(7)})");
    }

    /**
     * Verifies that dictionary keys are converted to strings.
     */
    @Test
    @Tag("unit")
    void testDictKeysAreStringified() {
        // Act
        String code = generator.generate(new DictExpr(List.of(
                new DictEntry(LiteralExpr.ofString("a"), LiteralExpr.ofInt(1)))));

        // Assert
        assertThat(code).isEqualTo(
                "DynamicType(std::map<std::string, DynamicType>{{(DynamicType(std::string(\"a\"))).toString(), DynamicType(1)}})");
    }

    /**
     * Verifies that collections with more than three items are laid out one item per line.
     */
    @Test
    @Tag("unit")
    void testLongCollectionsAreMultiLine() {
        // Act
        String code = generator.generate(new ListExpr(List.of(
                LiteralExpr.ofInt(1), LiteralExpr.ofInt(2), LiteralExpr.ofInt(3), LiteralExpr.ofInt(4))));

        // Assert
        assertThat(code).isEqualTo(String.join("\n",
                "DynamicType(std::vector<DynamicType>{",
                "    DynamicType(1),",
                "    DynamicType(2),",
                "    DynamicType(3),",
                "    DynamicType(4)",
                "})"));
    }
}

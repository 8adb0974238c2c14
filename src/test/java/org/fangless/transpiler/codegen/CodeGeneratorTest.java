package org.fangless.transpiler.codegen;

import org.fangless.transpiler.api.TranspilerErrorCode;
import org.fangless.transpiler.diagnostics.DiagnosticsEngine;
import org.fangless.transpiler.frontend.lexer.Lexer;
import org.fangless.transpiler.frontend.parser.Parser;
import org.fangless.transpiler.frontend.parser.ast.Module;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link CodeGenerator}, which assembles the complete C++ translation unit.
 */
public class CodeGeneratorTest {

    private static Module parse(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        return new Parser(new Lexer(source, diagnostics).scanTokens(), diagnostics).parse();
    }

    private static List<String> lines(String code) {
        return Arrays.asList(code.split("\n", -1));
    }

    private static long count(List<String> lines, String line) {
        return lines.stream().filter(line::equals).count();
    }

    /**
     * Verifies the complete output for a recursive function called from top-level code.
     */
    @Test
    @Tag("unit")
    void testCompleteTranslationUnit() {
        // Arrange
        String source = String.join("\n",
                "def fib(n):",
                "    if n <= 1:",
                "        return n",
                "    return fib(n - 1) + fib(n - 2)",
                "",
                "print(fib(10))",
                "");

        // Act
        String code = new CodeGenerator().generate(parse(source));

        // Assert
        assertThat(code).isEqualTo(String.join("\n",
                "#include <iostream>",
                "#include <string>",
                "#include <cmath>",
                "#include \"dynamic_type.hpp\"",
                "#include \"builtins.hpp\"",
                "using namespace std;",
                "",
                "DynamicType _fn_fib(DynamicType n);",
                "",
                "DynamicType _fn_fib(DynamicType n) {",
                "    if ((DynamicType((n) <= (DynamicType(1)))).toBool()) {",
                "        return n;",
                "    }",
                "    return ((_fn_fib(((n) - (DynamicType(1))))) + (_fn_fib(((n) - (DynamicType(2))))));",
                "}",
                "",
                "int main() {",
                "    print(_fn_fib(DynamicType(10)));",
                "    return 0;",
                "}",
                ""));
    }

    /**
     * Verifies that a top-level name is declared once however often it is reassigned.
     */
    @Test
    @Tag("unit")
    void testTopLevelDeclarationOnce() {
        // Act
        List<String> out = lines(new CodeGenerator().generate(parse("x = 1\nx = 'a'\nx = True\nprint(x)\n")));

        // Assert
        assertThat(out.stream().filter(l -> l.contains("DynamicType x =")).count()).isEqualTo(1);
        assertThat(out.stream().filter(l -> l.startsWith("    x = ")).count()).isEqualTo(2);
    }

    /**
     * Verifies that locals of one function are invisible to the next function and to top-level code.
     */
    @Test
    @Tag("unit")
    void testFunctionScopesAreIsolated() {
        // Arrange
        String source = String.join("\n",
                "def f():",
                "    y = 1",
                "    return y",
                "def g():",
                "    y = 2",
                "    return y",
                "y = 3",
                "");

        // Act
        List<String> out = lines(new CodeGenerator().generate(parse(source)));

        // Assert
        assertThat(out).contains(
                "    DynamicType y = DynamicType(1);",
                "    DynamicType y = DynamicType(2);",
                "    DynamicType y = DynamicType(3);");
    }

    /**
     * Verifies that functions are prototyped before any definition, so they may call each other.
     */
    @Test
    @Tag("unit")
    void testPrototypesPrecedeDefinitions() {
        // Arrange
        String source = "def even(n):\n    return odd(n)\ndef odd(n):\n    return even(n)\n";

        // Act
        List<String> out = lines(new CodeGenerator().generate(parse(source)));

        // Assert
        int evenPrototype = out.indexOf("DynamicType _fn_even(DynamicType n);");
        int oddPrototype = out.indexOf("DynamicType _fn_odd(DynamicType n);");
        int evenDefinition = out.indexOf("DynamicType _fn_even(DynamicType n) {");
        assertThat(evenPrototype).isNotNegative();
        assertThat(oddPrototype).isEqualTo(evenPrototype + 1);
        assertThat(evenDefinition).isGreaterThan(oddPrototype);
    }

    /**
     * Verifies that a defined but uncalled main() is called from the entry point.
     */
    @Test
    @Tag("unit")
    void testMainCallIsSynthesized() {
        // Act
        List<String> out = lines(new CodeGenerator().generate(parse("def main():\n    print(1)\n")));

        // Assert
        int call = out.indexOf("    _fn_main();");
        assertThat(call).isPositive();
        assertThat(out.get(call + 1)).isEqualTo("    return 0;");
    }

    /**
     * Verifies that the main guard is replaced by its body and that main() is not called twice.
     */
    @Test
    @Tag("unit")
    void testMainGuardIsElided() {
        // Arrange
        String source = "def main():\n    pass\n\nif __name__ == '__main__':\n    main()\n";

        // Act
        List<String> out = lines(new CodeGenerator().generate(parse(source)));

        // Assert
        assertThat(count(out, "    _fn_main();")).isEqualTo(1);
        assertThat(out).noneMatch(l -> l.contains("__main__"));
    }

    /**
     * Verifies that a guard with an else branch is kept as an ordinary if statement.
     */
    @Test
    @Tag("unit")
    void testGuardWithElseIsKept() {
        // Arrange
        String source = "if '__main__' == __name__:\n    a = 1\nelse:\n    a = 2\n";

        // Act
        String code = new CodeGenerator().generate(parse(source));

        // Assert
        assertThat(code).contains("} else {").contains("std::string(\"__main__\")");
    }

    /**
     * Verifies that the options control the preamble, the function prefix and main() synthesis.
     */
    @Test
    @Tag("unit")
    void testCustomOptions() {
        // Arrange
        CodegenOptions options = new CodegenOptions("  ", "py_", List.of("runtime.hpp"), false);

        // Act
        String code = new CodeGenerator(options).generate(parse("def main():\n    pass\n"));

        // Assert
        assertThat(code).startsWith("#include \"runtime.hpp\"\nusing namespace std;\n");
        assertThat(code).contains("DynamicType py_main() {\n  ;  // pass\n  return DynamicType();\n}");
        assertThat(code).doesNotContain("py_main();\n  return 0;");
    }

    /**
     * Verifies that the generator starts fresh for every module.
     */
    @Test
    @Tag("unit")
    void testGeneratorIsReusable() {
        // Arrange
        CodeGenerator generator = new CodeGenerator();
        Module module = parse("a, b = 1, 2\nfor v in [a, b]:\n    print(v)\n");

        // Act
        String first = generator.generate(module);
        String second = generator.generate(module);

        // Assert
        assertThat(second).isEqualTo(first);
        assertThat(second).contains("_unpack_0").contains("_iter_temp_1");
    }

    /**
     * Verifies that generation errors carry their code and position.
     */
    @Test
    @Tag("unit")
    void testErrorsCarryPosition() {
        // Arrange
        Module module = parse("x = 1\nbreak\n");

        // Act & Assert
        assertThatThrownBy(() -> new CodeGenerator().generate(module))
                .isInstanceOf(CodegenException.class)
                .hasMessage("Break: 'break' outside of a loop at <memory>:2:1")
                .satisfies(e -> assertThat(((CodegenException) e).getCode())
                        .isEqualTo(TranspilerErrorCode.BREAK_OUTSIDE_LOOP));
    }
}

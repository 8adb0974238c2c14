package org.fangless.transpiler.codegen;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link BuiltinFunctionTable} and the {@link MethodCallRegistry}.
 */
public class BuiltinFunctionTableTest {

    /**
     * Verifies the runtime names and argument conversions of the default builtins.
     */
    @Test
    @Tag("unit")
    void testDefaultBuiltins() {
        // Arrange
        BuiltinFunctionTable table = BuiltinFunctionTable.initializeWithDefaults();

        // Assert
        assertThat(table.get("float")).get().extracting(BuiltinFunctionTable.Builtin::runtimeName).isEqualTo("float_");
        assertThat(table.get("input")).get()
                .extracting(BuiltinFunctionTable.Builtin::conversion)
                .isEqualTo(BuiltinFunctionTable.ArgumentConversion.TO_STRING);
        assertThat(table.isBuiltin("fib")).isFalse();
        assertThat(BuiltinFunctionTable.initialize().isBuiltin("print")).isFalse();
    }

    /**
     * Verifies argument conversion wrapping.
     */
    @Test
    @Tag("unit")
    void testArgumentConversion() {
        // Assert
        assertThat(BuiltinFunctionTable.ArgumentConversion.TO_INT.apply("n")).isEqualTo("(n).toInt()");
        assertThat(BuiltinFunctionTable.ArgumentConversion.NONE.apply("n")).isEqualTo("n");
    }

    /**
     * Verifies renamed methods and a custom registration.
     */
    @Test
    @Tag("unit")
    void testMethodRegistry() {
        // Arrange
        MethodCallRegistry registry = MethodCallRegistry.initializeWithDefaults();
        registry.register("clear", (receiver, args) -> receiver + " = DynamicType(std::vector<DynamicType>{})");

        // Assert
        assertThat(registry.lower("s", "discard", List.of("x"))).isEqualTo("(s).remove(x)");
        assertThat(registry.lower("xs", "slice", List.of("a", "b"))).isEqualTo("(xs).sublist(a, b)");
        assertThat(registry.lower("xs", "clear", List.of())).isEqualTo("xs = DynamicType(std::vector<DynamicType>{})");
        assertThat(registry.isRegistered("append")).isTrue();
        assertThat(registry.isRegistered("upper")).isFalse();
    }
}

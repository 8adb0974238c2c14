package org.fangless.transpiler.codegen;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps builtin function names of the source language to the free functions of the C++ runtime.
 * Runtime names avoid C++ keywords ({@code int_}, {@code float_}, {@code bool_}) and standard library symbols ({@code set_}).
 */
public final class BuiltinFunctionTable {

    /**
     * How each argument is converted before being passed to the runtime function.
     */
    public enum ArgumentConversion {
        /** Arguments are passed as runtime values. */
        NONE(null),
        /** Arguments are narrowed to native integers. */
        TO_INT("toInt"),
        /** Arguments are converted to native strings. */
        TO_STRING("toString");

        private final String accessor;

        ArgumentConversion(String accessor) {
            this.accessor = accessor;
        }

        /**
         * @param argument The generated argument expression.
         * @return The argument with the conversion applied.
         */
        public String apply(String argument) {
            return accessor == null ? argument : "(" + argument + ")." + accessor + "()";
        }
    }

    /**
     * A runtime function bound to a builtin name.
     *
     * @param runtimeName The C++ function name.
     * @param conversion The conversion applied to each argument.
     */
    public record Builtin(String runtimeName, ArgumentConversion conversion) {}

    private final Map<String, Builtin> builtins = new HashMap<>();

    private BuiltinFunctionTable() {}

    /**
     * Registers or replaces a builtin.
     * @param sourceName The name used in source programs.
     * @param runtimeName The C++ function name.
     * @param conversion The argument conversion.
     */
    public void register(String sourceName, String runtimeName, ArgumentConversion conversion) {
        builtins.put(sourceName, new Builtin(runtimeName, conversion));
    }

    /**
     * @param sourceName A callee name.
     * @return The runtime binding, if the name is a builtin.
     */
    public Optional<Builtin> get(String sourceName) {
        return Optional.ofNullable(builtins.get(sourceName));
    }

    /**
     * @param sourceName A callee name.
     * @return {@code true} if the name is a builtin.
     */
    public boolean isBuiltin(String sourceName) {
        return builtins.containsKey(sourceName);
    }

    /**
     * @return An empty table.
     */
    public static BuiltinFunctionTable initialize() {
        return new BuiltinFunctionTable();
    }

    /**
     * @return A table holding every builtin the runtime library provides.
     */
    public static BuiltinFunctionTable initializeWithDefaults() {
        BuiltinFunctionTable table = initialize();
        table.register("print", "print", ArgumentConversion.NONE);
        table.register("len", "len", ArgumentConversion.NONE);
        table.register("range", "range", ArgumentConversion.TO_INT);
        table.register("str", "str", ArgumentConversion.NONE);
        table.register("int", "int_", ArgumentConversion.NONE);
        table.register("float", "float_", ArgumentConversion.NONE);
        table.register("bool", "bool_", ArgumentConversion.NONE);
        table.register("abs", "abs", ArgumentConversion.NONE);
        table.register("min", "min", ArgumentConversion.NONE);
        table.register("max", "max", ArgumentConversion.NONE);
        table.register("sum", "sum", ArgumentConversion.NONE);
        table.register("type", "type", ArgumentConversion.NONE);
        table.register("input", "input", ArgumentConversion.TO_STRING);
        table.register("set", "set_", ArgumentConversion.NONE);
        return table;
    }
}

package org.fangless.transpiler.codegen;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers {@code obj.method(args)} calls onto the member functions of the runtime value type.
 * Methods without a registered lowering are emitted verbatim as {@code (obj).method(args)}.
 */
public final class MethodCallRegistry {

    /**
     * Produces the C++ call for one method.
     */
    @FunctionalInterface
    public interface MethodLowering {
        /**
         * @param receiver The generated receiver expression.
         * @param args The generated argument expressions.
         * @return The C++ call expression.
         */
        String lower(String receiver, List<String> args);
    }

    private final Map<String, MethodLowering> lowerings = new HashMap<>();

    private MethodCallRegistry() {}

    /**
     * Registers or replaces the lowering of a method.
     * @param methodName The method name used in source programs.
     * @param lowering The lowering.
     */
    public void register(String methodName, MethodLowering lowering) {
        lowerings.put(methodName, lowering);
    }

    /**
     * Lowers a method call, falling back to a verbatim member call.
     * @param receiver The generated receiver expression.
     * @param methodName The method name.
     * @param args The generated argument expressions.
     * @return The C++ call expression.
     */
    public String lower(String receiver, String methodName, List<String> args) {
        MethodLowering lowering = lowerings.get(methodName);
        if (lowering != null) {
            return lowering.lower(receiver, args);
        }
        return member(receiver, methodName, args);
    }

    /**
     * @param methodName A method name.
     * @return {@code true} if the method has a registered lowering.
     */
    public boolean isRegistered(String methodName) {
        return lowerings.containsKey(methodName);
    }

    private static String member(String receiver, String name, List<String> args) {
        return "(" + receiver + ")." + name + "(" + String.join(", ", args) + ")";
    }

    private static MethodLowering renamed(String runtimeName) {
        return (receiver, args) -> member(receiver, runtimeName, args);
    }

    /**
     * @return An empty registry.
     */
    public static MethodCallRegistry initialize() {
        return new MethodCallRegistry();
    }

    /**
     * @return A registry holding the lowerings of the list, set and dict methods the runtime supports.
     */
    public static MethodCallRegistry initializeWithDefaults() {
        MethodCallRegistry registry = initialize();
        registry.register("append", renamed("append"));
        registry.register("add", renamed("add"));
        registry.register("remove", renamed("remove"));
        registry.register("discard", renamed("remove"));
        registry.register("get", renamed("get"));
        registry.register("pop", (receiver, args) -> args.isEmpty()
                ? member(receiver, "removeAt", List.of("DynamicType(-1)"))
                : member(receiver, "removeKey", args.subList(0, 1)));
        registry.register("sublist", renamed("sublist"));
        registry.register("slice", renamed("sublist"));
        return registry;
    }
}

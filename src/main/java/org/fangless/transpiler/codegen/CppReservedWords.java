package org.fangless.transpiler.codegen;

import java.util.Set;

/**
 * Keeps source identifiers from colliding with C++ keywords and with the names the generated code relies on.
 */
public final class CppReservedWords {

    private static final Set<String> RESERVED = Set.of(
            "alignas", "alignof", "asm", "auto", "bool", "case", "catch", "char", "char16_t", "char32_t",
            "class", "const", "constexpr", "const_cast", "decltype", "default", "delete", "do", "double",
            "dynamic_cast", "enum", "explicit", "export", "extern", "float", "friend", "goto", "inline",
            "int", "long", "mutable", "namespace", "new", "noexcept", "nullptr", "operator", "private",
            "protected", "public", "register", "reinterpret_cast", "short", "signed", "sizeof", "static",
            "static_assert", "static_cast", "struct", "switch", "template", "this", "thread_local", "throw",
            "try", "typedef", "typeid", "typename", "union", "unsigned", "using", "virtual", "void",
            "volatile", "wchar_t", "std", "main", "DynamicType");

    private CppReservedWords() {}

    /**
     * @param name A source identifier.
     * @return The identifier to emit: the name itself, or the name with a trailing {@code _} if it is reserved.
     */
    public static String escape(String name) {
        return RESERVED.contains(name) ? name + "_" : name;
    }
}

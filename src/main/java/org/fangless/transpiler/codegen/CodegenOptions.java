package org.fangless.transpiler.codegen;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

/**
 * Settings that shape the emitted C++ without changing its meaning.
 *
 * @param indent The indentation unit for one nesting level.
 * @param functionPrefix The prefix given to user-defined function names.
 * @param runtimeIncludes The {@code #include} targets of the preamble, in order. Entries in angle brackets are emitted verbatim.
 * @param synthesizeMainCall Whether to call a defined but never-called {@code main} function from the entry point.
 */
public record CodegenOptions(String indent, String functionPrefix, List<String> runtimeIncludes, boolean synthesizeMainCall) {

    public CodegenOptions {
        runtimeIncludes = List.copyOf(runtimeIncludes);
    }

    /**
     * @return The options from the bundled {@code reference.conf}.
     */
    public static CodegenOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the options from the {@code fangless.codegen} block of a configuration.
     * @param config The root configuration.
     * @return The options.
     */
    public static CodegenOptions fromConfig(Config config) {
        Config codegen = config.getConfig("fangless.codegen");
        return new CodegenOptions(
                codegen.getString("indent"),
                codegen.getString("function-prefix"),
                codegen.getStringList("runtime-includes"),
                codegen.getBoolean("synthesize-main-call"));
    }
}

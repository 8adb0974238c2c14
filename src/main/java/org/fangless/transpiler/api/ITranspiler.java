package org.fangless.transpiler.api;

import org.fangless.transpiler.frontend.parser.ast.Module;

import java.util.List;

/**
 * Defines the public interface for the Fangless transpiler.
 */
public interface ITranspiler {

    /**
     * Transpiles the given source code into a single C++ translation unit.
     *
     * @param sourceLines A list of strings representing the lines of the source program.
     * @param programName A name for the program, used in diagnostics.
     * @return The generated C++ source code.
     * @throws TranspilationException if errors occur during the transpilation process.
     */
    String transpile(List<String> sourceLines, String programName) throws TranspilationException;

    /**
     * Runs only the front end (lexing and parsing) and returns the syntax tree.
     *
     * @param sourceLines A list of strings representing the lines of the source program.
     * @param programName A name for the program, used in diagnostics.
     * @return The parsed {@link Module}.
     * @throws TranspilationException if the source contains lexical or syntax errors.
     */
    Module parse(List<String> sourceLines, String programName) throws TranspilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=trace).
     */
    void setVerbosity(int level);

    /**
     * Transpiles the source code from a file.
     * @param programPath The path to the source file.
     * @return The generated C++ source code.
     * @throws TranspilationException if errors occur during transpilation.
     * @throws java.io.IOException if the file cannot be read.
     */
    default String transpile(String programPath) throws TranspilationException, java.io.IOException {
        return transpile(java.nio.file.Files.readAllLines(java.nio.file.Path.of(programPath)), programPath);
    }
}

package org.fangless.transpiler;

import org.fangless.transpiler.api.ITranspiler;
import org.fangless.transpiler.api.TranspilationException;
import org.fangless.transpiler.codegen.CodeGenerator;
import org.fangless.transpiler.codegen.CodegenException;
import org.fangless.transpiler.codegen.CodegenOptions;
import org.fangless.transpiler.diagnostics.DiagnosticsEngine;
import org.fangless.transpiler.diagnostics.TranspilerLogger;
import org.fangless.transpiler.frontend.lexer.Lexer;
import org.fangless.transpiler.frontend.lexer.Token;
import org.fangless.transpiler.frontend.parser.ParseException;
import org.fangless.transpiler.frontend.parser.Parser;
import org.fangless.transpiler.frontend.parser.ast.Module;

import java.util.List;

/**
 * The main transpiler implementation. This class orchestrates the pipeline from source lines
 * to C++ source: lexing, parsing and code generation. It is not thread-safe.
 */
public class Transpiler implements ITranspiler {

    private final CodegenOptions options;
    private int verbosity = -1;

    /**
     * Creates a transpiler with the default code generation options.
     */
    public Transpiler() {
        this(CodegenOptions.defaults());
    }

    /**
     * @param options The code generation options.
     */
    public Transpiler(CodegenOptions options) {
        this.options = options;
    }

    @Override
    public String transpile(List<String> sourceLines, String programName) throws TranspilationException {
        Module module = parse(sourceLines, programName);

        // Phase 3: Code generation
        try {
            String code = new CodeGenerator(options).generate(module);
            TranspilerLogger.info("Transpiled {} ({} top-level statements).", programName, module.body().size());
            return code;
        } catch (CodegenException e) {
            TranspilerLogger.error("Code generation failed: {}", e.getMessage());
            throw new TranspilationException("[" + e.getCode() + "] " + e.getMessage(), e);
        }
    }

    @Override
    public Module parse(List<String> sourceLines, String programName) throws TranspilationException {
        if (verbosity >= 0) {
            TranspilerLogger.setLevel(verbosity);
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical analysis
        String fullSource = String.join("\n", sourceLines) + "\n";
        List<Token> tokens = new Lexer(fullSource, diagnostics, programName).scanTokens();
        TranspilerLogger.debug("Lexed {} tokens from {}.", tokens.size(), programName);
        if (diagnostics.hasErrors()) {
            throw new TranspilationException(diagnostics.summary());
        }

        // Phase 2: Parsing
        try {
            Module module = new Parser(tokens, diagnostics).parse();
            if (diagnostics.hasErrors()) {
                throw new TranspilationException(diagnostics.summary());
            }
            diagnostics.logWarnings();
            return module;
        } catch (ParseException e) {
            TranspilerLogger.debug("Parsing stopped with {} at {}.", e.getCode(), e.getSourceInfo());
            throw new TranspilationException(diagnostics.summary(), e);
        }
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}

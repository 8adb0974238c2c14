package org.fangless.cli.commands;

import org.fangless.cli.CommandLineInterface;
import org.fangless.cli.config.LoggingConfigurator;
import org.fangless.transpiler.Transpiler;
import org.fangless.transpiler.api.TranspilationException;
import org.fangless.transpiler.codegen.CodegenOptions;
import org.fangless.transpiler.diagnostics.TranspilerLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "transpile", description = "Transpiles a source file to a C++ translation unit.")
public class TranspileCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranspileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "Where to write the C++ code (default: stdout).")
    private File output;

    @Option(names = {"-v", "--verbose"}, description = "Log transpiler phases (-v debug, -vv trace).")
    private boolean[] verbose = new boolean[0];

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        CodegenOptions options = CodegenOptions.fromConfig(parent.getConfig());
        PrintWriter err = spec.commandLine().getErr();

        List<String> sourceLines;
        try {
            sourceLines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot read " + file.getPath() + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        Transpiler transpiler = new Transpiler(options);
        if (verbose.length > 0) {
            boolean trace = verbose.length > 1;
            transpiler.setVerbosity(trace ? TranspilerLogger.TRACE : TranspilerLogger.DEBUG);
            LoggingConfigurator.setLevel(TranspilerLogger.class.getName(), trace ? "TRACE" : "DEBUG");
        }

        String code;
        try {
            code = transpiler.transpile(sourceLines, file.getPath());
        } catch (TranspilationException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_TRANSPILATION_ERROR;
        }

        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(code);
            out.flush();
            return CommandLineInterface.EXIT_OK;
        }
        try {
            Files.writeString(output.toPath(), code, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot write " + output.getPath() + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
        LOGGER.info("Wrote {} bytes of C++ to {}", code.length(), output.getPath());
        return CommandLineInterface.EXIT_OK;
    }
}

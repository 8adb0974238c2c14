package org.fangless.cli.commands;

import org.fangless.cli.CommandLineInterface;
import org.fangless.transpiler.Transpiler;
import org.fangless.transpiler.api.TranspilationException;
import org.fangless.transpiler.codegen.AstJsonSerializer;
import org.fangless.transpiler.codegen.CodegenOptions;
import org.fangless.transpiler.frontend.parser.ast.Module;
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

@Command(name = "ast", description = "Parses a source file and prints its syntax tree as JSON.")
public class AstCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

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

        Module module;
        try {
            module = new Transpiler(options).parse(sourceLines, file.getPath());
        } catch (TranspilationException e) {
            err.println(e.getMessage());
            return CommandLineInterface.EXIT_TRANSPILATION_ERROR;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println(new AstJsonSerializer().toJson(module));
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}

package org.fangless.cli;

import org.fangless.cli.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains integration tests for the command line interface.
 * Commands are executed in-process with their output captured.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Verifies the command name and the registered subcommands.
     */
    @Test
    @Tag("unit")
    void testCliInitialization() {
        // Assert
        assertThat(cmd.getCommandName()).isEqualTo("fangless");
        assertThat(cmd.getSubcommands()).containsKeys("transpile", "ast", "help");
    }

    /**
     * Verifies that running without a subcommand prints the usage help to the configured output.
     */
    @Test
    @Tag("unit")
    void testNoSubcommandPrintsUsage() {
        // Act
        int exitCode = cmd.execute();
        cmd.getOut().flush();

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString())
                .contains("Usage: fangless")
                .contains("transpile")
                .contains("ast");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that transpiling a valid file prints the C++ code and exits with 0.
     */
    @Test
    @Tag("integration")
    void testTranspileToStdout() throws IOException {
        // Arrange
        Path source = write("square.py", "def square(x):\n    return x * x\n\nprint(square(4))\n");

        // Act
        int exitCode = cmd.execute("transpile", "-f", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString())
                .contains("DynamicType _fn_square(DynamicType x);")
                .contains("print(_fn_square(DynamicType(4)));");
    }

    /**
     * Verifies that the output option writes the code to a file instead of stdout.
     */
    @Test
    @Tag("integration")
    void testTranspileToFile() throws IOException {
        // Arrange
        Path source = write("hello.py", "print('hello')\n");
        Path target = tempDir.resolve("hello.cpp");

        // Act
        int exitCode = cmd.execute("transpile", "-f", source.toString(), "-o", target.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).isEmpty();
        assertThat(Files.readString(target)).contains("int main() {");
    }

    /**
     * Verifies the exit code and message for a program that uses an unsupported construct.
     */
    @Test
    @Tag("integration")
    void testTranspilationErrorExitCode() throws IOException {
        // Arrange
        Path source = write("shape.py", "class Shape:\n    pass\n");

        // Act
        int exitCode = cmd.execute("transpile", "-f", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_TRANSPILATION_ERROR);
        assertThat(err.toString()).contains("'class' is not supported.");
    }

    /**
     * Verifies the exit code for a source file that does not exist.
     */
    @Test
    @Tag("integration")
    void testMissingSourceFile() {
        // Act
        int exitCode = cmd.execute("transpile", "-f", tempDir.resolve("absent.py").toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("cannot read");
    }

    /**
     * Verifies that a custom configuration file changes the generated code.
     */
    @Test
    @Tag("integration")
    void testCustomConfigFile() throws IOException {
        // Arrange
        Path config = write("custom.conf", "fangless.codegen.function-prefix = \"user_\"\n");
        Path source = write("f.py", "def f():\n    pass\nf()\n");

        // Act
        int exitCode = cmd.execute("-c", config.toString(), "transpile", "-f", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("DynamicType user_f() {").contains("    user_f();");
    }

    /**
     * Verifies that a configuration file given on the command line must exist.
     */
    @Test
    @Tag("integration")
    void testMissingConfigFile() throws IOException {
        // Arrange
        Path source = write("f.py", "x = 1\n");

        // Act
        int exitCode = cmd.execute("-c", tempDir.resolve("nope.conf").toString(), "transpile", "-f", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("was not found");
    }

    /**
     * Verifies that the ast command prints the syntax tree as JSON.
     */
    @Test
    @Tag("integration")
    void testAstCommand() throws IOException {
        // Arrange
        Path source = write("x.py", "x = 1\n");

        // Act
        int exitCode = cmd.execute("ast", "-f", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(out.toString()).contains("\"node\": \"Module\"").contains("\"node\": \"Assign\"");
    }
}

package org.fangless.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.fangless.cli.commands.AstCommand;
import org.fangless.cli.commands.TranspileCommand;
import org.fangless.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "fangless",
    mixinStandardHelpOptions = true,
    version = "Fangless 1.0",
    description = "Fangless - transpiles a Python subset into C++",
    subcommands = {
        TranspileCommand.class,
        AstCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** The command completed successfully. */
    public static final int EXIT_OK = 0;
    /** The source could not be transpiled. */
    public static final int EXIT_TRANSPILATION_ERROR = 1;
    /** A file could not be read or written. */
    public static final int EXIT_IO_ERROR = 2;

    private static final String CONFIG_FILE_NAME = "fangless.conf";
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: fangless.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("fangless");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        try {
            if (this.configFile != null) {
                if (!this.configFile.exists()) {
                    throw new CommandLine.ParameterException(spec.commandLine(),
                            "Configuration file specified via --config was not found: " + this.configFile.getAbsolutePath());
                }
                LOGGER.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
                this.config = load(this.configFile);
            } else {
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    LOGGER.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    this.config = load(cwdConfigFile);
                } else {
                    LOGGER.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                    this.config = ConfigFactory.systemProperties()
                            .withFallback(ConfigFactory.systemEnvironment())
                            .withFallback(ConfigFactory.load())
                            .resolve();
                }
            }
        } catch (ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Failed to load or parse configuration: " + e.getMessage(), e, null, null);
        }

        LoggingConfigurator.configure(config);
        initialized = true;
    }

    // Config load order: System Props > Env Vars > File > Classpath defaults
    private static Config load(File file) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

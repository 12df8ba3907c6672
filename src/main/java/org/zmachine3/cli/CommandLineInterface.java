package org.zmachine3.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zmachine3.cli.commands.DisassembleCommand;
import org.zmachine3.cli.commands.RunCommand;
import org.zmachine3.config.ConfigLoader;
import org.zmachine3.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "zmachine3",
    mixinStandardHelpOptions = true,
    version = "zmachine3 1.0",
    description = "Interpreter for Z-machine version 3 story files",
    subcommands = {
        RunCommand.class,
        DisassembleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: zmachine3.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("zmachine3");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.exists()) {
                LOG.error("Configuration file specified via --config was not found: {}", configFile.getAbsolutePath());
            }
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}

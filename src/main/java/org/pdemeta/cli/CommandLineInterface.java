package org.pdemeta.cli;

import com.typesafe.config.Config;
import org.pdemeta.cli.commands.AnalyzeCommand;
import org.pdemeta.config.ConfigLoader;
import org.pdemeta.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pdemeta",
    mixinStandardHelpOptions = true,
    version = "pdemeta 1.0",
    description = "Boundary-condition classification and variable mapping for PDE problems",
    subcommands = {
        AnalyzeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        commandLine.setCommandName("pdemeta");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null) {
                LOG.debug("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            }
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}

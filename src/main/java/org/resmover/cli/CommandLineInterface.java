package org.resmover.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.resmover.cli.commands.MoveCommand;
import org.resmover.cli.commands.RemoveCommand;
import org.resmover.cli.config.ConfigLoader;
import org.resmover.cli.config.LoggingConfigurator;
import org.resmover.resources.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "resmover",
    mixinStandardHelpOptions = true,
    version = "resmover 1.0",
    description = "Moves Android resources between modules and removes unused ones",
    subcommands = {
        MoveCommand.class,
        RemoveCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/resmover.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("resmover");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws ConfigurationException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    private void initialize() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        try {
            this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (ConfigException e) {
            throw new ConfigurationException("Failed to load or parse configuration: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("resmover.logging.format", "COLOR".equalsIgnoreCase(format) ? "STDERR_COLOR" : "STDERR_PLAIN");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}

package org.loreweave.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.loreweave.cli.commands.RunCommand;
import org.loreweave.cli.commands.ValidateCommand;
import org.loreweave.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "loreweave",
    mixinStandardHelpOptions = true,
    version = "Loreweave 1.0",
    description = "Loreweave - Stochastic World Generation",
    subcommands = {
        RunCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "loreweave.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: loreweave.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("loreweave");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration. Precedence: {@code --config} file, then {@code -Dconfig.file}, then
     * {@code loreweave.conf} in the working directory, then classpath defaults. System properties and
     * environment variables override every file.
     *
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed
     */
    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw new IllegalArgumentException("Configuration file specified via --config was not found: "
                        + this.configFile.getAbsolutePath());
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            this.config = load(this.configFile);
        } else {
            // 2) Next: standard Typesafe Config system property -Dconfig.file
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                if (!systemConfigFile.exists()) {
                    throw new IllegalArgumentException("Configuration file specified via -Dconfig.file was not found: "
                            + systemConfigFile.getAbsolutePath());
                }
                logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile.getAbsolutePath());
                this.config = load(systemConfigFile);
            } else {
                // 3) Then: loreweave.conf in the current working directory
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    this.config = load(cwdConfigFile);
                } else {
                    // 4) Finally: fall back to classpath defaults only
                    logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                    this.config = load(null);
                }
            }
        }

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("loreweave.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private static Config load(File file) {
        // Config load order: System Props > Env Vars > File > Classpath defaults
        Config fileConfig = file != null ? ConfigFactory.parseFile(file) : ConfigFactory.empty();
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context = (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
            LoggingConfigurator.reset();
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

package org.sysmlite.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.sysmlite.cli.commands.ParseCommand;
import org.sysmlite.cli.commands.TokensCommand;
import org.sysmlite.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "sysmlite",
    mixinStandardHelpOptions = true,
    version = "sysmlite 1.0",
    description = "sysmlite - parses SysML v2 model text into a syntax tree",
    subcommands = {
        ParseCommand.class,
        TokensCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final String CONFIG_FILE_NAME = "sysmlite.conf";
    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: sysmlite.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

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
        commandLine.setCommandName("sysmlite");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        // Config load order: System Props > Env Vars > File > Classpath defaults
        final File file = resolveConfigFile();
        try {
            Config fileConfig = ConfigFactory.empty();
            if (file != null) {
                LOG.info("Using configuration file: {}", file.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(file);
            } else {
                LOG.debug("No '{}' found. Using default configuration from classpath.", CONFIG_FILE_NAME);
            }
            this.config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment())
                    .withFallback(fileConfig)
                    .withFallback(ConfigFactory.load())
                    .resolve();
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            throw new ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    /**
     * Finds the configuration file: --config, then -Dconfig.file, then sysmlite.conf in the working directory.
     * @return The file, or {@code null} to use classpath defaults only.
     * @throws ParameterException if an explicitly given file does not exist.
     */
    private File resolveConfigFile() {
        // 1) Highest precedence: explicit CLI option --config
        if (this.configFile != null) {
            if (!this.configFile.exists()) {
                throw missingConfigFile("--config", this.configFile.getAbsoluteFile());
            }
            return this.configFile;
        }

        // 2) Next: standard Typesafe Config system property -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw missingConfigFile("-Dconfig.file", systemConfigFile);
            }
            return systemConfigFile;
        }

        // 3) Then: sysmlite.conf in the current working directory
        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        return cwdConfigFile.exists() ? cwdConfigFile : null;
    }

    private ParameterException missingConfigFile(final String source, final File file) {
        LOG.error("Configuration file specified via {} was not found: {}", source, file.getPath());
        return new ParameterException(spec.commandLine(),
                "Configuration file specified via " + source + " was not found: " + file.getPath());
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the resolved configuration, loading it on first use.
     * @return The application configuration.
     * @throws ParameterException if the configuration file is missing or cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

package org.loreweave.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN selects the message-only appender
 *   default-level = "WARN"    # root logger level
 *   levels {
 *     "org.loreweave.engine" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    public static final String FORMAT_PROPERTY = "loreweave.logging.format";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures Logback from the configuration. Idempotent until {@link #reset()}.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (loggingConfig.hasPath(FORMAT_KEY)) {
            // The appender is chosen from the system property when logback.xml is (re)loaded.
            LOGGER.debug("Logging format '{}' uses appender {}", loggingConfig.getString(FORMAT_KEY),
                    System.getProperty(FORMAT_PROPERTY, "STDOUT"));
        }

        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }

        if (loggingConfig.hasPath(LEVELS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
                LOGGER.debug("Configured logger '{}' to level: {}", entry.getKey(), level);
            }
        }
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply its settings again. Used by tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }

    public static boolean isConfigured() {
        return loggingConfigured;
    }
}

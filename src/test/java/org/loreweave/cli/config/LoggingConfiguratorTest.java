package org.loreweave.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.loreweave.junit.extensions.logging.ExpectLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.loreweave.test.configured";

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context().getLogger(TEST_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    /**
     * Root and per-logger levels are applied from the logging block.
     */
    @Test
    void configure_appliesLevels() {
        final Config config = ConfigFactory.parseString(
                "logging { default-level = \"ERROR\", levels { \"" + TEST_LOGGER + "\" = \"DEBUG\" } }");

        LoggingConfigurator.configure(config);

        assertThat(context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context().getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(LoggingConfigurator.isConfigured()).isTrue();
    }

    /**
     * A second call is ignored until reset.
     */
    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.empty());
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = \"TRACE\" }"));
        assertThat(context().getLogger(TEST_LOGGER).getLevel()).isNull();

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = \"TRACE\" }"));
        assertThat(context().getLogger(TEST_LOGGER).getLevel()).isEqualTo(Level.TRACE);
    }

    /**
     * Unknown level names are reported and skipped.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown log level 'LOUD' for logger '.*'")
    void configure_skipsUnknownLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"" + TEST_LOGGER + "\" = \"LOUD\" }"));

        assertThat(context().getLogger(TEST_LOGGER).getLevel()).isNull();
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}

package org.loreweave.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.loreweave.cli.CommandLineInterface;
import org.loreweave.cli.config.LoggingConfigurator;
import org.loreweave.junit.extensions.logging.AllowLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains integration tests for the run and validate subcommands against the bundled configuration.
 */
@Tag("integration")
@AllowLog(level = LogLevel.WARN)
class RunCommandTest {

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        cmd = new CommandLine(new CommandLineInterface());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    /**
     * A short run prints the world summary followed by the validation report.
     */
    @Test
    void run_printsSummaryAndValidation() {
        int exitCode = cmd.execute("run", "-t", "20", "-s", "7");

        assertThat(exitCode).isIn(RunCommand.EXIT_VALID, RunCommand.EXIT_INVALID);
        assertThat(out.toString())
                .contains("=== World Summary ===")
                .contains("Seed: 7")
                .contains("Validation: ");
    }

    /**
     * The JSON format writes a snapshot of the final world to the output file.
     */
    @Test
    void run_writesJsonSnapshot(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("world.json");

        int exitCode = cmd.execute("run", "-t", "5", "-s", "3", "-f", "json", "-o", file.toString());

        assertThat(exitCode).isIn(RunCommand.EXIT_VALID, RunCommand.EXIT_INVALID);
        JsonNode world = new ObjectMapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        assertThat(world.get("seed").asLong()).isEqualTo(3L);
        assertThat(world.get("tick").asLong()).isEqualTo(5L);
        assertThat(world.get("entities").size()).isGreaterThanOrEqualTo(13);
        assertThat(world.get("validation").get("totalChecks").asInt()).isEqualTo(4);
    }

    /**
     * An unsupported output format is a defect and nothing runs.
     */
    @Test
    void run_rejectsUnknownFormat() {
        int exitCode = cmd.execute("run", "-f", "xml");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_DEFECT);
        assertThat(err.toString()).contains("Unknown format: xml");
    }

    /**
     * Validate prints only the report, using settings from a --config file.
     */
    @Test
    void validate_readsConfigFile(@TempDir Path dir) throws Exception {
        Path conf = dir.resolve("small.conf");
        Files.writeString(conf, "loreweave.engine { seed = 11, max-ticks = 10 }\n", StandardCharsets.UTF_8);

        int exitCode = cmd.execute("--config", conf.toString(), "validate");

        assertThat(exitCode).isIn(RunCommand.EXIT_VALID, RunCommand.EXIT_INVALID);
        assertThat(out.toString()).startsWith("Validation: ").doesNotContain("World Summary");
    }

    /**
     * A configuration error, here an unknown system type, ends the command with the defect exit code.
     */
    @Test
    @AllowLog(level = LogLevel.ERROR, messagePattern = "Configuration defect: .*")
    void validate_reportsConfigurationDefect(@TempDir Path dir) throws Exception {
        Path conf = dir.resolve("broken.conf");
        Files.writeString(conf, "loreweave.systems = [{ type = weather }]\n", StandardCharsets.UTF_8);

        int exitCode = cmd.execute("--config", conf.toString(), "validate");

        assertThat(exitCode).isEqualTo(RunCommand.EXIT_DEFECT);
        assertThat(err.toString()).contains("Unknown system type: weather");
    }
}

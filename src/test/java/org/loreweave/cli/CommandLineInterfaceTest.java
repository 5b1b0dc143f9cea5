package org.loreweave.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CommandLineInterface} entry point.
 */
@Tag("unit")
class CommandLineInterfaceTest {

    /**
     * The root command registers the run, validate and help subcommands.
     */
    @Test
    void cliInitialization_registersSubcommands() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());

        assertThat(cmd.getCommandName()).isEqualTo("loreweave");
        assertThat(cmd.getSubcommands()).containsKeys("run", "validate", "help");
    }

    /**
     * A configuration file given with --config must exist.
     */
    @Test
    void execute_missingConfigFileIsDefect() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        StringWriter err = new StringWriter();
        cmd.setErr(new PrintWriter(err));

        int exitCode = cmd.execute("--config", "does-not-exist.conf", "validate");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("does-not-exist.conf");
    }
}

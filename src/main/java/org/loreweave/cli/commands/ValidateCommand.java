package org.loreweave.cli.commands;

import com.typesafe.config.ConfigException;
import org.loreweave.cli.CommandLineInterface;
import org.loreweave.engine.WorldEngine;
import org.loreweave.runtime.templates.MissingCapabilityException;
import org.loreweave.runtime.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Runs a world and prints only its validation report. Exits with 2 if any check failed.
 */
@Command(
    name = "validate",
    description = "Generate a world and check its structural invariants"
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

    @Option(names = {"-s", "--seed"}, description = "Random seed (default: loreweave.engine.seed)")
    private Long seed;

    @Option(names = {"-t", "--max-ticks"}, description = "Tick limit (default: loreweave.engine.max-ticks)")
    private Long maxTicks;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        WorldEngine engine;
        try {
            engine = RunCommand.buildEngine(parent.getConfig(), seed, maxTicks);
            engine.run();
        } catch (MissingCapabilityException | IllegalArgumentException | ConfigException e) {
            LOG.error("Configuration defect: {}", e.getMessage());
            spec.commandLine().getErr().println("Configuration defect: " + e.getMessage());
            return RunCommand.EXIT_DEFECT;
        }

        ValidationReport report = engine.validate();
        spec.commandLine().getOut().print(report.format());
        spec.commandLine().getOut().flush();
        return report.isValid() ? RunCommand.EXIT_VALID : RunCommand.EXIT_INVALID;
    }
}

package org.loreweave.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.loreweave.cli.CommandLineInterface;
import org.loreweave.engine.EngineSettings;
import org.loreweave.engine.WorldEngine;
import org.loreweave.engine.WorldEngineFactory;
import org.loreweave.engine.WorldSnapshot;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.HistoryEvent;
import org.loreweave.runtime.templates.MissingCapabilityException;
import org.loreweave.runtime.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Generate a world and print its summary and validation report"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    public static final int EXIT_VALID = 0;
    public static final int EXIT_DEFECT = 1;
    public static final int EXIT_INVALID = 2;

    @Option(
        names = {"-s", "--seed"},
        description = "Random seed (default: loreweave.engine.seed)"
    )
    private Long seed;

    @Option(
        names = {"-t", "--max-ticks"},
        description = "Tick limit (default: loreweave.engine.max-ticks)"
    )
    private Long maxTicks;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: summary, json (default: summary)"
    )
    private String format = "summary";

    @Option(
        names = {"-o", "--output"},
        description = "Write the output to this file instead of stdout"
    )
    private File output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        if (!"summary".equalsIgnoreCase(format) && !"json".equalsIgnoreCase(format)) {
            spec.commandLine().getErr().println("Unknown format: " + format + ". Supported formats: summary, json");
            return EXIT_DEFECT;
        }

        WorldEngine engine;
        try {
            engine = buildEngine(parent.getConfig(), seed, maxTicks);
            engine.run();
        } catch (MissingCapabilityException | IllegalArgumentException | ConfigException e) {
            LOG.error("Configuration defect: {}", e.getMessage());
            spec.commandLine().getErr().println("Configuration defect: " + e.getMessage());
            return EXIT_DEFECT;
        }

        ValidationReport report = engine.validate();
        try {
            String text = "json".equalsIgnoreCase(format)
                    ? toJson(WorldSnapshot.of(engine, report))
                    : summary(engine) + System.lineSeparator() + report.format();
            write(text);
        } catch (IOException e) {
            LOG.error("Failed to write output: {}", e.getMessage());
            spec.commandLine().getErr().println("Failed to write output: " + e.getMessage());
            return EXIT_DEFECT;
        }
        return report.isValid() ? EXIT_VALID : EXIT_INVALID;
    }

    /**
     * Builds an engine from the application configuration, applying optional overrides.
     */
    public static WorldEngine buildEngine(Config config, Long seed, Long maxTicks) {
        Config root = WorldEngineFactory.rootOf(config);
        EngineSettings settings = EngineSettings.fromConfig(
                root.hasPath("engine") ? root.getConfig("engine") : ConfigFactory.empty());
        if (seed != null) settings = settings.withSeed(seed);
        if (maxTicks != null) settings = settings.withMaxTicks(maxTicks);
        return WorldEngineFactory.create(root, settings);
    }

    static String summary(WorldEngine engine) {
        Graph graph = engine.getGraph();
        Map<String, Integer> byKind = new TreeMap<>();
        for (Entity entity : graph.getEntities()) {
            byKind.merge(entity.getKind(), 1, Integer::sum);
        }
        Map<String, Integer> historyByType = new TreeMap<>();
        for (HistoryEvent event : graph.getHistory()) {
            historyByType.merge(event.type(), 1, Integer::sum);
        }
        Map<String, String> pressures = new TreeMap<>();
        graph.getPressures().forEach((id, value) -> pressures.put(id, String.format("%.1f", value)));

        StringBuilder sb = new StringBuilder();
        sb.append("=== World Summary ===").append(System.lineSeparator());
        sb.append(String.format("Seed: %d%n", engine.getSettings().seed()));
        sb.append(String.format("Ticks: %d, epochs: %d, era: %s%n", graph.getTick(), engine.getEpoch(),
                graph.getCurrentEra().name()));
        sb.append(String.format("Entities: %d %s%n", graph.getEntityCount(), byKind));
        sb.append(String.format("Relationships: %d%n", graph.getRelationships().size()));
        sb.append(String.format("Pressures: %s%n", pressures));
        sb.append(String.format("History: %s%n", historyByType));
        sb.append(String.format("Operational errors: %d%n", engine.getErrors().size()));
        return sb.toString();
    }

    static String toJson(Object value) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    private void write(String text) throws IOException {
        if (output == null) {
            spec.commandLine().getOut().println(text);
            spec.commandLine().getOut().flush();
            return;
        }
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8))) {
            writer.println(text);
        }
        LOG.info("Wrote {} output to {}", format.toLowerCase(), output.getAbsolutePath());
    }
}

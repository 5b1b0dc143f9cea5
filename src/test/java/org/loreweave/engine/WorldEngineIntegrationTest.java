package org.loreweave.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.loreweave.junit.extensions.logging.AllowLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.validation.ValidationReport;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the reference world end to end.
 */
@Tag("integration")
@AllowLog(level = LogLevel.WARN)
class WorldEngineIntegrationTest {

    private static final Config ROOT = WorldEngineFactory.rootOf(ConfigFactory.load());

    /**
     * Two engines with the same seed produce the same world.
     */
    @Test
    void run_isDeterministicForSeed() {
        Graph first = engine(5L, 60).run();
        Graph second = engine(5L, 60).run();

        assertThat(fingerprint(second)).isEqualTo(fingerprint(first));
        assertThat(entityIds(second)).isEqualTo(entityIds(first));
        assertThat(first.getEntityCount()).isGreaterThan(13);
    }

    /**
     * Resetting an engine replays exactly the same run.
     */
    @Test
    void reset_replaysRun() {
        WorldEngine engine = engine(8L, 40);
        List<String> before = fingerprint(engine.run());

        engine.reset();
        assertThat(engine.getGraph().getTick()).isZero();
        List<String> after = fingerprint(engine.run());

        assertThat(after).isEqualTo(before);
    }

    /**
     * The finished world passes its structural checks and keeps link arrays in sync.
     */
    @Test
    void validate_reportsAllChecks() {
        WorldEngine engine = engine(42L, 60);
        engine.run();

        ValidationReport report = engine.validate();

        assertThat(report.totalChecks()).isEqualTo(4);
        assertThat(report.results()).anySatisfy(result -> {
            assertThat(result.name()).isEqualTo("Link Synchronization");
            assertThat(result.passed()).isTrue();
        });
        assertThat(report.results()).anySatisfy(result -> {
            assertThat(result.name()).isEqualTo("Relationship Integrity");
            assertThat(result.passed()).isTrue();
        });
        assertThat(WorldSnapshot.of(engine, report).entities()).hasSize(engine.getGraph().getEntityCount());
    }

    private static WorldEngine engine(long seed, long maxTicks) {
        EngineSettings settings = EngineSettings.fromConfig(ROOT.getConfig("engine")).withSeed(seed).withMaxTicks(maxTicks);
        return WorldEngineFactory.create(ROOT, settings);
    }

    private static List<String> entityIds(Graph graph) {
        return graph.getEntities().stream().map(Entity::getId).sorted().collect(Collectors.toList());
    }

    private static List<String> fingerprint(Graph graph) {
        return graph.getRelationships().stream()
                .map(r -> r.getKind() + ":" + r.getSrc() + "->" + r.getDst() + String.format("@%.6f", r.getStrength()))
                .sorted()
                .collect(Collectors.toList());
    }
}

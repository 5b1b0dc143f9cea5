package org.loreweave.engine;

import org.loreweave.junit.extensions.logging.ExpectLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Era;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.HistoryEvent;
import org.loreweave.runtime.mutation.EntityRef;
import org.loreweave.runtime.mutation.TemplateResult;
import org.loreweave.runtime.spi.IGrowthTemplate;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;
import org.loreweave.runtime.systems.SystemResult;
import org.loreweave.runtime.templates.MissingCapabilityException;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link WorldEngine} loop, driven by small stub systems and templates.
 */
@Tag("unit")
class WorldEngineTest {

    private static final SeedWorld ONE_COLONY = new SeedWorld(
            List.of(new SeedWorld.SeedEntity("home", "location", "colony", "Home", null, "thriving", null, null,
                    Map.of(), null)),
            List.of());

    /**
     * The run walks through every era and stops once each era has had its epochs.
     */
    @Test
    void run_advancesThroughErasAndEpochs() {
        WorldEngine engine = engine(settings(100), List.of(Era.neutral("first"), Era.neutral("second")), List.of(), List.of());

        Graph graph = engine.run();

        assertThat(graph.getTick()).isEqualTo(4);
        assertThat(engine.getEpoch()).isEqualTo(2);
        assertThat(graph.getCurrentEra().id()).isEqualTo("second");
        assertThat(graph.getHistory()).extracting(HistoryEvent::description)
                .anyMatch(d -> d.startsWith("Era changed"));
        assertThat(engine.step()).isFalse();
    }

    /**
     * The tick limit ends the run even inside an epoch.
     */
    @Test
    void run_stopsAtMaxTicks() {
        WorldEngine engine = engine(settings(3), List.of(Era.neutral("only")), List.of(), List.of());

        assertThat(engine.run().getTick()).isEqualTo(3);
    }

    /**
     * An abort stops the next step; a reset restores the seed graph and clears the flag.
     */
    @Test
    void abortAndReset() {
        WorldEngine engine = engine(settings(100), List.of(Era.neutral("only")), List.of(), List.of());
        assertThat(engine.step()).isTrue();

        engine.abort();
        assertThat(engine.step()).isFalse();
        assertThat(engine.isAborted()).isTrue();

        engine.reset();
        assertThat(engine.isAborted()).isFalse();
        assertThat(engine.getGraph().getTick()).isZero();
        assertThat(engine.getGraph().getEntityCount()).isEqualTo(1);
    }

    /**
     * A failing system is recorded as an operational error and the tick carries on with the other systems.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "System broken failed at tick 0: boom")
    void step_recordsFailingSystemAndContinues() {
        CountingSystem counter = new CountingSystem("counter");
        ISimulationSystem broken = new CountingSystem("broken") {
            @Override
            public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
                throw new IllegalStateException("boom");
            }
        };
        WorldEngine engine = engine(settings(100), List.of(Era.neutral("only")), List.of(broken, counter), List.of());

        engine.step();

        assertThat(counter.calls.get()).isEqualTo(1);
        assertThat(engine.getErrors()).singleElement().satisfies(e -> assertThat(e.errorType()).isEqualTo("SYSTEM_FAILED"));
        engine.clearErrors();
        assertThat(engine.getErrors()).isEmpty();
    }

    /**
     * A bad argument raised while a system runs is recorded like any other failure instead of ending the run.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "System misconfigured failed at tick 0: bad option")
    void step_recordsIllegalArgumentFromSystem() {
        CountingSystem counter = new CountingSystem("counter");
        ISimulationSystem misconfigured = new CountingSystem("misconfigured") {
            @Override
            public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
                throw new IllegalArgumentException("bad option");
            }
        };
        WorldEngine engine = engine(settings(100), List.of(Era.neutral("only")), List.of(misconfigured, counter), List.of());

        assertThat(engine.step()).isTrue();

        assertThat(counter.calls.get()).isEqualTo(1);
        assertThat(engine.getErrors()).singleElement()
                .satisfies(e -> assertThat(e.errorType()).isEqualTo("SYSTEM_FAILED"));
    }

    /**
     * A missing domain capability is a configuration error and ends the run.
     */
    @Test
    void step_rethrowsMissingCapability() {
        ISimulationSystem needsPlacement = new CountingSystem("needs_placement") {
            @Override
            public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
                throw new MissingCapabilityException("needs_placement", "placement");
            }
        };
        WorldEngine engine = engine(settings(100), List.of(Era.neutral("only")), List.of(needsPlacement), List.of());

        assertThatThrownBy(engine::step).isInstanceOf(MissingCapabilityException.class);
    }

    /**
     * Entities proposed by a system are created with their links and show up in the simulation history.
     */
    @Test
    void step_commitsEntitiesProposedBySystems() {
        ISimulationSystem shrineBuilder = new CountingSystem("shrines") {
            @Override
            public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
                SystemResult.Builder result = SystemResult.builder();
                EntityRef shrine = result.addEntity(EntitySpec.of("rules").name("Shrine"));
                result.relate("originated_in", shrine, EntityRef.existing("home"));
                return result.build("a shrine is raised");
            }
        };
        WorldEngine engine = engine(settings(100), List.of(Era.neutral("only")), List.of(shrineBuilder), List.of());

        engine.step();

        Graph graph = engine.getGraph();
        HistoryEvent simulation = graph.getHistory().stream()
                .filter(e -> "simulation".equals(e.type())).findFirst().orElseThrow();
        assertThat(simulation.entitiesCreated()).hasSize(1);
        assertThat(simulation.relationshipsCreated()).isEqualTo(1);
        assertThat(graph.hasRelationship(simulation.entitiesCreated().get(0), "home", "originated_in")).isTrue();
    }

    /**
     * A system whose era modifier is zero does not run in that era.
     */
    @Test
    void step_skipsSystemsDisabledByEra() {
        CountingSystem counter = new CountingSystem("counter");
        Era quiet = new Era("quiet", "Quiet", "", Map.of(), Map.of("counter", 0.0), Map.of());
        WorldEngine engine = engine(settings(100), List.of(quiet), List.of(counter), List.of());

        engine.step();

        assertThat(counter.calls.get()).isZero();
    }

    /**
     * Template results are committed, logged as growth history and counted as discoveries when flagged.
     */
    @Test
    void step_commitsTemplateGrowth() {
        WorldEngine engine = engine(settings(100), List.of(Era.neutral("only")), List.of(), List.of(new SettlerTemplate()));

        engine.step();

        Graph graph = engine.getGraph();
        assertThat(graph.getEntityCount("npc", null)).isGreaterThanOrEqualTo(1);
        assertThat(graph.getHistory()).extracting(HistoryEvent::type).contains("growth");
        assertThat(graph.getDiscoveryState().getDiscoveriesThisEpoch()).isGreaterThanOrEqualTo(1);
        assertThat(engine.validate().results()).isNotEmpty();
    }

    private static EngineSettings settings(long maxTicks) {
        return new EngineSettings(11L, 2, 1, maxTicks, 30, List.of("npc"), 50, 20.0, 500);
    }

    private static WorldEngine engine(EngineSettings settings, List<Era> eras, List<ISimulationSystem> systems,
                                      List<IGrowthTemplate> templates) {
        return new WorldEngine(settings, TestWorlds.permissiveDomain(), List.of(), eras, systems, templates, ONE_COLONY);
    }

    private static class CountingSystem implements ISimulationSystem {
        final String id;
        final AtomicInteger calls = new AtomicInteger();

        CountingSystem(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getName() {
            return id;
        }

        @Override
        public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
            calls.incrementAndGet();
            return SystemResult.dormant(id + " idle");
        }
    }

    private static final class SettlerTemplate implements IGrowthTemplate {

        @Override
        public String getId() {
            return "settler";
        }

        @Override
        public String getName() {
            return "Settler";
        }

        @Override
        public String getProducedKind() {
            return "npc";
        }

        @Override
        public boolean canApply(Graph graph, IRandomProvider random) {
            return true;
        }

        @Override
        public List<Entity> findTargets(Graph graph, IRandomProvider random) {
            return List.of(graph.getEntity("home"));
        }

        @Override
        public TemplateResult expand(Graph graph, Entity target, IRandomProvider random) {
            TemplateResult.Builder result = TemplateResult.builder();
            EntityRef settler = result.addEntity(EntitySpec.of("npc").subtype("merchant"));
            result.relate("resident_of", settler, EntityRef.existing(target.getId()));
            result.discovery();
            return result.build("a settler arrives");
        }
    }
}

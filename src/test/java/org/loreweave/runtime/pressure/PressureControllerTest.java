package org.loreweave.runtime.pressure;

import com.typesafe.config.ConfigFactory;
import org.loreweave.junit.extensions.logging.ExpectLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.loreweave.runtime.model.Era;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for the {@link PressureController}: delta smoothing, clamping and the epoch update.
 */
@Tag("unit")
class PressureControllerTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
    }

    /**
     * Deltas proposed in one tick are summed, limited to the per-tick maximum and clamped to [0, 100].
     */
    @Test
    void flush_limitsAndClampsSummedDeltas() {
        PressureController controller = new PressureController(graph, List.of(
                new PressureDefinition("conflict", "Conflict", 90.0, 0.0, g -> 0.0),
                new PressureDefinition("stability", "Stability", 50.0, 0.0, g -> 0.0)), 20.0);
        controller.initialize();

        controller.propose("conflict", 8.0);
        controller.propose("conflict", 7.0);
        controller.proposeAll(Map.of("stability", -45.0));
        Map<String, Double> applied = controller.flush();

        assertThat(graph.getPressure("conflict")).isEqualTo(100.0);
        assertThat(applied.get("conflict")).isCloseTo(10.0, within(1e-9));
        assertThat(graph.getPressure("stability")).isCloseTo(30.0, within(1e-9));
        assertThat(controller.getPending()).isEmpty();
        assertThat(controller.flush()).isEmpty();
    }

    /**
     * The epoch update adds growth, pulls toward equilibrium without overshooting it and scales by the era modifier.
     */
    @Test
    void updateEpoch_appliesGrowthDecayAndEraModifier() {
        PressureController controller = new PressureController(graph, List.of(
                new PressureDefinition("high", "High", 80.0, 5.0, g -> 0.0),
                new PressureDefinition("near", "Near", 48.0, 5.0, g -> 0.0),
                new PressureDefinition("growing", "Growing", 10.0, 2.0, g -> 4.0)), 20.0);
        controller.initialize();
        Era era = new Era("war", "War", "", Map.of(), Map.of(), Map.of("growing", 2.0));

        controller.updateEpoch(era);

        assertThat(graph.getPressure("high")).isCloseTo(75.0, within(1e-9));
        assertThat(graph.getPressure("near")).isCloseTo(50.0, within(1e-9));
        assertThat(graph.getPressure("growing")).isCloseTo(10.0 + (4.0 + 2.0) * 2.0, within(1e-9));
    }

    /**
     * A growth function that yields a non-finite value is treated as zero growth.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Growth of pressure broken is not finite, using 0")
    void updateEpoch_ignoresNonFiniteGrowth() {
        PressureController controller = new PressureController(graph, List.of(
                new PressureDefinition("broken", "Broken", 50.0, 0.0, g -> Double.NaN)), 20.0);
        controller.initialize();

        controller.updateEpoch(Era.neutral("any"));

        assertThat(graph.getPressure("broken")).isEqualTo(50.0);
    }

    /**
     * Definitions are read from configuration blocks, with growth selected by type.
     */
    @Test
    void definition_fromConfig() {
        PressureDefinition definition = PressureDefinition.fromConfig(ConfigFactory.parseString(
                "id = scarcity, initial-value = 30, decay = 2, growth { type = constant, value = 1.5 }"));

        assertThat(definition.name()).isEqualTo("scarcity");
        assertThat(definition.initialValue()).isEqualTo(30.0);
        assertThat(definition.growth().compute(graph)).isEqualTo(1.5);
        assertThatThrownBy(() -> PressureDefinition.fromConfig(ConfigFactory.parseString(
                "id = bad, growth { type = no-such-growth }")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PressureController(graph, List.of(), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

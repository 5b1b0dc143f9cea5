package org.loreweave.runtime.systems.trigger;

import com.typesafe.config.ConfigFactory;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.mutation.ProposedRelationship;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.systems.EntityModification;
import org.loreweave.runtime.systems.SystemResult;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ThresholdTriggerSystem}: filtering, conditions, clustering and actions.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ThresholdTriggerSystemTest {

    private static final String WAR_BREWING = "id = war_brewing\n"
            + "filter { kind = faction, not-has-tag = war_brewing }\n"
            + "conditions = [\n"
            + "  { type = relationship-count, relationship-kind = at_war_with, min-count = 1 }\n"
            + "  { type = pressure-above, pressure = conflict, threshold = 40 }\n"
            + "]\n"
            + "cluster-mode = by-relationship\n"
            + "cluster-relationship-kind = at_war_with\n"
            + "min-cluster-size = 2\n"
            + "actions = [{ type = set-cluster-tag, tag = war_brewing }]\n"
            + "pressure-changes { stability = -2 }\n";

    private Graph graph;

    @Mock
    private IRandomProvider random;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        for (String id : new String[]{"north", "middle", "south", "east", "west"}) {
            TestWorlds.faction(graph, id);
        }
        graph.addRelationship("at_war_with", "north", "middle");
        graph.addRelationship("at_war_with", "south", "middle");
        graph.addRelationship("at_war_with", "east", "west");
        graph.updateEntity("west", EntityChanges.create().putTag("war_brewing", "cluster_1_0"));
        graph.setTick(7);
    }

    /**
     * Factions at war with the same enemy form one cluster and share its id; singletons are dropped.
     */
    @Test
    void apply_tagsClustersSharingAnEnemy() {
        graph.setPressure("conflict", 55);
        ThresholdTriggerSystem system = new ThresholdTriggerSystem(ConfigFactory.parseString(WAR_BREWING));

        SystemResult result = system.apply(graph, 1.0, random);

        assertThat(result.getEntitiesModified()).extracting(EntityModification::id)
                .containsExactly("north", "south");
        assertThat(result.getEntitiesModified())
                .allSatisfy(m -> assertThat(m.changes().getTagPuts()).containsEntry("war_brewing", "cluster_7_0"));
        assertThat(result.getPressureChanges()).containsEntry("stability", -2.0);
    }

    /**
     * Three factions all at war with each other end up in one cluster with one shared tag value.
     */
    @Test
    void apply_tagsWarTriangleAsOneCluster() {
        Graph triangle = TestWorlds.emptyGraph();
        for (String id : new String[]{"a", "b", "c"}) {
            TestWorlds.faction(triangle, id);
        }
        triangle.addRelationship("at_war_with", "a", "b");
        triangle.addRelationship("at_war_with", "b", "c");
        triangle.addRelationship("at_war_with", "c", "a");
        triangle.setPressure("conflict", 60);
        triangle.setTick(5);
        ThresholdTriggerSystem system = new ThresholdTriggerSystem(ConfigFactory.parseString(WAR_BREWING));

        SystemResult result = system.apply(triangle, 1.0, random);

        assertThat(result.getEntitiesModified()).extracting(EntityModification::id)
                .containsExactlyInAnyOrder("a", "b", "c");
        assertThat(result.getEntitiesModified())
                .allSatisfy(m -> assertThat(m.changes().getTagPuts()).containsEntry("war_brewing", "cluster_5_0"));
    }

    /**
     * A failing condition leaves the trigger dormant.
     */
    @Test
    void apply_isDormantBelowPressureThreshold() {
        graph.setPressure("conflict", 10);
        ThresholdTriggerSystem system = new ThresholdTriggerSystem(ConfigFactory.parseString(WAR_BREWING));

        assertThat(system.apply(graph, 1.0, random).isEmpty()).isTrue();
    }

    /**
     * In all-matching mode a relationship action links every pair of matches once.
     */
    @Test
    void apply_createsRelationshipsBetweenAllMatches() {
        ThresholdTriggerSystem system = new ThresholdTriggerSystem(ConfigFactory.parseString(
                "id = coalition\n"
                        + "filter { kind = faction, not-has-tag = war_brewing }\n"
                        + "conditions = [{ type = relationship-count, relationship-kind = at_war_with, direction = src, min-count = 1 }]\n"
                        + "cluster-mode = all-matching\n"
                        + "actions = [{ type = create-relationship, relationship-kind = allied_with, strength = 0.6,"
                        + " between-matching = true }]\n"));

        SystemResult result = system.apply(graph, 1.0, random);

        assertThat(result.getRelationshipsAdded()).extracting(ProposedRelationship::kind)
                .containsOnly("allied_with").hasSize(3);
        assertThat(result.getRelationshipsAdded()).extracting(ProposedRelationship::strength).containsOnly(0.6);
    }

    /**
     * Grouping by relationship without naming the kind is rejected.
     */
    @Test
    void fromConfig_requiresClusterKind() {
        assertThatThrownBy(() -> TriggerConfig.fromConfig(ConfigFactory.parseString(
                "id = x, filter { kind = faction }, cluster-mode = by-relationship,"
                        + " actions = [{ type = set-tag, tag = t }]")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TriggerConfig.fromConfig(ConfigFactory.parseString(
                "id = x, filter { kind = faction }")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Tag values that a tag map cannot hold are rejected when the trigger is read, not mid-tick.
     */
    @Test
    void fromConfig_rejectsNonScalarTagValue() {
        assertThatThrownBy(() -> TriggerConfig.fromConfig(ConfigFactory.parseString(
                "id = x, filter { kind = faction }, actions = [{ type = set-tag, tag = t, tag-value = 3 }]")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("boolean or string");
        assertThatThrownBy(() -> EntityChanges.create().putTag("t", 2.5))
                .isInstanceOf(IllegalArgumentException.class);

        TriggerConfig flag = TriggerConfig.fromConfig(ConfigFactory.parseString(
                "id = x, filter { kind = faction }, actions = [{ type = set-tag, tag = t, tag-value = calm }]"));
        assertThat(flag.actions().get(0).tagValue()).isEqualTo("calm");
    }
}

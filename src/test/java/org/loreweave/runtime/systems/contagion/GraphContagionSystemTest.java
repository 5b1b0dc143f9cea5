package org.loreweave.runtime.systems.contagion;

import com.typesafe.config.ConfigFactory;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.mutation.ProposedRelationship;
import org.loreweave.runtime.spi.IRandomProvider;
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
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link GraphContagionSystem} with relationship and tag markers.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GraphContagionSystemTest {

    private static final String FEUD = "id = feud\n"
            + "entity-kind = npc\n"
            + "entity-status = alive\n"
            + "marker { type = relationship, relationship-kind = enemy_of }\n"
            + "vectors = [{ relationship-kind = follower_of, direction = both }]\n"
            + "transmission { base-rate = 0.5, contact-multiplier = 0.5 }\n"
            + "infection { type = create-relationship, relationship-kind = enemy_of, target = contagion-source }\n"
            + "recovery { base-rate = 0.5, immunity-tag = peacemaker }\n"
            + "pressure-changes { conflict = 2 }\n";

    private Graph graph;

    @Mock
    private IRandomProvider random;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        when(random.nextDouble()).thenReturn(0.0);
        when(random.nextInt(anyInt())).thenReturn(0);
        TestWorlds.npc(graph, "carrier", "hero");
        TestWorlds.npc(graph, "follower", "merchant");
        TestWorlds.npc(graph, "foe", "outlaw");
        graph.addRelationship("enemy_of", "carrier", "foe");
        graph.addRelationship("follower_of", "follower", "carrier");
    }

    /**
     * A follower of an infected NPC takes up the carrier's enemy; the carrier recovers and becomes immune.
     */
    @Test
    void apply_spreadsEnmityToContagionSource() {
        GraphContagionSystem system = new GraphContagionSystem(ConfigFactory.parseString(FEUD));

        SystemResult result = system.apply(graph, 1.0, random);

        assertThat(result.getRelationshipsAdded()).singleElement().satisfies(p -> {
            assertThat(p.kind()).isEqualTo("enemy_of");
            assertThat(p.src().getId()).isEqualTo("follower");
            assertThat(p.dst().getId()).isEqualTo("foe");
        });
        assertThat(result.getEntitiesModified()).singleElement().satisfies(m -> {
            assertThat(m.id()).isEqualTo("carrier");
            assertThat(m.changes().getTagPuts()).containsEntry("peacemaker", Boolean.TRUE);
        });
        assertThat(result.getPressureChanges()).containsEntry("conflict", 2.0);
        assertThat(system.getId()).isEqualTo("feud");
    }

    /**
     * Immune entities are never infected, and without carriers the system stays dormant.
     */
    @Test
    void apply_skipsImmuneEntities() {
        graph.updateEntity("follower", EntityChanges.create().putTag("peacemaker", true));
        GraphContagionSystem system = new GraphContagionSystem(ConfigFactory.parseString(FEUD));

        assertThat(system.apply(graph, 1.0, random).getRelationshipsAdded()).isEmpty();

        graph.removeRelationship("carrier", "foe", "enemy_of");
        assertThat(system.apply(graph, 1.0, random).isEmpty()).isTrue();
    }

    /**
     * With a tag marker, infection adds the tag and recovery removes it again.
     */
    @Test
    void apply_tagMarkerSpreadsAndClears() {
        graph.updateEntity("carrier", EntityChanges.create().putTag("plague", true));
        GraphContagionSystem system = new GraphContagionSystem(ConfigFactory.parseString(
                "id = plague, entity-kind = npc\n"
                        + "marker { type = tag, tag = plague }\n"
                        + "vectors = [{ relationship-kind = follower_of }]\n"
                        + "transmission { base-rate = 0.9 }\n"
                        + "infection { type = add-tag, tag-key = plague }\n"
                        + "recovery { base-rate = 0.9, immunity-tag = survivor }\n"));

        SystemResult result = system.apply(graph, 1.0, random);

        assertThat(result.getEntitiesModified()).hasSize(2);
        assertThat(result.getEntitiesModified()).anySatisfy(m -> {
            assertThat(m.id()).isEqualTo("follower");
            assertThat(m.changes().getTagPuts()).containsKey("plague");
        });
        assertThat(result.getEntitiesModified()).anySatisfy(m -> {
            assertThat(m.id()).isEqualTo("carrier");
            assertThat(m.changes().getTagRemovals()).contains("plague");
        });
        assertThat(result.getRelationshipsAdded()).extracting(ProposedRelationship::kind).isEmpty();
    }

    /**
     * Inconsistent blocks are rejected when read.
     */
    @Test
    void fromConfig_rejectsInconsistentSettings() {
        assertThatThrownBy(() -> ContagionConfig.fromConfig(ConfigFactory.parseString(
                "id = x, entity-kind = npc, marker { type = tag, tag = t }, vectors = [{ relationship-kind = a }]\n"
                        + "infection { type = create-relationship, relationship-kind = b, target = contagion-source }")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContagionConfig.fromConfig(ConfigFactory.parseString(
                "id = x, entity-kind = npc, marker { type = tag, tag = t }\n"
                        + "infection { type = add-tag, tag-key = t }")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContagionConfig.fromConfig(ConfigFactory.parseString(
                "id = x, entity-kind = npc, marker { type = tag, tag = t }, vectors = [{ relationship-kind = a }]\n"
                        + "infection { type = add-tag, tag-key = t, tag-value = [1, 2] }")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("boolean or string");
    }
}

package org.loreweave.engine;

import com.typesafe.config.ConfigFactory;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for reading and applying a {@link SeedWorld}.
 */
@Tag("unit")
class SeedWorldTest {

    /**
     * The reference seed world creates all its entities and links them.
     */
    @Test
    void applyTo_createsReferenceSeed() {
        SeedWorld seed = SeedWorld.fromConfig(ConfigFactory.load().getConfig("loreweave.seed-world"));
        Graph graph = TestWorlds.emptyGraph();

        List<String> ids = seed.applyTo(graph, TestWorlds.permissiveDomain());

        assertThat(ids).hasSize(13).contains("loc_aurora", "npc_mayor", "abl_glowcalling");
        assertThat(graph.getRelationships()).hasSize(seed.getRelationships().size());
        assertThat(graph.hasRelationship("npc_mayor", "loc_aurora", "resident_of")).isTrue();
        assertThat(graph.getEntity("loc_aurora").getProminence()).isEqualTo(Prominence.RECOGNIZED);
    }

    /**
     * Numeric tags are kept as text, boolean tags stay flags, and a missing status takes the kind's default.
     */
    @Test
    void fromConfig_normalisesTagsAndStatus() {
        SeedWorld seed = SeedWorld.fromConfig(ConfigFactory.parseString(
                "entities = [{ id = spire, kind = location, subtype = colony, name = \"Spire\","
                        + " tags { temp = 0.5, mystical = true } }]"));
        Graph graph = TestWorlds.emptyGraph();

        seed.applyTo(graph, TestWorlds.permissiveDomain());

        assertThat(graph.getEntity("spire").getTags().get("temp")).isEqualTo("0.5");
        assertThat(graph.getEntity("spire").getTags().get("mystical")).isEqualTo(Boolean.TRUE);
        assertThat(graph.getEntity("spire").getStatus()).isEqualTo("unspoiled");
    }

    /**
     * Relationship endpoints may name an entity instead of giving its id.
     */
    @Test
    void applyTo_resolvesEndpointsByName() {
        SeedWorld seed = SeedWorld.fromConfig(ConfigFactory.parseString(
                "entities = [\n"
                        + "  { id = n1, kind = npc, name = \"Ada Frost\" }\n"
                        + "  { id = l1, kind = location, name = \"Cold Harbour\" }\n"
                        + "]\n"
                        + "relationships = [{ kind = resident_of, src = \"Ada Frost\", dst = \"Cold Harbour\", strength = 0.7 }]"));
        Graph graph = TestWorlds.emptyGraph();

        seed.applyTo(graph, TestWorlds.permissiveDomain());

        assertThat(graph.hasRelationship("n1", "l1", "resident_of")).isTrue();
        assertThat(graph.getEntity("n1").getStatus()).isEqualTo("alive");
    }
}

package org.loreweave.runtime.discovery;

import org.loreweave.runtime.internal.services.SeededRandomProvider;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link EmergentDiscovery}: the discovery gate and the state analyses.
 */
@Tag("unit")
class EmergentDiscoveryTest {

    private Graph graph;
    private IRandomProvider random;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        random = new SeededRandomProvider(3L);
    }

    /**
     * The gate allows the configured number of discoveries per epoch and reopens after the epoch reset.
     */
    @Test
    void shouldDiscoverLocation_limitsDiscoveriesPerEpoch() {
        EmergentDiscovery discovery = discoveryFor(TestWorlds.spatialDomain(""));
        TestWorlds.npc(graph, "scout", "hero");

        assertThat(discovery.shouldDiscoverLocation(graph, random)).isTrue();
        graph.getDiscoveryState().recordDiscovery(graph.getTick());
        graph.getDiscoveryState().recordDiscovery(graph.getTick());
        assertThat(discovery.shouldDiscoverLocation(graph, random)).isFalse();

        graph.getDiscoveryState().resetEpoch();
        assertThat(discovery.shouldDiscoverLocation(graph, random)).isTrue();
    }

    /**
     * Without an active explorer, past the location cap, or without configuration there is no discovery.
     */
    @Test
    void shouldDiscoverLocation_requiresExplorerAndRoom() {
        EmergentDiscovery capped = discoveryFor(TestWorlds.spatialDomain("discovery.max-locations = 1"));
        TestWorlds.npc(graph, "merchant", "merchant");
        assertThat(capped.shouldDiscoverLocation(graph, random)).isFalse();

        TestWorlds.npc(graph, "scout", "outlaw");
        assertThat(capped.shouldDiscoverLocation(graph, random)).isTrue();

        TestWorlds.colony(graph, "home", "thriving", 0, 0);
        assertThat(capped.shouldDiscoverLocation(graph, random)).isFalse();
        assertThat(new EmergentDiscovery(null, null).shouldDiscoverLocation(graph, random)).isFalse();
    }

    /**
     * A cooldown since the last discovery blocks the gate until enough ticks have passed.
     */
    @Test
    void shouldDiscoverLocation_respectsCooldown() {
        EmergentDiscovery discovery = discoveryFor(TestWorlds.spatialDomain(
                "discovery.min-ticks-between-discoveries = 5\ndiscovery.max-discoveries-per-epoch = 10"));
        TestWorlds.npc(graph, "scout", "hero");
        graph.setTick(10);
        graph.getDiscoveryState().recordDiscovery(8);

        assertThat(discovery.shouldDiscoverLocation(graph, random)).isFalse();
        graph.setTick(13);
        assertThat(discovery.shouldDiscoverLocation(graph, random)).isTrue();
    }

    /**
     * More waning than thriving settlements signals a food deficit naming the waning ones.
     */
    @Test
    void analyzeResourceDeficit_prefersWaningColonies() {
        EmergentDiscovery discovery = discoveryFor(TestWorlds.spatialDomain(""));
        TestWorlds.colony(graph, "a", "waning", 0, 0);
        TestWorlds.colony(graph, "b", "waning", 5, 0);
        TestWorlds.colony(graph, "c", "thriving", 10, 0);

        ResourceAnalysis analysis = discovery.analyzeResourceDeficit(graph, random);

        assertThat(analysis.primary()).isEqualTo("food");
        assertThat(analysis.affectedColonies()).containsExactly("a", "b");
    }

    /**
     * Conflict needs both pressure and hostile relationships; resource scarcity turns it into a resource war.
     */
    @Test
    void analyzeConflictPatterns_classifiesConflict() {
        EmergentDiscovery discovery = discoveryFor(TestWorlds.spatialDomain(""));
        TestWorlds.faction(graph, "red");
        TestWorlds.faction(graph, "blue");
        graph.setPressure("conflict", 45);
        assertThat(discovery.analyzeConflictPatterns(graph)).isNull();

        graph.addRelationship("at_war_with", "red", "blue");
        ConflictAnalysis territorial = discovery.analyzeConflictPatterns(graph);
        assertThat(territorial.type()).isEqualTo(ConflictAnalysis.Type.TERRITORIAL);
        assertThat(territorial.factions()).containsExactly("red", "blue");

        graph.setPressure("resource_scarcity", 70);
        assertThat(discovery.analyzeConflictPatterns(graph).type()).isEqualTo(ConflictAnalysis.Type.RESOURCE);
    }

    private static EmergentDiscovery discoveryFor(IDomainSchema schema) {
        return new EmergentDiscovery(schema.getDiscoveryConfig().orElseThrow(), schema.getThemeVocabulary());
    }

    /**
     * Neighbours count in either adjacency direction, contained locations too; the home itself does not.
     */
    @Test
    void findNearbyLocations_looksAroundTheExplorersHome() {
        TestWorlds.colony(graph, "home", "thriving", 0, 0);
        TestWorlds.colony(graph, "east", "thriving", 5, 0);
        TestWorlds.colony(graph, "west", "thriving", -5, 0);
        TestWorlds.colony(graph, "cellar", "thriving", 0, 1);
        TestWorlds.colony(graph, "far", "thriving", 10, 0);
        graph.addRelationship(RelationshipKinds.ADJACENT_TO, "home", "east");
        graph.addRelationship(RelationshipKinds.ADJACENT_TO, "west", "home");
        graph.addRelationship(RelationshipKinds.ADJACENT_TO, "east", "far");
        graph.addRelationship("contains", "home", "cellar");
        TestWorlds.npc(graph, "scout", "outlaw");
        graph.addRelationship(RelationshipKinds.RESIDENT_OF, "scout", "home");

        assertThat(EmergentDiscovery.findNearbyLocations(graph, graph.getEntity("scout")))
                .extracting(Entity::getId)
                .containsExactlyInAnyOrder("east", "west", "cellar");
        TestWorlds.npc(graph, "drifter", "outlaw");
        assertThat(EmergentDiscovery.findNearbyLocations(graph, graph.getEntity("drifter"))).isEmpty();
    }
}

package org.loreweave.runtime.templates;

import com.typesafe.config.ConfigFactory;
import org.loreweave.runtime.internal.services.SeededRandomProvider;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.mutation.EntityRef;
import org.loreweave.runtime.mutation.ProposedRelationship;
import org.loreweave.runtime.mutation.TemplateResult;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the location discovery templates, using the strategic variant.
 */
@Tag("unit")
class LocationDiscoveryTemplateTest {

    private Graph graph;
    private IRandomProvider random;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        random = new SeededRandomProvider(13L);
        TestWorlds.colony(graph, "home", "thriving", 0, 0);
        TestWorlds.npc(graph, "scout", "hero");
        graph.addRelationship("resident_of", "scout", "home");
        TestWorlds.faction(graph, "red");
        TestWorlds.faction(graph, "blue");
        graph.addRelationship("at_war_with", "red", "blue");
        graph.setPressure("conflict", 50);
    }

    /**
     * A discovered place is linked to its explorer in both directions and made adjacent to the explorer's home.
     */
    @Test
    void expand_linksExplorerAndNeighbour() {
        StrategicLocationDiscoveryTemplate template =
                new StrategicLocationDiscoveryTemplate(ConfigFactory.empty(), TestWorlds.spatialDomain(""));
        assertThat(template.canApply(graph, random)).isTrue();
        List<Entity> scouts = template.findTargets(graph, random);
        assertThat(scouts).extracting(Entity::getId).containsExactly("scout");

        TemplateResult result = template.expand(graph, scouts.get(0), random);

        assertThat(result.isDiscovery()).isTrue();
        EntitySpec place = result.getEntities().get(0);
        assertThat(place.getKind()).isEqualTo("location");
        assertThat(place.getStatus()).isEqualTo("unspoiled");
        assertThat(place.getTags()).containsKeys("strategic", "territorial");
        assertThat(result.getRelationships()).extracting(ProposedRelationship::kind)
                .containsExactly("explorer_of", "discovered_by", "adjacent_to", "adjacent_to");
        assertThat(result.getRelationships().get(0).src()).isEqualTo(EntityRef.existing("scout"));
        assertThat(result.getRelationships().get(2).dst()).isEqualTo(EntityRef.existing("home"));
    }

    /**
     * Without conflict there is no need for a strategic place.
     */
    @Test
    void canApply_requiresConflictPattern() {
        graph.setPressure("conflict", 10);
        StrategicLocationDiscoveryTemplate template =
                new StrategicLocationDiscoveryTemplate(ConfigFactory.empty(), TestWorlds.spatialDomain(""));

        assertThat(template.canApply(graph, random)).isFalse();
    }

    /**
     * Discovery needs a spatial model to place the new location.
     */
    @Test
    void expand_withoutPlacement_throwsMissingCapability() {
        StrategicLocationDiscoveryTemplate template =
                new StrategicLocationDiscoveryTemplate(ConfigFactory.empty(), TestWorlds.permissiveDomain());

        assertThatThrownBy(() -> template.expand(graph, graph.getEntity("scout"), random))
                .isInstanceOf(MissingCapabilityException.class);
    }
}

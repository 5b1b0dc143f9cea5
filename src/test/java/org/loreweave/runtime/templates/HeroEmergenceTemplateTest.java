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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link HeroEmergenceTemplate}: the conflict band, saturation and the
 * shape of the proposed hero.
 */
@Tag("unit")
class HeroEmergenceTemplateTest {

    private Graph graph;
    private IRandomProvider random;
    private HeroEmergenceTemplate template;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        random = new SeededRandomProvider(21L);
        template = new HeroEmergenceTemplate(ConfigFactory.parseString("saturation-target = 2"), TestWorlds.permissiveDomain());
        TestWorlds.colony(graph, "home", "thriving", 0, 0);
    }

    /**
     * Heroes only emerge while conflict lies within the configured band and a colony thrives.
     */
    @Test
    void canApply_requiresConflictBandAndThrivingColony() {
        graph.setPressure("conflict", 2);
        assertThat(template.canApply(graph, random)).isFalse();

        graph.setPressure("conflict", 30);
        assertThat(template.canApply(graph, random)).isTrue();

        graph.setPressure("conflict", 95);
        assertThat(template.canApply(graph, random)).isFalse();

        graph.setPressure("conflict", 30);
        graph.getEntity("home").setStatus("waning");
        assertThat(template.canApply(graph, random)).isFalse();
    }

    /**
     * Once the hero count reaches the saturation threshold the template stops applying.
     */
    @Test
    void canApply_stopsWhenSaturated() {
        graph.setPressure("conflict", 30);
        for (int i = 0; i < 3; i++) {
            TestWorlds.npc(graph, "hero" + i, "hero");
        }

        assertThat(template.canApply(graph, random)).isFalse();
    }

    /**
     * The hero is proposed as a living resident of the colony carrying one trait, and relieves conflict.
     */
    @Test
    void expand_proposesResidentHero() {
        graph.setPressure("conflict", 30);

        TemplateResult result = template.expand(graph, graph.getEntity("home"), random);

        assertThat(result.getEntities()).hasSize(1);
        EntitySpec hero = result.getEntities().get(0);
        assertThat(hero.getKind()).isEqualTo("npc");
        assertThat(hero.getSubtype()).isEqualTo("hero");
        assertThat(hero.getStatus()).isEqualTo("alive");
        assertThat(hero.getTags()).hasSize(1);
        assertThat(hero.getTags().keySet()).containsAnyOf("brave", "wise", "cunning", "resolute");
        assertThat(result.getRelationships()).singleElement().satisfies(p -> {
            assertThat(p.kind()).isEqualTo("resident_of");
            assertThat(p.src()).isEqualTo(EntityRef.pending(0));
            assertThat(p.dst()).isEqualTo(EntityRef.existing("home"));
        });
        assertThat(result.getPressureChanges()).containsEntry("conflict", -2.0);
    }

    /**
     * A target that no longer exists yields an empty result.
     */
    @Test
    void expand_withVanishedTarget_isEmpty() {
        graph.setPressure("conflict", 30);
        TestWorlds.colony(graph, "gone", "thriving", 5, 5);
        Entity gone = graph.getEntity("gone");
        graph.deleteEntity("gone");

        TemplateResult result = template.expand(graph, gone, random);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getRelationships()).extracting(ProposedRelationship::kind).isEmpty();
    }

    /**
     * An inverted conflict band is rejected.
     */
    @Test
    void constructor_rejectsInvertedBand() {
        assertThatThrownBy(() -> new HeroEmergenceTemplate(
                ConfigFactory.parseString("min-conflict = 50, max-conflict = 10"), TestWorlds.permissiveDomain()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

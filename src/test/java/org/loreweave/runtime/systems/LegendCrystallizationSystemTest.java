package org.loreweave.runtime.systems;

import org.loreweave.runtime.internal.services.SeededRandomProvider;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.mutation.CommitOutcome;
import org.loreweave.runtime.mutation.MutationCommitter;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link LegendCrystallizationSystem}.
 */
@Tag("unit")
class LegendCrystallizationSystemTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        TestWorlds.colony(graph, "vale", "thriving", 0, 0);
        graph.createEntity(EntitySpec.of("npc").id("bard").subtype("hero").name("Ilsa").status("dead")
                .prominence(Prominence.RENOWNED));
        graph.addRelationship(RelationshipKinds.RESIDENT_OF, "bard", "vale");
        graph.setTick(60);
    }

    /**
     * The memorial is only a proposal until committed; nothing appears in the graph during apply.
     */
    @Test
    void apply_proposesMemorialWithoutTouchingGraph() {
        int before = graph.getEntityCount();

        SystemResult result = new LegendCrystallizationSystem(1.0, 50).apply(graph, 1.0, new SeededRandomProvider(3L));

        assertThat(graph.getEntityCount()).isEqualTo(before);
        assertThat(result.getEntities()).singleElement()
                .satisfies(spec -> assertThat(spec.getKind()).isEqualTo("rules"));
        assertThat(result.getEntitiesModified()).extracting(EntityModification::id).contains("bard", "vale");
    }

    /**
     * With no relationship budget left the memorial is still created together with both of its links.
     */
    @Test
    void commit_memorialKeepsItsLinksWhenBudgetIsSpent() {
        SystemResult result = new LegendCrystallizationSystem(1.0, 50).apply(graph, 1.0, new SeededRandomProvider(3L));

        CommitOutcome outcome = new SystemCommitter(new MutationCommitter(TestWorlds.permissiveDomain()))
                .commit(graph, result, 0);

        assertThat(outcome.createdIds()).hasSize(1);
        String memorialId = outcome.createdIds().get(0);
        Entity memorial = graph.getEntity(memorialId);
        assertThat(memorial.getTags().has("memorial")).isTrue();
        assertThat(graph.hasRelationship(memorialId, "bard", RelationshipKinds.COMMEMORATES)).isTrue();
        assertThat(graph.hasRelationship(memorialId, "vale", RelationshipKinds.ORIGINATED_IN)).isTrue();
        assertThat(graph.hasRelationship("vale", "bard", RelationshipKinds.COMMEMORATES)).isFalse();
    }

    /**
     * NPCs that died too recently are left alone.
     */
    @Test
    void apply_waitsForThreshold() {
        graph.setTick(20);

        SystemResult result = new LegendCrystallizationSystem(1.0, 50).apply(graph, 1.0, new SeededRandomProvider(3L));

        assertThat(result.getEntities()).isEmpty();
        assertThat(result.getEntitiesModified()).isEmpty();
    }
}

package org.loreweave.runtime.mutation;

import com.typesafe.config.ConfigFactory;
import org.loreweave.runtime.domain.ConfigDomainSchema;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link MutationCommitter}: placeholder resolution, kind defaults,
 * and the domain relationship matrix.
 */
@Tag("unit")
class MutationCommitterTest {

    private Graph graph;
    private MutationCommitter committer;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        committer = new MutationCommitter(TestWorlds.permissiveDomain());
    }

    /**
     * Pending references resolve to the ids assigned in creation order; existing references pass through.
     */
    @Test
    void commit_resolvesPendingReferences() {
        TestWorlds.colony(graph, "home", "thriving", 0, 0);
        TemplateResult.Builder builder = TemplateResult.builder();
        EntityRef cult = builder.addEntity(EntitySpec.of("faction").subtype("cult"));
        EntityRef prophet = builder.addEntity(EntitySpec.of("npc").subtype("hero"));
        builder.relate("leader_of", prophet, cult);
        builder.relate("occupies", cult, EntityRef.existing("home"));
        builder.relate("member_of", prophet, cult);
        builder.relate("occupies", cult, EntityRef.existing("home"));

        CommitOutcome outcome = committer.commit(graph, builder.build("a cult forms"));

        assertThat(outcome.createdIds()).hasSize(2);
        String cultId = outcome.createdIds().get(0);
        String prophetId = outcome.createdIds().get(1);
        assertThat(graph.getEntity(cultId).getKind()).isEqualTo("faction");
        assertThat(graph.hasRelationship(prophetId, cultId, "leader_of")).isTrue();
        assertThat(graph.hasRelationship(cultId, "home", "occupies")).isTrue();
        assertThat(outcome.relationshipsAdded()).isEqualTo(3);
        assertThat(outcome.relationshipsSkipped()).isEqualTo(1);
    }

    /**
     * Entities proposed without a status take the default status of their kind.
     */
    @Test
    void commit_appliesDefaultStatus() {
        TemplateResult.Builder builder = TemplateResult.builder();
        builder.addEntity(EntitySpec.of("npc"));
        builder.addEntity(EntitySpec.of("npc").status("dead"));
        builder.addEntity(EntitySpec.of("creature"));

        List<String> ids = committer.commit(graph, builder.build("births")).createdIds();

        assertThat(graph.getEntity(ids.get(0)).getStatus()).isEqualTo("alive");
        assertThat(graph.getEntity(ids.get(1)).getStatus()).isEqualTo("dead");
        assertThat(graph.getEntity(ids.get(2)).getStatus()).isNull();
    }

    /**
     * A pending index beyond the batch is rejected before anything is created.
     */
    @Test
    void commit_rejectsOutOfRangePlaceholderWithoutSideEffects() {
        TemplateResult.Builder builder = TemplateResult.builder();
        EntityRef npc = builder.addEntity(EntitySpec.of("npc"));
        builder.relate("follower_of", npc, EntityRef.pending(3));

        assertThatThrownBy(() -> committer.commit(graph, builder.build("broken")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(graph.getEntityCount()).isZero();
    }

    /**
     * Pairs listed in the domain matrix only accept the listed kinds; unlisted pairs are open unless strict.
     */
    @Test
    void addRelationship_honoursDomainMatrix() {
        MutationCommitter strict = new MutationCommitter(new ConfigDomainSchema(ConfigFactory.parseString(
                "strict-relationships = true\n"
                        + "relationships = [{ src = npc, dst = location, kinds = [resident_of] }]")));
        TestWorlds.npc(graph, "a", "hero");
        TestWorlds.npc(graph, "b", "hero");
        TestWorlds.colony(graph, "home", "thriving", 0, 0);

        assertThat(strict.addRelationship(graph, "resident_of", "a", "home", null, null)).isTrue();
        assertThat(strict.addRelationship(graph, "explorer_of", "a", "home", null, null)).isFalse();
        assertThat(strict.addRelationship(graph, "follower_of", "a", "b", null, null)).isFalse();
        assertThat(committer.addRelationship(graph, "follower_of", "a", "b", null, null)).isTrue();
        assertThat(graph.hasRelationship("a", "home", "resident_of")).isTrue();
    }
}

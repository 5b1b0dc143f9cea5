package org.loreweave.runtime.systems;

import com.typesafe.config.ConfigFactory;
import org.loreweave.junit.extensions.logging.AllowLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.loreweave.runtime.internal.services.SeededRandomProvider;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.mutation.MutationCommitter;
import org.loreweave.runtime.mutation.ProposedRelationship;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link RelationshipFormationSystem}. Randomness is pinned to zero so
 * that every roll succeeds and the outcome depends only on co-location, factions, cooldowns and
 * contradictions.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RelationshipFormationSystemTest {

    private Graph graph;
    private RelationshipFormationSystem system;

    @Mock
    private IRandomProvider alwaysSucceeds;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        when(alwaysSucceeds.nextDouble()).thenReturn(0.0);
        system = new RelationshipFormationSystem(ConfigFactory.parseString(
                "throttle-chance = 1.0, friendship-base-chance = 0.5, romance-base-chance = 0.5"));

        TestWorlds.colony(graph, "home", "thriving", 0, 0);
        TestWorlds.colony(graph, "away", "thriving", 30, 30);
        TestWorlds.faction(graph, "guild");
        TestWorlds.npc(graph, "a", "hero");
        TestWorlds.npc(graph, "b", "hero");
        TestWorlds.npc(graph, "c", "hero");
        graph.addRelationship("resident_of", "a", "home");
        graph.addRelationship("resident_of", "b", "home");
        graph.addRelationship("resident_of", "c", "away");
        graph.addRelationship("member_of", "a", "guild");
        graph.addRelationship("member_of", "b", "guild");
    }

    /**
     * Co-located faction mates bond; NPCs elsewhere and dead NPCs are left alone.
     */
    @Test
    void apply_pairsOnlyLivingCoLocatedNpcs() {
        TestWorlds.npc(graph, "ghost", "hero");
        graph.addRelationship("resident_of", "ghost", "home");
        graph.getEntity("ghost").setStatus("dead");

        SystemResult result = system.apply(graph, 1.0, alwaysSucceeds);

        assertThat(result.getRelationshipsAdded())
                .extracting(ProposedRelationship::kind)
                .containsExactlyInAnyOrder(RelationshipKinds.FOLLOWER_OF, RelationshipKinds.LOVER_OF);
        assertThat(result.getRelationshipsAdded())
                .allSatisfy(p -> {
                    assertThat(p.src().getId()).isEqualTo("a");
                    assertThat(p.dst().getId()).isEqualTo("b");
                });
    }

    /**
     * An existing enmity in either direction blocks friendship and romance between the pair.
     */
    @Test
    void apply_skipsKindsContradictingExistingRelationships() {
        graph.addRelationship(RelationshipKinds.ENEMY_OF, "b", "a");

        SystemResult result = system.apply(graph, 1.0, alwaysSucceeds);

        assertThat(result.getRelationshipsAdded()).isEmpty();
    }

    /**
     * Each committed formation is recorded against the source, so the same kind cannot form again within its cooldown.
     */
    @Test
    void apply_recordsFormationCooldownsOnCommit() {
        graph.setTick(3);

        SystemResult first = system.apply(graph, 1.0, alwaysSucceeds);

        assertThat(graph.getLastFormation("a", RelationshipKinds.FOLLOWER_OF)).isNull();
        new SystemCommitter(new MutationCommitter(TestWorlds.permissiveDomain())).commit(graph, first, 10);

        assertThat(graph.getLastFormation("a", RelationshipKinds.FOLLOWER_OF)).isEqualTo(3L);
        assertThat(graph.canFormRelationship("a", RelationshipKinds.LOVER_OF,
                system.cooldownOf(RelationshipKinds.LOVER_OF))).isFalse();
        assertThat(system.apply(graph, 1.0, alwaysSucceeds).getRelationshipsAdded()).isEmpty();
        assertThat(system.cooldownOf(RelationshipKinds.ENEMY_OF)).isEqualTo(8L);
    }

    /**
     * Over many seeded runs in a crowded settlement, contradictory kinds never end up between the same pair.
     */
    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = ".*soft limit.*")
    void apply_neverCommitsContradictoryPairs() {
        for (long seed = 1; seed <= 6; seed++) {
            Graph world = crowdedSettlement(seed);
            IRandomProvider random = new SeededRandomProvider(seed);
            SystemCommitter committer = new SystemCommitter(new MutationCommitter(TestWorlds.permissiveDomain()));
            RelationshipFormationSystem eager = new RelationshipFormationSystem(ConfigFactory.parseString(
                    "throttle-chance = 1.0, friendship-base-chance = 0.9, romance-base-chance = 0.9,"
                            + " conflict-base-chance = 0.9, cooldown { follower = 0, rival = 0, enemy = 0, lover = 0 }"));

            for (long tick = 1; tick <= 40; tick++) {
                world.setTick(tick);
                committer.commit(world, eager.apply(world, 1.0 + (tick % 3), random), 50);
                assertNoContradictions(world, seed, tick);
            }
            assertThat(world.getRelationships())
                    .anySatisfy(r -> assertThat(r.getKind()).isIn(RelationshipKinds.FOLLOWER_OF,
                            RelationshipKinds.RIVAL_OF, RelationshipKinds.ENEMY_OF, RelationshipKinds.LOVER_OF));
        }
    }

    /**
     * A failed throttle roll leaves the system dormant.
     */
    @Test
    void apply_isDormantWhenThrottled() {
        RelationshipFormationSystem throttled = new RelationshipFormationSystem(
                ConfigFactory.parseString("throttle-chance = 0.0"));

        assertThat(throttled.apply(graph, 1.0, alwaysSucceeds).isEmpty()).isTrue();
    }

    private static Graph crowdedSettlement(long seed) {
        Graph world = TestWorlds.emptyGraph();
        IRandomProvider layout = new SeededRandomProvider(seed * 31);
        TestWorlds.colony(world, "hub", "thriving", 0, 0);
        List<String> factions = List.of("red", "blue", "green");
        for (String faction : factions) {
            TestWorlds.faction(world, faction);
        }
        world.addRelationship(RelationshipKinds.AT_WAR_WITH, "red", "blue");
        world.addRelationship(RelationshipKinds.ALLIED_WITH, "blue", "green");
        for (int i = 0; i < 14; i++) {
            String id = "npc" + i;
            TestWorlds.npc(world, id, "hero");
            world.addRelationship(RelationshipKinds.RESIDENT_OF, id, "hub");
            world.addRelationship(RelationshipKinds.MEMBER_OF, id, factions.get(layout.nextInt(factions.size())));
        }
        return world;
    }

    private static void assertNoContradictions(Graph world, long seed, long tick) {
        List<Relationship> all = world.getRelationships();
        for (int i = 0; i < all.size(); i++) {
            Relationship first = all.get(i);
            for (int j = i + 1; j < all.size(); j++) {
                Relationship second = all.get(j);
                if (second.connects(first.getSrc(), first.getDst())) {
                    assertThat(RelationshipKinds.contradicts(first.getKind(), second.getKind()))
                            .as("seed %d tick %d: %s vs %s", seed, tick, first, second)
                            .isFalse();
                }
            }
        }
    }
}

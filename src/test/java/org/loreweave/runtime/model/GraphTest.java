package org.loreweave.runtime.model;

import org.loreweave.junit.extensions.logging.AllowLog;
import org.loreweave.junit.extensions.logging.ExpectLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.loreweave.runtime.internal.services.SeededRandomProvider;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Graph} store: entity creation, relationship identity,
 * link synchronisation and formation cooldowns.
 */
@Tag("unit")
class GraphTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
    }

    /**
     * Entities without an explicit id get kind-prefixed ids and default fields stamped with the current tick.
     */
    @Test
    void createEntity_assignsIdsAndDefaults() {
        graph.setTick(4);
        String id = graph.createEntity(EntitySpec.of("npc").subtype("hero"));

        Entity entity = graph.getEntity(id);
        assertThat(id).startsWith("npc_");
        assertThat(entity.getName()).isEqualTo(id);
        assertThat(entity.getProminence()).isEqualTo(Prominence.MARGINAL);
        assertThat(entity.getCreatedAt()).isEqualTo(4);
        assertThat(entity.getUpdatedAt()).isEqualTo(4);
        assertThat(graph.getEntityCount("npc", "hero")).isEqualTo(1);
        assertThat(graph.getEntityCount("npc", null)).isEqualTo(1);
    }

    /**
     * A spec carrying an id that already exists is rejected.
     */
    @Test
    void createEntity_rejectsDuplicateId() {
        graph.createEntity(EntitySpec.of("npc").id("a"));

        assertThatThrownBy(() -> graph.createEntity(EntitySpec.of("npc").id("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a");
    }

    /**
     * Adding the same (kind, src, dst) triple twice keeps a single relationship.
     */
    @Test
    void addRelationship_deduplicatesIdentityTriple() {
        TestWorlds.npc(graph, "a", "hero");
        TestWorlds.npc(graph, "b", "hero");

        assertThat(graph.addRelationship("follower_of", "a", "b")).isTrue();
        assertThat(graph.addRelationship("follower_of", "a", "b", 0.9)).isFalse();
        assertThat(graph.addRelationship("follower_of", "b", "a")).isTrue();

        assertThat(graph.getRelationships()).hasSize(2);
        assertThat(graph.findRelationship("a", "b", "follower_of").getStrength()).isEqualTo(0.6);
    }

    /**
     * The source entity carries a copy of each of its outgoing relationships, kept in sync on
     * strength changes and removal.
     */
    @Test
    void links_followRelationshipChanges() {
        TestWorlds.npc(graph, "a", "hero");
        TestWorlds.npc(graph, "b", "hero");
        graph.addRelationship("enemy_of", "a", "b", 0.4);

        Entity a = graph.getEntity("a");
        assertThat(a.getLinks()).hasSize(1);
        assertThat(graph.getEntity("b").getLinks()).isEmpty();

        graph.modifyRelationshipStrength("a", "b", "enemy_of", 0.9);
        assertThat(a.getLinks().get(0).getStrength()).isEqualTo(1.0);
        assertThat(graph.findRelationship("a", "b", "enemy_of").getStrength()).isEqualTo(1.0);

        graph.archiveRelationship("a", "b", "enemy_of");
        assertThat(a.getLinks().get(0).isActive()).isFalse();

        graph.removeRelationship("a", "b", "enemy_of");
        assertThat(a.getLinks()).isEmpty();
        assertThat(graph.getRelationships()).isEmpty();
    }

    /**
     * Deleting an entity removes every relationship touching it, in both directions.
     */
    @Test
    void deleteEntity_cascadesRelationships() {
        TestWorlds.npc(graph, "a", "hero");
        TestWorlds.npc(graph, "b", "hero");
        TestWorlds.npc(graph, "c", "hero");
        graph.addRelationship("follower_of", "a", "b");
        graph.addRelationship("follower_of", "b", "c");
        graph.addRelationship("follower_of", "c", "a");

        assertThat(graph.deleteEntity("b")).isTrue();

        assertThat(graph.getRelationships()).extracting(Relationship::getSrc).containsExactly("c");
        assertThat(graph.getEntity("a").getLinks()).isEmpty();
        assertThat(graph.deleteEntity("b")).isFalse();
    }

    /**
     * A relationship to a missing entity is stored and reported, leaving validation to flag it.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Relationship .* references a missing entity.*")
    void addRelationship_withMissingEndpoint_isKeptAndLogged() {
        TestWorlds.npc(graph, "a", "hero");

        assertThat(graph.addRelationship("resident_of", "a", "ghost")).isTrue();
        assertThat(graph.getEntity("a").getLinks()).hasSize(1);
    }

    /**
     * Formation cooldowns expire exactly {@code cooldown} ticks after the last formation.
     */
    @Test
    void canFormRelationship_respectsCooldown() {
        graph.setTick(10);
        assertThat(graph.canFormRelationship("a", "lover_of", 5)).isTrue();

        graph.recordRelationshipFormation("a", "lover_of");
        assertThat(graph.getLastFormation("a", "lover_of")).isEqualTo(10L);
        assertThat(graph.canFormRelationship("a", "lover_of", 5)).isFalse();
        assertThat(graph.canFormRelationship("a", "enemy_of", 5)).isTrue();

        for (int i = 0; i < 4; i++) graph.advanceTick();
        assertThat(graph.canFormRelationship("a", "lover_of", 5)).isFalse();
        graph.advanceTick();
        assertThat(graph.canFormRelationship("a", "lover_of", 5)).isTrue();
    }

    /**
     * Updates merge changes into the entity and stamp the current tick; missing entities are ignored.
     */
    @Test
    void updateEntity_mergesChanges() {
        TestWorlds.npc(graph, "a", "hero");
        graph.setTick(12);

        boolean updated = graph.updateEntity("a", EntityChanges.create().status("dead").putTag("brave", true));

        Entity a = graph.getEntity("a");
        assertThat(updated).isTrue();
        assertThat(a.getStatus()).isEqualTo("dead");
        assertThat(a.getTags().has("brave")).isTrue();
        assertThat(a.getUpdatedAt()).isEqualTo(12);
        assertThat(graph.updateEntity("missing", EntityChanges.create().status("dead"))).isFalse();
    }

    /**
     * Pressures are clamped to [0, 100] on every write.
     */
    @Test
    void setPressure_clamps() {
        graph.setPressure("conflict", 140);
        graph.setPressure("stability", -3);

        assertThat(graph.getPressure("conflict")).isEqualTo(100.0);
        assertThat(graph.getPressure("stability")).isEqualTo(0.0);
        assertThat(graph.getPressure("unknown")).isEqualTo(0.0);
    }

    /**
     * Random sequences of adds, removals and deletions keep every entity's links equal to its outgoing relationships.
     */
    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = ".*soft limit.*")
    void links_stayInSyncUnderRandomMutations() {
        String[] kinds = {"follower_of", "enemy_of", "lover_of", "resident_of"};
        for (long seed = 1; seed <= 5; seed++) {
            Graph world = TestWorlds.emptyGraph();
            IRandomProvider random = new SeededRandomProvider(seed);
            List<String> alive = new ArrayList<>();
            int created = 0;
            for (int step = 0; step < 400; step++) {
                int op = random.nextInt(10);
                if (alive.size() < 2 || op == 0) {
                    String id = "e" + created++;
                    world.createEntity(EntitySpec.of("npc").id(id));
                    alive.add(id);
                } else if (op <= 5) {
                    world.addRelationship(kinds[random.nextInt(kinds.length)],
                            alive.get(random.nextInt(alive.size())), alive.get(random.nextInt(alive.size())));
                } else if (op <= 8) {
                    world.removeRelationship(alive.get(random.nextInt(alive.size())),
                            alive.get(random.nextInt(alive.size())), kinds[random.nextInt(kinds.length)]);
                } else {
                    String victim = alive.remove(random.nextInt(alive.size()));
                    assertThat(world.deleteEntity(victim)).isTrue();
                }
                assertLinksMatchRelationships(world, seed, step);
            }
        }
    }

    private static void assertLinksMatchRelationships(Graph world, long seed, int step) {
        for (Entity entity : world.getEntities()) {
            Set<String> expected = new TreeSet<>();
            for (Relationship r : world.getRelationships()) {
                if (r.getSrc().equals(entity.getId())) expected.add(r.getKind() + "|" + r.getSrc() + "|" + r.getDst());
            }
            Set<String> links = new TreeSet<>();
            for (Relationship link : entity.getLinks()) {
                links.add(link.getKind() + "|" + link.getSrc() + "|" + link.getDst());
            }
            assertThat(links).as("seed %d step %d entity %s", seed, step, entity.getId()).isEqualTo(expected);
            assertThat(entity.getLinks()).hasSameSizeAs(expected);
        }
        for (Relationship r : world.getRelationships()) {
            assertThat(world.getEntity(r.getSrc())).as("seed %d step %d: %s", seed, step, r).isNotNull();
            assertThat(world.getEntity(r.getDst())).as("seed %d step %d: %s", seed, step, r).isNotNull();
        }
    }
}

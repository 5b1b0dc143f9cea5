package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.mutation.ProposedRelationship;
import org.loreweave.runtime.query.AffiliationIndex;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.query.GraphQueries.FactionStance;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forms friendships, rivalries, enmities and romances between living NPCs sharing a location.
 * <p>
 * Each pair is weighted by the inverse degree of both NPCs so that isolated NPCs bond more easily
 * than hubs. Faction stance scales the chances: shared or allied factions favour friendship,
 * enemy factions favour enmity. A relationship is only proposed if the pair does not have it yet,
 * the source is not on cooldown for that kind and no contradictory relationship exists or is
 * already proposed this tick.
 * </p>
 */
public class RelationshipFormationSystem implements ISimulationSystem {

    private final double throttleChance;
    private final double friendshipBaseChance;
    private final double friendshipRivalRatio;
    private final double conflictBaseChance;
    private final double romanceBaseChance;
    private final double sameFactionFriendship;
    private final double alliedFactionFriendship;
    private final double enemyFactionConflict;
    private final double neutralConflict;
    private final double sameFactionRomance;
    private final double alliedFactionRomance;
    private final double neutralRomance;
    private final double starCrossedRomance;
    private final Map<String, Long> cooldowns;

    public RelationshipFormationSystem(Config options) {
        this.throttleChance = doubleOr(options, "throttle-chance", 0.3);
        this.friendshipBaseChance = doubleOr(options, "friendship-base-chance", 0.2);
        this.friendshipRivalRatio = doubleOr(options, "friendship-rival-ratio", 0.75);
        this.conflictBaseChance = doubleOr(options, "conflict-base-chance", 0.2);
        this.romanceBaseChance = doubleOr(options, "romance-base-chance", 0.05);
        this.sameFactionFriendship = doubleOr(options, "same-faction-friendship-multiplier", 2.0);
        this.alliedFactionFriendship = doubleOr(options, "allied-faction-friendship-multiplier", 1.2);
        this.enemyFactionConflict = doubleOr(options, "enemy-faction-conflict-multiplier", 3.0);
        this.neutralConflict = doubleOr(options, "neutral-conflict-multiplier", 0.3);
        this.sameFactionRomance = doubleOr(options, "same-faction-romance-multiplier", 3.0);
        this.alliedFactionRomance = doubleOr(options, "allied-faction-romance-multiplier", 1.5);
        this.neutralRomance = doubleOr(options, "neutral-romance-multiplier", 0.7);
        this.starCrossedRomance = doubleOr(options, "star-crossed-multiplier", 0.05);
        this.cooldowns = Map.of(
                RelationshipKinds.FOLLOWER_OF, longOr(options, "cooldown.follower", 5),
                RelationshipKinds.RIVAL_OF, longOr(options, "cooldown.rival", 5),
                RelationshipKinds.ENEMY_OF, longOr(options, "cooldown.enemy", 8),
                RelationshipKinds.LOVER_OF, longOr(options, "cooldown.lover", 15));
    }

    @Override
    public String getId() {
        return "relationship_formation";
    }

    @Override
    public String getName() {
        return "Social Dynamics";
    }

    /**
     * Cooldown in ticks of a kind this system forms.
     */
    public long cooldownOf(String kind) {
        return cooldowns.getOrDefault(kind, 0L);
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (!Probabilities.rollProbability(random, throttleChance, modifier)) {
            return SystemResult.dormant("Social dynamics dormant");
        }
        AffiliationIndex index = AffiliationIndex.of(graph);
        List<Entity> npcs = graph.findEntities(e -> "npc".equals(e.getKind()) && "alive".equals(e.getStatus()));
        SystemResult.Builder result = SystemResult.builder();

        for (int i = 0; i < npcs.size(); i++) {
            Entity npc = npcs.get(i);
            if (index.locationOf(npc.getId()) == null) continue;
            double npcWeight = GraphQueries.getConnectionWeight(npc);

            for (int j = i + 1; j < npcs.size(); j++) {
                Entity neighbor = npcs.get(j);
                if (!index.sameLocation(npc.getId(), neighbor.getId())) continue;
                double balance = (npcWeight + GraphQueries.getConnectionWeight(neighbor)) / 2;

                Set<String> npcFactions = index.factionsOf(npc.getId());
                Set<String> neighborFactions = index.factionsOf(neighbor.getId());
                boolean shared = index.shareFaction(npc.getId(), neighbor.getId());
                FactionStance stance = GraphQueries.getFactionStance(graph, npcFactions, neighborFactions);

                if (shared || stance == FactionStance.ALLIED) {
                    double multiplier = shared ? sameFactionFriendship : alliedFactionFriendship;
                    if (Probabilities.rollProbability(random, Math.min(0.95, friendshipBaseChance * multiplier * balance), modifier)) {
                        String kind = random.nextDouble() > friendshipRivalRatio
                                ? RelationshipKinds.RIVAL_OF : RelationshipKinds.FOLLOWER_OF;
                        tryForm(graph, result, kind, npc, neighbor);
                    }
                }

                if (!shared && !npcFactions.isEmpty() && !neighborFactions.isEmpty()) {
                    double multiplier;
                    if (stance == FactionStance.ENEMY) multiplier = enemyFactionConflict;
                    else if (stance == FactionStance.ALLIED) multiplier = 0.0;
                    else multiplier = neutralConflict;
                    if (Probabilities.rollProbability(random, Math.min(0.95, conflictBaseChance * multiplier * balance), modifier)) {
                        tryForm(graph, result, RelationshipKinds.ENEMY_OF, npc, neighbor);
                    }
                }

                double romance;
                if (shared) romance = sameFactionRomance;
                else if (stance == FactionStance.ALLIED) romance = alliedFactionRomance;
                else if (stance == FactionStance.ENEMY) romance = starCrossedRomance;
                else romance = neutralRomance;
                if (Probabilities.rollProbability(random, Math.min(0.95, romanceBaseChance * romance * balance), modifier)) {
                    tryForm(graph, result, RelationshipKinds.LOVER_OF, npc, neighbor);
                }
            }
        }
        return result.build("Social bonds form and rivalries emerge (" + result.relationshipCount() + " new relationships)");
    }

    private void tryForm(Graph graph, SystemResult.Builder result, String kind, Entity src, Entity dst) {
        if (graph.hasRelationship(src.getId(), dst.getId(), kind) || result.isProposed(kind, src.getId(), dst.getId())) return;
        if (!result.canForm(graph, src.getId(), kind, cooldownOf(kind))) return;
        if (GraphQueries.hasContradiction(graph, src.getId(), dst.getId(), kind)) return;
        for (ProposedRelationship queued : result.proposalsBetween(src.getId(), dst.getId())) {
            if (RelationshipKinds.contradicts(queued.kind(), kind)) return;
        }
        result.form(kind, src.getId(), dst.getId());
    }

    private static double doubleOr(Config options, String path, double fallback) {
        return options.hasPath(path) ? options.getDouble(path) : fallback;
    }

    private static long longOr(Config options, String path, long fallback) {
        return options.hasPath(path) ? options.getLong(path) : fallback;
    }
}

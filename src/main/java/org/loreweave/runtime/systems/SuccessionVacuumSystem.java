package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects active factions whose leaders are all dead and starts a succession crisis.
 * <p>
 * Two or three prominent core members become claimants and may turn into rivals; their supporters
 * may become enemies; rules originating in the faction may be repealed; the faction wanes.
 * Every crisis costs 15 stability and adds 10 conflict.
 * </p>
 */
public class SuccessionVacuumSystem implements ISimulationSystem {

    private final double throttleChance;
    private final long rivalryCooldown;
    private final double rivalryChance;
    private final double escalationChance;
    private final double conflictChance;
    private final double repealChance;

    public SuccessionVacuumSystem(Config options) {
        this.throttleChance = options.hasPath("throttle-chance") ? options.getDouble("throttle-chance") : 0.2;
        this.rivalryCooldown = options.hasPath("rivalry-cooldown") ? options.getLong("rivalry-cooldown") : 8L;
        this.rivalryChance = options.hasPath("rivalry-chance") ? options.getDouble("rivalry-chance") : 0.7;
        this.escalationChance = options.hasPath("escalation-chance") ? options.getDouble("escalation-chance") : 0.3;
        this.conflictChance = options.hasPath("conflict-chance") ? options.getDouble("conflict-chance") : 0.5;
        this.repealChance = options.hasPath("repeal-chance") ? options.getDouble("repeal-chance") : 0.4;
    }

    @Override
    public String getId() {
        return "succession_vacuum";
    }

    @Override
    public String getName() {
        return "Leadership Crisis";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (!Probabilities.rollProbability(random, throttleChance, modifier)) {
            return SystemResult.dormant("No succession crises detected");
        }

        List<Entity> leaderless = new ArrayList<>();
        for (Entity faction : graph.findEntities(e -> "faction".equals(e.getKind()) && "active".equals(e.getStatus()))) {
            List<Entity> leaders = GraphQueries.getFactionLeaders(graph, faction.getId());
            if (!leaders.isEmpty() && leaders.stream().noneMatch(l -> "alive".equals(l.getStatus()))) {
                leaderless.add(faction);
            }
        }
        if (leaderless.isEmpty()) {
            return SystemResult.dormant("All factions have stable leadership");
        }

        SystemResult.Builder result = SystemResult.builder();
        for (Entity faction : leaderless) {
            List<Entity> claimantPool = new ArrayList<>();
            for (Entity member : GraphQueries.getFactionMembers(graph, faction.getId(), 0.7)) {
                if ("alive".equals(member.getStatus()) && member.getProminence().isAtLeast(Prominence.RECOGNIZED)) {
                    claimantPool.add(member);
                }
            }
            if (claimantPool.size() < 2) {
                result.modify(faction.getId(), EntityChanges.create()
                        .status("waning")
                        .description(faction.getDescription() + " With no clear successor, the faction's influence fades."));
                continue;
            }

            List<Entity> claimants = Probabilities.pickMultiple(random, claimantPool, Math.min(3, claimantPool.size()));
            for (int i = 0; i < claimants.size(); i++) {
                for (int j = i + 1; j < claimants.size(); j++) {
                    String a = claimants.get(i).getId();
                    String b = claimants.get(j).getId();
                    if (GraphQueries.hasContradiction(graph, a, b, RelationshipKinds.RIVAL_OF)
                            || graph.hasRelationship(a, b, RelationshipKinds.RIVAL_OF)
                            || !result.canForm(graph, a, RelationshipKinds.RIVAL_OF, rivalryCooldown)) {
                        continue;
                    }
                    if (Probabilities.rollProbability(random, Math.min(0.95, rivalryChance * modifier), modifier)) {
                        result.form(RelationshipKinds.RIVAL_OF, a, b);
                    }
                }
            }

            if (random.nextDouble() < escalationChance) {
                escalate(graph, result, claimants.get(0), claimants.get(1), modifier, random);
            }

            boolean deadLeader = GraphQueries.getFactionLeaders(graph, faction.getId()).stream()
                    .anyMatch(l -> "dead".equals(l.getStatus()));
            if (deadLeader) {
                List<Entity> factionRules = graph.findEntities(rule -> "rules".equals(rule.getKind())
                        && "enacted".equals(rule.getStatus())
                        && graph.hasRelationship(rule.getId(), faction.getId(), RelationshipKinds.ORIGINATED_IN));
                for (Entity rule : Probabilities.pickMultiple(random, factionRules, 2)) {
                    if (Probabilities.rollProbability(random, Math.min(0.95, repealChance * modifier), modifier)) {
                        result.modify(rule.getId(), EntityChanges.create()
                                .status("repealed")
                                .description(rule.getDescription() + " This edict was repealed during the succession crisis."));
                    }
                }
            }

            result.modify(faction.getId(), EntityChanges.create()
                    .status("waning")
                    .description(faction.getDescription() + " A succession crisis threatens to tear the faction apart."));
            result.pressure("stability", -15);
            result.pressure("conflict", 10);
        }

        return result.build("Succession crisis: " + leaderless.size() + " faction(s) face leadership vacuum");
    }

    private void escalate(Graph graph, SystemResult.Builder result, Entity first, Entity second, double modifier,
                          IRandomProvider random) {
        Entity supporterA = Probabilities.pickRandom(random,
                GraphQueries.getRelated(graph, first.getId(), RelationshipKinds.FOLLOWER_OF, Direction.DST));
        Entity supporterB = Probabilities.pickRandom(random,
                GraphQueries.getRelated(graph, second.getId(), RelationshipKinds.FOLLOWER_OF, Direction.DST));
        if (supporterA == null || supporterB == null || supporterA == supporterB) return;
        String a = supporterA.getId();
        String b = supporterB.getId();
        if (GraphQueries.hasContradiction(graph, a, b, RelationshipKinds.ENEMY_OF)
                || graph.hasRelationship(a, b, RelationshipKinds.ENEMY_OF)
                || result.isProposed(RelationshipKinds.ENEMY_OF, a, b)
                || !result.canForm(graph, a, RelationshipKinds.ENEMY_OF, 8)) {
            return;
        }
        if (Probabilities.rollProbability(random, Math.min(0.95, conflictChance * modifier), modifier)) {
            result.form(RelationshipKinds.ENEMY_OF, a, b);
        }
    }
}

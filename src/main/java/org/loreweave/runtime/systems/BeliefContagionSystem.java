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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Spreads proposed rules through the population as SIR contagions.
 * <p>
 * Believers hold a {@code believer_of} relationship to the rule; NPCs who rejected it carry an
 * {@code immune:<ruleId>} tag. Contacts are followers, followees and fellow faction members with a
 * bond of at least 0.3. Infection probability is {@code beta * infectedContacts * (1 - resistance)},
 * recovery probability {@code gamma * (1 + tradition)}. A rule reaching the enactment threshold is
 * enacted; one below 5% adoption is forgotten.
 * </p>
 */
public class BeliefContagionSystem implements ISimulationSystem {

    static final String IMMUNITY_PREFIX = "immune:";
    private static final double CONTACT_MIN_STRENGTH = 0.3;

    private final double transmissionRate;
    private final double recoveryRate;
    private final double resistanceWeight;
    private final double traditionWeight;
    private final double enactmentThreshold;
    private final double forgetThreshold;

    public BeliefContagionSystem(Config options) {
        this.transmissionRate = options.hasPath("transmission-rate") ? options.getDouble("transmission-rate") : 0.15;
        this.recoveryRate = options.hasPath("recovery-rate") ? options.getDouble("recovery-rate") : 0.03;
        this.resistanceWeight = options.hasPath("resistance-weight") ? options.getDouble("resistance-weight") : 0.3;
        this.traditionWeight = options.hasPath("tradition-weight") ? options.getDouble("tradition-weight") : 0.5;
        this.enactmentThreshold = options.hasPath("enactment-threshold") ? options.getDouble("enactment-threshold") : 0.2;
        this.forgetThreshold = options.hasPath("forget-threshold") ? options.getDouble("forget-threshold") : 0.05;
    }

    @Override
    public String getId() {
        return "belief_contagion";
    }

    @Override
    public String getName() {
        return "Ideological Spread";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        List<Entity> proposed = graph.findEntities(e -> "rules".equals(e.getKind()) && "proposed".equals(e.getStatus()));
        if (proposed.isEmpty()) {
            return SystemResult.dormant("No ideological movements active");
        }
        List<Entity> npcs = graph.findEntities(e -> "npc".equals(e.getKind()) && "alive".equals(e.getStatus()));
        if (npcs.isEmpty()) {
            return SystemResult.dormant("No one left to convert");
        }

        SystemResult.Builder result = SystemResult.builder();
        int shifts = 0;
        boolean enacted = false;
        for (Entity rule : proposed) {
            String immunity = IMMUNITY_PREFIX + rule.getId();
            int believers = 0;
            for (Entity npc : npcs) {
                if (believes(graph, npc, rule)) {
                    believers++;
                    if (Probabilities.rollProbability(random, Math.min(0.95, recoveryRate * (1 + traditionOf(npc)) * modifier), modifier)) {
                        result.remove(RelationshipKinds.BELIEVER_OF, npc.getId(), rule.getId());
                        result.modify(npc.getId(), EntityChanges.create().putTag(immunity, Boolean.TRUE));
                        believers--;
                        shifts++;
                    }
                    continue;
                }
                if (npc.getTags().has(immunity)) continue;

                int infectedContacts = 0;
                for (Entity contact : contactsOf(graph, npc)) {
                    if (believes(graph, contact, rule)) infectedContacts++;
                }
                if (infectedContacts == 0) continue;
                double probability = transmissionRate * infectedContacts * (1 - resistanceOf(npc));
                if (Probabilities.rollProbability(random, Math.min(0.95, probability * modifier), modifier)) {
                    result.relate(RelationshipKinds.BELIEVER_OF, npc.getId(), rule.getId());
                    believers++;
                    shifts++;
                }
            }

            double adoption = (double) believers / npcs.size();
            if (adoption >= enactmentThreshold) {
                result.modify(rule.getId(), EntityChanges.create()
                        .status("enacted")
                        .prominence(Prominence.RECOGNIZED)
                        .description(rule.getDescription() + " This belief has spread widely and is now established tradition."));
                enacted = true;
            } else if (adoption < forgetThreshold) {
                result.modify(rule.getId(), EntityChanges.create()
                        .status("forgotten")
                        .description(rule.getDescription() + " This ideology failed to gain traction."));
            }
        }

        if (enacted) {
            result.pressure("cultural_tension", -10);
            result.pressure("stability", 5);
        }
        return result.build(shifts > 0 || enacted
                ? "Ideological movements: " + shifts + " NPCs shift beliefs"
                : "Belief systems remain stable");
    }

    private static boolean believes(Graph graph, Entity npc, Entity rule) {
        return graph.hasRelationship(npc.getId(), rule.getId(), RelationshipKinds.BELIEVER_OF);
    }

    private static Set<Entity> contactsOf(Graph graph, Entity npc) {
        Set<Entity> contacts = new LinkedHashSet<>();
        contacts.addAll(GraphQueries.getRelated(graph, npc.getId(), RelationshipKinds.FOLLOWER_OF, Direction.BOTH,
                CONTACT_MIN_STRENGTH, 1.0, false));
        for (Entity faction : GraphQueries.getRelated(graph, npc.getId(), RelationshipKinds.MEMBER_OF, Direction.SRC,
                CONTACT_MIN_STRENGTH, 1.0, false)) {
            contacts.addAll(GraphQueries.getFactionMembers(graph, faction.getId(), CONTACT_MIN_STRENGTH));
        }
        contacts.remove(npc);
        return contacts;
    }

    private double resistanceOf(Entity npc) {
        if (npc.getTags().has("radical") || npc.getTags().has("innovator")) return -0.2;
        if (npc.getTags().has("traditional") || npc.getTags().has("conservative")) return resistanceWeight;
        return 0;
    }

    private double traditionOf(Entity npc) {
        return npc.getTags().has("traditional") || npc.getTags().has("conservative") ? traditionWeight : 0;
    }
}

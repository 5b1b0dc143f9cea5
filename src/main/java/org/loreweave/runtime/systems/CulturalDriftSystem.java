package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Living NPCs drift toward the culture most of their social contacts share.
 * <p>
 * Contacts are other living NPCs linked by one of the contact kinds in either direction. An NPC
 * whose contacts hold a strict majority culture different from its own adopts it with probability
 * {@code driftRate * modifier}. Every drift raises cultural tension.
 * </p>
 */
public class CulturalDriftSystem implements ISimulationSystem {

    private final double throttleChance;
    private final double driftRate;
    private final double tensionPerDrift;
    private final Set<String> contactKinds;

    public CulturalDriftSystem(Config options) {
        this.throttleChance = options.hasPath("throttle-chance") ? options.getDouble("throttle-chance") : 0.3;
        this.driftRate = options.hasPath("drift-rate") ? options.getDouble("drift-rate") : 0.1;
        this.tensionPerDrift = options.hasPath("tension-per-drift") ? options.getDouble("tension-per-drift") : 0.5;
        this.contactKinds = Set.copyOf(options.hasPath("contact-kinds")
                ? options.getStringList("contact-kinds")
                : List.of("follower_of", "lover_of", "friend_of", "mentor_of", "family_of"));
    }

    @Override
    public String getId() {
        return "cultural_drift";
    }

    @Override
    public String getName() {
        return "Cultural Drift";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (!Probabilities.rollProbability(random, throttleChance, modifier)) {
            return SystemResult.dormant("Cultural drift dormant");
        }
        SystemResult.Builder result = SystemResult.builder();
        int drifts = 0;
        for (Entity npc : graph.findEntities(e -> "npc".equals(e.getKind()) && "alive".equals(e.getStatus()))) {
            String majority = majorityCulture(graph, npc);
            if (majority == null || majority.equals(npc.getCulture())) continue;
            if (random.nextDouble() < Math.min(0.95, driftRate * modifier)) {
                result.modify(npc.getId(), EntityChanges.create().culture(majority));
                drifts++;
            }
        }
        if (drifts == 0) {
            return SystemResult.dormant("Cultures hold steady");
        }
        result.pressure("cultural_tension", drifts * tensionPerDrift);
        return result.build("Cultural drift: " + drifts + " NPCs adopt the customs of their companions");
    }

    /**
     * Culture held by more than half of the NPC's living contacts, or null.
     */
    String majorityCulture(Graph graph, Entity npc) {
        Map<String, Integer> counts = new TreeMap<>();
        int contacts = 0;
        for (Relationship r : graph.getRelationships()) {
            if (!contactKinds.contains(r.getKind()) || !r.involves(npc.getId())) continue;
            Entity other = graph.getEntity(r.otherEnd(npc.getId()));
            if (other == null || other == npc || !"npc".equals(other.getKind()) || !"alive".equals(other.getStatus())) continue;
            contacts++;
            if (other.getCulture() != null) counts.merge(other.getCulture(), 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() * 2 > contacts) return entry.getKey();
        }
        return null;
    }
}

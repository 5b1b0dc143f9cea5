package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.AffiliationIndex;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.ArrayList;

/**
 * Strengthens relationships through shared context: structural bonds get a flat bonus, other bonds
 * grow when both ends live in the same place, share a faction or share an enemy.
 */
public class RelationshipReinforcementSystem implements ISimulationSystem {

    private final double structuralBonus;
    private final double proximityBonus;
    private final double sharedFactionBonus;
    private final double sharedEnemyBonus;
    private final double cap;

    public RelationshipReinforcementSystem(double structuralBonus, double proximityBonus, double sharedFactionBonus,
                                           double sharedEnemyBonus, double cap) {
        this.structuralBonus = structuralBonus;
        this.proximityBonus = proximityBonus;
        this.sharedFactionBonus = sharedFactionBonus;
        this.sharedEnemyBonus = sharedEnemyBonus;
        this.cap = cap;
    }

    public RelationshipReinforcementSystem(Config options) {
        this(
                options.hasPath("structural-bonus") ? options.getDouble("structural-bonus") : 0.02,
                options.hasPath("proximity-bonus") ? options.getDouble("proximity-bonus") : 0.03,
                options.hasPath("shared-faction-bonus") ? options.getDouble("shared-faction-bonus") : 0.02,
                options.hasPath("shared-enemy-bonus") ? options.getDouble("shared-enemy-bonus") : 0.05,
                options.hasPath("cap") ? options.getDouble("cap") : 1.0);
    }

    @Override
    public String getId() {
        return "relationship_reinforcement";
    }

    @Override
    public String getName() {
        return "Relationship Bonding";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        AffiliationIndex index = AffiliationIndex.of(graph);
        int reinforced = 0;
        for (Relationship r : new ArrayList<>(graph.getRelationships())) {
            if (r.getStrength() >= cap || !graph.hasEntity(r.getSrc()) || !graph.hasEntity(r.getDst())) continue;
            boolean spatial = RelationshipKinds.isSpatial(r.getKind());
            double bonus = 0;
            if (spatial || RelationshipDecaySystem.NARRATIVE_KINDS.contains(r.getKind())) {
                bonus += structuralBonus;
            }
            if (!spatial) {
                if (index.sameLocation(r.getSrc(), r.getDst())) bonus += proximityBonus;
                if (index.shareFaction(r.getSrc(), r.getDst())) bonus += sharedFactionBonus;
                if (index.shareEnemy(r.getSrc(), r.getDst())) bonus += sharedEnemyBonus;
            }
            if (bonus <= 0) continue;
            double next = Math.min(cap, r.getStrength() + bonus * modifier);
            if (next != r.getStrength()) {
                graph.setStrength(r, next);
                reinforced++;
            }
        }
        if (reinforced == 0) {
            return SystemResult.dormant("Relationship bonding dormant");
        }
        return SystemResult.builder().adjusted(reinforced)
                .build("Bonds strengthen through shared experiences (" + reinforced + " reinforced)");
    }
}

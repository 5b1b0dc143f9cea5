package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipCategory;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.AffiliationIndex;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.ArrayList;
import java.util.Set;

/**
 * Weakens every relationship a little each tick. Spatial bonds fade fastest, conflict slowest.
 * Living in the same place halves the decay and a shared faction reduces it by 30%.
 * Strength never drops below the floor, and immutable facts do not decay at all.
 */
public class RelationshipDecaySystem implements ISimulationSystem {

    static final Set<String> NARRATIVE_KINDS = Set.of(RelationshipKinds.MEMBER_OF, RelationshipKinds.LEADER_OF,
            RelationshipKinds.PRACTITIONER_OF, RelationshipKinds.ORIGINATED_IN, RelationshipKinds.FOUNDED_BY, "mastered_by");

    private final double narrativeRate;
    private final double socialRate;
    private final double spatialRate;
    private final double conflictRate;
    private final double proximityReduction;
    private final double sharedFactionReduction;
    private final double floor;

    public RelationshipDecaySystem(double narrativeRate, double socialRate, double spatialRate, double conflictRate,
                                   double proximityReduction, double sharedFactionReduction, double floor) {
        this.narrativeRate = narrativeRate;
        this.socialRate = socialRate;
        this.spatialRate = spatialRate;
        this.conflictRate = conflictRate;
        this.proximityReduction = proximityReduction;
        this.sharedFactionReduction = sharedFactionReduction;
        this.floor = floor;
    }

    public RelationshipDecaySystem(Config options) {
        this(
                options.hasPath("narrative-rate") ? options.getDouble("narrative-rate") : 0.01,
                options.hasPath("social-rate") ? options.getDouble("social-rate") : 0.02,
                options.hasPath("spatial-rate") ? options.getDouble("spatial-rate") : 0.05,
                options.hasPath("conflict-rate") ? options.getDouble("conflict-rate") : 0.005,
                options.hasPath("proximity-reduction") ? options.getDouble("proximity-reduction") : 0.5,
                options.hasPath("shared-faction-reduction") ? options.getDouble("shared-faction-reduction") : 0.3,
                options.hasPath("floor") ? options.getDouble("floor") : 0.1);
    }

    @Override
    public String getId() {
        return "relationship_decay";
    }

    @Override
    public String getName() {
        return "Relationship Entropy";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        AffiliationIndex index = AffiliationIndex.of(graph);
        int decayed = 0;
        for (Relationship r : new ArrayList<>(graph.getRelationships())) {
            if (r.getCategory() == RelationshipCategory.IMMUTABLE_FACT || r.getStrength() <= floor) continue;
            double rate = baseRate(r.getKind()) * modifier;
            if (index.sameLocation(r.getSrc(), r.getDst())) rate *= 1.0 - proximityReduction;
            if (index.shareFaction(r.getSrc(), r.getDst())) rate *= 1.0 - sharedFactionReduction;
            double next = Math.max(floor, r.getStrength() - rate);
            if (next != r.getStrength()) {
                graph.setStrength(r, next);
                decayed++;
            }
        }
        if (decayed == 0) {
            return SystemResult.dormant("Relationship decay stable");
        }
        return SystemResult.builder().adjusted(decayed)
                .build("Relationships weaken without reinforcement (" + decayed + " decayed)");
    }

    private double baseRate(String kind) {
        if (NARRATIVE_KINDS.contains(kind)) return narrativeRate;
        if (RelationshipKinds.isSpatial(kind)) return spatialRate;
        if (RelationshipKinds.ENEMY_OF.equals(kind) || RelationshipKinds.AT_WAR_WITH.equals(kind)) return conflictRate;
        return socialRate;
    }
}

package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

/**
 * Compares each settlement's adjacent resource locations with its population.
 * <p>
 * Supply is {@code resources / residents}. A thriving settlement below the strain ratio may wane and
 * raises resource scarcity; a waning settlement with full supply may recover and relieves it.
 * </p>
 */
public class ResourceFlowSystem implements ISimulationSystem {

    private final double throttleChance;
    private final String settlementSubtype;
    private final String resourceTag;
    private final double strainRatio;
    private final double waneChance;
    private final double recoveryChance;
    private final double strainPressure;
    private final double reliefPressure;

    public ResourceFlowSystem(Config options) {
        this.throttleChance = options.hasPath("throttle-chance") ? options.getDouble("throttle-chance") : 0.5;
        this.settlementSubtype = options.hasPath("settlement-subtype") ? options.getString("settlement-subtype") : "colony";
        this.resourceTag = options.hasPath("resource-tag") ? options.getString("resource-tag") : "resource";
        this.strainRatio = options.hasPath("strain-ratio") ? options.getDouble("strain-ratio") : 0.5;
        this.waneChance = options.hasPath("wane-chance") ? options.getDouble("wane-chance") : 0.3;
        this.recoveryChance = options.hasPath("recovery-chance") ? options.getDouble("recovery-chance") : 0.3;
        this.strainPressure = options.hasPath("strain-pressure") ? options.getDouble("strain-pressure") : 3.0;
        this.reliefPressure = options.hasPath("relief-pressure") ? options.getDouble("relief-pressure") : -2.0;
    }

    @Override
    public String getId() {
        return "resource_flow";
    }

    @Override
    public String getName() {
        return "Resource Flow";
    }

    /**
     * Resource supply of a settlement, or -1 if nobody lives there.
     */
    public double supplyOf(Graph graph, Entity settlement) {
        int residents = GraphQueries.getResidents(graph, settlement.getId()).size();
        if (residents == 0) return -1;
        long resources = GraphQueries.getRelated(graph, settlement.getId(), RelationshipKinds.ADJACENT_TO, Direction.BOTH)
                .stream().filter(e -> "location".equals(e.getKind()) && e.getTags().has(resourceTag)).count();
        return (double) resources / residents;
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (!Probabilities.rollProbability(random, throttleChance, modifier)) {
            return SystemResult.dormant("Resource flow dormant");
        }
        SystemResult.Builder result = SystemResult.builder();
        int strained = 0;
        int recovered = 0;
        for (Entity settlement : graph.findEntities(e -> e.is("location", settlementSubtype))) {
            double supply = supplyOf(graph, settlement);
            if (supply < 0) continue;
            if (supply < strainRatio && "thriving".equals(settlement.getStatus())) {
                if (Probabilities.rollProbability(random, waneChance, modifier)) {
                    result.modify(settlement.getId(), EntityChanges.create()
                            .status("waning")
                            .description(settlement.getDescription() + " Dwindling supplies strain the settlement."));
                    result.pressure("resource_scarcity", strainPressure);
                    strained++;
                }
            } else if (supply >= 1.0 && "waning".equals(settlement.getStatus())) {
                if (Probabilities.rollProbability(random, recoveryChance, modifier)) {
                    result.modify(settlement.getId(), EntityChanges.create()
                            .status("thriving")
                            .description(settlement.getDescription() + " Restored supply lines revive the settlement."));
                    result.pressure("resource_scarcity", reliefPressure);
                    recovered++;
                }
            }
        }
        if (strained + recovered == 0) {
            return SystemResult.dormant("Supply lines hold steady");
        }
        return result.build("Resource flow: " + strained + " settlements strained, " + recovered + " recovered");
    }
}

package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.loreweave.runtime.spi.ISimulationSystem;
import org.loreweave.runtime.systems.contagion.GraphContagionSystem;
import org.loreweave.runtime.systems.trigger.ThresholdTriggerSystem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for creating simulation systems.
 * It uses a registry to map type names to creators.
 */
public class SystemFactory {

    private static final Map<String, ISystemCreator> registry = new HashMap<>();

    static {
        register("relationship_decay", RelationshipDecaySystem::new);
        register("relationship_reinforcement", RelationshipReinforcementSystem::new);
        register("relationship_formation", RelationshipFormationSystem::new);
        register("graph-contagion", GraphContagionSystem::new);
        register("resource_flow", ResourceFlowSystem::new);
        register("cultural_drift", CulturalDriftSystem::new);
        register("prominence_evolution", ProminenceEvolutionSystem::new);
        register("alliance_formation", AllianceFormationSystem::new);
        register("legend_crystallization", LegendCrystallizationSystem::new);
        register("thermal_cascade", ThermalCascadeSystem::new);
        register("belief_contagion", BeliefContagionSystem::new);
        register("succession_vacuum", SuccessionVacuumSystem::new);
        register("threshold-trigger", ThresholdTriggerSystem::new);
        register("relationship_culling", RelationshipCullingSystem::new);
    }

    /**
     * Registers a new system creator.
     * @param type The type of the system.
     * @param creator The creator for the system.
     */
    public static void register(String type, ISystemCreator creator) {
        registry.put(type.toLowerCase(), creator);
    }

    /**
     * Creates a new simulation system.
     * @param type The type of the system to create.
     * @param options The system's options, may be null.
     * @return The created system.
     * @throws IllegalArgumentException if the system type is unknown.
     */
    public static ISimulationSystem create(String type, Config options) {
        Objects.requireNonNull(type, "System type cannot be null.");
        ISystemCreator creator = registry.get(type.toLowerCase());
        if (creator == null) {
            throw new IllegalArgumentException("Unknown system type: " + type);
        }
        return creator.create(options != null ? options : ConfigFactory.empty());
    }

    /**
     * Creates the pipeline from a list of system blocks, each carrying a {@code type} and its options.
     * Blocks with {@code enabled = false} are skipped.
     */
    public static List<ISimulationSystem> createAll(List<? extends Config> blocks) {
        List<ISimulationSystem> systems = new ArrayList<>();
        for (Config block : blocks) {
            if (block.hasPath("enabled") && !block.getBoolean("enabled")) continue;
            systems.add(create(block.getString("type"), block));
        }
        return systems;
    }
}

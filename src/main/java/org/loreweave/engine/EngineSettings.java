package org.loreweave.engine;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Run limits and budgets of a {@link WorldEngine}, read from {@code loreweave.engine}.
 *
 * @param seed seed of the root random provider
 * @param ticksPerEpoch ticks run before an epoch closes
 * @param epochsPerEra epochs spent in each era
 * @param maxTicks hard tick limit
 * @param targetEntitiesPerKind population target for every growth kind
 * @param growthKinds entity kinds counted for growth targets and template deficits
 * @param maxRelationshipsPerTick relationships systems may commit in one tick
 * @param maxPressureDeltaPerTick largest pressure change applied by one flush
 * @param aggressiveSystemThreshold relationships a single system may create before it is reported
 */
public record EngineSettings(long seed,
                             int ticksPerEpoch,
                             int epochsPerEra,
                             long maxTicks,
                             int targetEntitiesPerKind,
                             List<String> growthKinds,
                             int maxRelationshipsPerTick,
                             double maxPressureDeltaPerTick,
                             int aggressiveSystemThreshold) {

    public static final List<String> DEFAULT_GROWTH_KINDS = List.of("npc", "faction", "rules", "abilities", "location");

    public EngineSettings {
        growthKinds = List.copyOf(growthKinds);
        if (ticksPerEpoch < 1) throw new IllegalArgumentException("ticks-per-epoch must be >= 1");
        if (epochsPerEra < 1) throw new IllegalArgumentException("epochs-per-era must be >= 1");
        if (maxTicks < 0) throw new IllegalArgumentException("max-ticks must not be negative");
        if (targetEntitiesPerKind < 1) throw new IllegalArgumentException("target-entities-per-kind must be >= 1");
        if (growthKinds.isEmpty()) throw new IllegalArgumentException("growth-kinds must not be empty");
        if (maxRelationshipsPerTick < 0) throw new IllegalArgumentException("max-relationships-per-tick must not be negative");
        if (maxPressureDeltaPerTick <= 0) throw new IllegalArgumentException("max-pressure-delta-per-tick must be positive");
    }

    public static EngineSettings fromConfig(Config options) {
        return new EngineSettings(
                options.hasPath("seed") ? options.getLong("seed") : 42L,
                options.hasPath("ticks-per-epoch") ? options.getInt("ticks-per-epoch") : 10,
                options.hasPath("epochs-per-era") ? options.getInt("epochs-per-era") : 2,
                options.hasPath("max-ticks") ? options.getLong("max-ticks") : 500L,
                options.hasPath("target-entities-per-kind") ? options.getInt("target-entities-per-kind") : 30,
                options.hasPath("growth-kinds") ? options.getStringList("growth-kinds") : DEFAULT_GROWTH_KINDS,
                options.hasPath("max-relationships-per-tick") ? options.getInt("max-relationships-per-tick") : 50,
                options.hasPath("max-pressure-delta-per-tick") ? options.getDouble("max-pressure-delta-per-tick") : 20.0,
                options.hasPath("aggressive-system-threshold") ? options.getInt("aggressive-system-threshold") : 500);
    }

    public EngineSettings withSeed(long newSeed) {
        return new EngineSettings(newSeed, ticksPerEpoch, epochsPerEra, maxTicks, targetEntitiesPerKind, growthKinds,
                maxRelationshipsPerTick, maxPressureDeltaPerTick, aggressiveSystemThreshold);
    }

    public EngineSettings withMaxTicks(long newMaxTicks) {
        return new EngineSettings(seed, ticksPerEpoch, epochsPerEra, newMaxTicks, targetEntitiesPerKind, growthKinds,
                maxRelationshipsPerTick, maxPressureDeltaPerTick, aggressiveSystemThreshold);
    }

    /**
     * @return entity count at which the run stops growing
     */
    public int targetPopulation() {
        return targetEntitiesPerKind * growthKinds.size();
    }
}

package org.loreweave.runtime.discovery;

import com.typesafe.config.Config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Domain settings of the emergent discovery gate and analyses.
 *
 * @param maxLocations hard cap on the number of locations
 * @param maxDiscoveriesPerEpoch discoveries allowed before the next epoch reset
 * @param minTicksBetweenDiscoveries cooldown since the last discovery
 * @param explorerSubtypes npc subtypes able to discover places
 * @param explorerActiveStatus status an explorer must have
 * @param eraChance discovery roll chance per era id
 * @param defaultEraChance chance for eras without an entry
 * @param settlementSubtypes location subtypes counted as settlements
 * @param thrivingStatus settlement status counted as thriving
 * @param waningStatus settlement status counted as waning
 * @param foodResources specific resource names picked for a generic food deficit
 * @param anomalySubtype location subtype counted as a magical anomaly
 */
public record DiscoveryConfig(int maxLocations,
                              int maxDiscoveriesPerEpoch,
                              long minTicksBetweenDiscoveries,
                              List<String> explorerSubtypes,
                              String explorerActiveStatus,
                              Map<String, Double> eraChance,
                              double defaultEraChance,
                              List<String> settlementSubtypes,
                              String thrivingStatus,
                              String waningStatus,
                              List<String> foodResources,
                              String anomalySubtype) {

    public DiscoveryConfig {
        explorerSubtypes = List.copyOf(explorerSubtypes);
        eraChance = Map.copyOf(eraChance);
        settlementSubtypes = List.copyOf(settlementSubtypes);
        foodResources = List.copyOf(foodResources);
        if (maxLocations < 0 || maxDiscoveriesPerEpoch < 0 || minTicksBetweenDiscoveries < 0) {
            throw new IllegalArgumentException("Discovery limits must not be negative");
        }
    }

    /**
     * Reads the settings from a {@code discovery} block, falling back to defaults for missing keys.
     */
    public static DiscoveryConfig fromConfig(Config options) {
        Map<String, Double> eraChance = new HashMap<>();
        if (options.hasPath("era-chance")) {
            Config chances = options.getConfig("era-chance");
            for (String era : chances.root().keySet()) {
                eraChance.put(era, chances.getDouble(era));
            }
        }
        return new DiscoveryConfig(
                options.hasPath("max-locations") ? options.getInt("max-locations") : 40,
                options.hasPath("max-discoveries-per-epoch") ? options.getInt("max-discoveries-per-epoch") : 3,
                options.hasPath("min-ticks-between-discoveries") ? options.getLong("min-ticks-between-discoveries") : 5,
                options.hasPath("explorer-subtypes") ? options.getStringList("explorer-subtypes") : List.of("hero", "outlaw"),
                options.hasPath("explorer-active-status") ? options.getString("explorer-active-status") : "alive",
                eraChance,
                options.hasPath("default-era-chance") ? options.getDouble("default-era-chance") : 0.10,
                options.hasPath("settlement-subtypes") ? options.getStringList("settlement-subtypes") : List.of("colony"),
                options.hasPath("thriving-status") ? options.getString("thriving-status") : "thriving",
                options.hasPath("waning-status") ? options.getString("waning-status") : "waning",
                options.hasPath("food-resources") ? options.getStringList("food-resources") : List.of("krill", "fish"),
                options.hasPath("anomaly-subtype") ? options.getString("anomaly-subtype") : "anomaly");
    }

    public double eraChance(String eraId) {
        return eraChance.getOrDefault(eraId, defaultEraChance);
    }
}

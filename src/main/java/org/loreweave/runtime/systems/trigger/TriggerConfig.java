package org.loreweave.runtime.systems.trigger;

import com.typesafe.config.Config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of one threshold trigger.
 * <p>
 * Example block:
 * <pre>
 * {
 *   type = threshold-trigger
 *   id = war_brewing
 *   filter { kind = faction, not-has-tag = war_brewing }
 *   conditions = [{ type = relationship-count, relationship-kind = at_war_with, min-count = 1 }]
 *   cluster-mode = by-relationship
 *   cluster-relationship-kind = at_war_with
 *   min-cluster-size = 2
 *   actions = [{ type = set-cluster-tag, tag = war_brewing }]
 * }
 * </pre>
 */
public record TriggerConfig(
        String id,
        String name,
        EntityFilter filter,
        List<TriggerCondition> conditions,
        List<TriggerAction> actions,
        ClusterMode clusterMode,
        String clusterRelationshipKind,
        int minClusterSize,
        double throttleChance,
        String cooldownTag,
        Map<String, Double> pressureChanges) {

    public TriggerConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Trigger id cannot be blank");
        }
        if (filter == null) {
            throw new IllegalArgumentException("Trigger '" + id + "' needs an entity filter");
        }
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("Trigger '" + id + "' needs at least one action");
        }
        if (clusterMode == ClusterMode.BY_RELATIONSHIP && clusterRelationshipKind == null) {
            throw new IllegalArgumentException("Trigger '" + id + "' clusters by relationship but names no relationship kind");
        }
        name = name == null ? id : name;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        actions = List.copyOf(actions);
        clusterMode = clusterMode == null ? ClusterMode.INDIVIDUAL : clusterMode;
        pressureChanges = pressureChanges == null ? Map.of() : Map.copyOf(pressureChanges);
    }

    /**
     * Reads a trigger block.
     *
     * @throws IllegalArgumentException on missing or inconsistent settings
     */
    public static TriggerConfig fromConfig(Config options) {
        List<TriggerCondition> conditions = new ArrayList<>();
        if (options.hasPath("conditions")) {
            for (Config c : options.getConfigList("conditions")) {
                conditions.add(TriggerCondition.fromConfig(c));
            }
        }
        List<TriggerAction> actions = new ArrayList<>();
        if (options.hasPath("actions")) {
            for (Config a : options.getConfigList("actions")) {
                actions.add(TriggerAction.fromConfig(a));
            }
        }
        Map<String, Double> pressureChanges = new LinkedHashMap<>();
        if (options.hasPath("pressure-changes")) {
            Config block = options.getConfig("pressure-changes");
            for (String key : block.root().keySet()) {
                pressureChanges.put(key, block.getDouble(key));
            }
        }
        String id = options.getString("id");
        return new TriggerConfig(
                id,
                stringOr(options, "name"),
                EntityFilter.fromConfig(options.getConfig("filter")),
                conditions,
                actions,
                options.hasPath("cluster-mode") ? enumOf(ClusterMode.class, options.getString("cluster-mode")) : ClusterMode.INDIVIDUAL,
                stringOr(options, "cluster-relationship-kind"),
                options.hasPath("min-cluster-size") ? options.getInt("min-cluster-size") : 1,
                options.hasPath("throttle-chance") ? options.getDouble("throttle-chance") : 1.0,
                stringOr(options, "cooldown-tag"),
                pressureChanges);
    }

    static <E extends Enum<E>> E enumOf(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " value: " + value, e);
        }
    }

    static String stringOr(Config options, String path) {
        return options.hasPath(path) ? options.getString(path) : null;
    }
}

package org.loreweave.runtime.pressure;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.GraphQueries;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Registry of pressure growth functions, selected by type name from configuration.
 * Subtype and tag names default to the ones of the bundled world and can be overridden per entry.
 */
public final class PressureGrowthFunctions {

    private static final Map<String, Function<Config, IPressureGrowth>> registry = new HashMap<>();

    static {
        register("constant", options -> {
            double value = doubleOr(options, "value", 0.0);
            return graph -> value;
        });
        register("colony-resource-strain", PressureGrowthFunctions::resourceStrain);
        register("hostility-ratio", PressureGrowthFunctions::hostilityRatio);
        register("magic-saturation", PressureGrowthFunctions::magicSaturation);
        register("cultural-fragmentation", PressureGrowthFunctions::culturalFragmentation);
        register("cooperation", PressureGrowthFunctions::cooperation);
        register("external-presence", PressureGrowthFunctions::externalPresence);
    }

    private PressureGrowthFunctions() {}

    /**
     * Registers a growth function creator.
     *
     * @param type the type name, matched case-insensitively
     * @param creator creates the function from its options block (may receive null)
     */
    public static void register(String type, Function<Config, IPressureGrowth> creator) {
        registry.put(type.toLowerCase(), creator);
    }

    /**
     * Creates a growth function.
     *
     * @throws IllegalArgumentException if the type is unknown
     */
    public static IPressureGrowth create(String type, Config options) {
        Objects.requireNonNull(type, "Growth type cannot be null.");
        Function<Config, IPressureGrowth> creator = registry.get(type.toLowerCase());
        if (creator == null) {
            throw new IllegalArgumentException("Unknown pressure growth type: " + type);
        }
        return creator.apply(options);
    }

    // Colonies short of adjacent resource locations push scarcity up; geographic features relieve it.
    private static IPressureGrowth resourceStrain(Config options) {
        String settlement = stringOr(options, "settlement-subtype", "colony");
        String resourceTag = stringOr(options, "resource-tag", "resource");
        String reliefSubtype = stringOr(options, "relief-subtype", "geographic_feature");
        return graph -> {
            List<Entity> colonies = graph.findEntities(e -> e.is("location", settlement));
            if (colonies.isEmpty()) return 0.0;
            double totalRatio = 0;
            int evaluated = 0;
            for (Entity colony : colonies) {
                int residents = GraphQueries.getResidents(graph, colony.getId()).size();
                if (residents == 0) continue;
                long resources = GraphQueries.getRelated(graph, colony.getId(), RelationshipKinds.ADJACENT_TO, Direction.BOTH)
                        .stream().filter(e -> "location".equals(e.getKind()) && e.getTags().has(resourceTag)).count();
                totalRatio += Math.min(1.0, (double) resources / residents);
                evaluated++;
            }
            if (evaluated == 0) return 0.0;
            double scarcity = (1 - totalRatio / evaluated) * 8;
            double colonyPressure = colonies.size() * 0.3;
            double relief = graph.getEntityCount("location", reliefSubtype) * 0.4;
            return Math.max(0, scarcity + colonyPressure - relief);
        };
    }

    // Hostile share of social bonds, plus a capped war bonus, minus hero suppression.
    private static IPressureGrowth hostilityRatio(Config options) {
        String heroSubtype = stringOr(options, "hero-subtype", "hero");
        return graph -> {
            int hostile = 0;
            int friendly = 0;
            int wars = 0;
            for (Relationship r : graph.getRelationships()) {
                String kind = r.getKind();
                if (RelationshipKinds.isConflict(kind)) hostile++;
                if (RelationshipKinds.ALLIED_WITH.equals(kind) || "trades_with".equals(kind)
                        || RelationshipKinds.MEMBER_OF.equals(kind)) friendly++;
                if (RelationshipKinds.AT_WAR_WITH.equals(kind)) wars++;
            }
            if (hostile + friendly == 0) return 0.0;
            double hostileRatio = (double) hostile / (hostile + friendly);
            double warBonus = Math.min(wars * 2, 5);
            double heroSuppression = graph.getEntityCount("npc", heroSubtype) * 0.4;
            return Math.max(0, hostileRatio * 6 + warBonus - heroSuppression);
        };
    }

    private static IPressureGrowth magicSaturation(Config options) {
        String anomalySubtype = stringOr(options, "anomaly-subtype", "anomaly");
        String magicSubtype = stringOr(options, "magic-subtype", "magic");
        return graph -> {
            int total = graph.getEntityCount();
            if (total == 0) return 0.0;
            double anomalyDensity = (double) graph.getEntityCount("location", anomalySubtype) / total * 20;
            int magic = graph.getEntityCount("abilities", magicSubtype);
            int abilities = graph.getEntityCount("abilities", null);
            double magicRatio = abilities > 0 ? (double) magic / abilities : 0;
            return Math.min(anomalyDensity * 2.5, 5) + Math.min(magic * 0.5, 10) + magicRatio * 5;
        };
    }

    private static IPressureGrowth culturalFragmentation(Config options) {
        String settlement = stringOr(options, "settlement-subtype", "colony");
        return graph -> {
            int factions = graph.getEntityCount("faction", null);
            if (factions == 0) return 0.0;
            long splinters = graph.getRelationships().stream().filter(r -> "splinter_of".equals(r.getKind())).count();
            List<Entity> colonies = graph.findEntities(e -> e.is("location", settlement));
            long isolated = colonies.stream()
                    .filter(c -> c.getTags().has("isolated") || c.getTags().has("divergent")).count();
            double isolationRatio = colonies.isEmpty() ? 0 : (double) isolated / colonies.size();
            double factionPressure = graph.getEntityCount("faction", "political") * 0.4;
            long alliances = graph.getRelationships().stream()
                    .filter(r -> RelationshipKinds.ALLIED_WITH.equals(r.getKind())).count();
            double rules = graph.getEntityCount("rules", "social") * 0.2;
            double growth = (double) splinters / factions * 8 + isolationRatio * 4 + factionPressure
                    - alliances * 0.3 - rules;
            return Math.max(0, Math.min(growth, 8));
        };
    }

    private static IPressureGrowth cooperation(Config options) {
        String leaderSubtype = stringOr(options, "leader-subtype", "mayor");
        String aliveStatus = stringOr(options, "alive-status", "alive");
        return graph -> {
            int alliances = 0;
            int conflicts = 0;
            int leadership = 0;
            for (Relationship r : graph.getRelationships()) {
                if (RelationshipKinds.ALLIED_WITH.equals(r.getKind())) alliances++;
                if (RelationshipKinds.isConflict(r.getKind())) conflicts++;
                if (RelationshipKinds.LEADER_OF.equals(r.getKind())) leadership++;
            }
            double coopRatio = alliances + conflicts > 0 ? (double) alliances / (alliances + conflicts) : 0.5;
            List<Entity> leaders = graph.findEntities(e -> e.is("npc", leaderSubtype));
            long alive = leaders.stream().filter(e -> aliveStatus.equals(e.getStatus())).count();
            double leadershipRatio = leaders.isEmpty() ? 1.0 : (double) alive / leaders.size();
            double penalty = (leaders.size() - alive) * 0.2;
            return Math.max(0, coopRatio * 7 + leadershipRatio * 3 + leadership * 0.3 - penalty);
        };
    }

    private static IPressureGrowth externalPresence(Config options) {
        String invaderSubtype = stringOr(options, "invader-subtype", "orca");
        return graph -> {
            long tagged = graph.getEntities().stream()
                    .filter(e -> e.getTags().has("external") || e.getTags().has("invader")).count();
            return tagged * 10 + graph.getEntityCount("npc", invaderSubtype) * 0.8;
        };
    }

    private static String stringOr(Config options, String path, String fallback) {
        return options != null && options.hasPath(path) ? options.getString(path) : fallback;
    }

    private static double doubleOr(Config options, String path, double fallback) {
        return options != null && options.hasPath(path) ? options.getDouble(path) : fallback;
    }
}

package org.loreweave.runtime.systems.contagion;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.TagMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of one graph contagion system.
 * <p>
 * Example block:
 * <pre>
 * {
 *   type = graph-contagion
 *   id = conflict_contagion
 *   entity-kind = npc
 *   entity-status = alive
 *   marker { type = relationship, relationship-kind = enemy_of }
 *   vectors = [{ relationship-kind = follower_of, direction = both, min-strength = 0.3 }]
 *   transmission { base-rate = 0.02, contact-multiplier = 0.08 }
 *   infection { type = create-relationship, relationship-kind = enemy_of, target = contagion-source }
 *   recovery { base-rate = 0.05, immunity-tag = peacemaker }
 * }
 * </pre>
 */
public record ContagionConfig(
        String id,
        String name,
        String entityKind,
        String entityStatus,
        Marker marker,
        List<Vector> vectors,
        double baseRate,
        double contactMultiplier,
        double maxProbability,
        Infection infection,
        Recovery recovery,
        Map<String, Double> susceptibility,
        double throttleChance,
        long cooldown,
        Map<String, Double> pressureChanges) {

    public enum MarkerType { RELATIONSHIP, TAG }

    public enum InfectionType { CREATE_RELATIONSHIP, ADD_TAG }

    /**
     * Endpoint of a relationship created on infection: the infected contact, or one of the targets
     * that marks the contact as infected.
     */
    public enum InfectionTarget { SOURCE, CONTAGION_SOURCE }

    /**
     * What marks an entity as infected: an outgoing relationship of a kind, or a tag.
     */
    public record Marker(MarkerType type, String relationshipKind, String tag) {}

    public record Vector(String relationshipKind, Direction direction, double minStrength) {}

    public record Infection(InfectionType type, String relationshipKind, Double strength, InfectionTarget target,
                            String tagKey, Object tagValue) {}

    /**
     * @param bonusTags additional recovery probability per tag
     */
    public record Recovery(double baseRate, String immunityTag, Map<String, Double> bonusTags) {}

    public ContagionConfig {
        Objects.requireNonNull(id, "Contagion id cannot be null.");
        Objects.requireNonNull(entityKind, "Contagion entity kind cannot be null.");
        Objects.requireNonNull(marker, "Contagion marker cannot be null.");
        Objects.requireNonNull(infection, "Contagion infection cannot be null.");
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Contagion '" + id + "' needs at least one transmission vector");
        }
        if (marker.type() == MarkerType.RELATIONSHIP && marker.relationshipKind() == null) {
            throw new IllegalArgumentException("Contagion '" + id + "' relationship marker needs a relationship-kind");
        }
        if (marker.type() == MarkerType.TAG && marker.tag() == null) {
            throw new IllegalArgumentException("Contagion '" + id + "' tag marker needs a tag");
        }
        if (infection.type() == InfectionType.CREATE_RELATIONSHIP && infection.relationshipKind() == null) {
            throw new IllegalArgumentException("Contagion '" + id + "' infection needs a relationship-kind");
        }
        if (infection.type() == InfectionType.ADD_TAG && infection.tagKey() == null) {
            throw new IllegalArgumentException("Contagion '" + id + "' infection needs a tag-key");
        }
        if (infection.type() == InfectionType.ADD_TAG) {
            TagMap.checkValue(infection.tagKey(), infection.tagValue());
        }
        if (infection.target() == InfectionTarget.CONTAGION_SOURCE && marker.type() != MarkerType.RELATIONSHIP) {
            throw new IllegalArgumentException("Contagion '" + id + "' can only target the contagion source with a relationship marker");
        }
    }

    /**
     * Reads a contagion block.
     *
     * @throws IllegalArgumentException on missing or inconsistent settings
     */
    public static ContagionConfig fromConfig(Config options) {
        String id = options.getString("id");
        Config markerConfig = options.getConfig("marker");
        Marker marker = new Marker(
                enumOf(MarkerType.class, markerConfig.getString("type")),
                stringOr(markerConfig, "relationship-kind", null),
                stringOr(markerConfig, "tag", null));

        List<Vector> vectors = new ArrayList<>();
        if (options.hasPath("vectors")) {
            for (Config v : options.getConfigList("vectors")) {
                vectors.add(new Vector(
                        v.getString("relationship-kind"),
                        v.hasPath("direction") ? enumOf(Direction.class, v.getString("direction")) : Direction.BOTH,
                        doubleOr(v, "min-strength", 0.0)));
            }
        }

        Config transmission = options.hasPath("transmission") ? options.getConfig("transmission") : null;
        Config infectionConfig = options.getConfig("infection");
        Infection infection = new Infection(
                enumOf(InfectionType.class, infectionConfig.getString("type")),
                stringOr(infectionConfig, "relationship-kind", null),
                infectionConfig.hasPath("strength") ? infectionConfig.getDouble("strength") : null,
                infectionConfig.hasPath("target")
                        ? enumOf(InfectionTarget.class, infectionConfig.getString("target")) : InfectionTarget.SOURCE,
                stringOr(infectionConfig, "tag-key", null),
                infectionConfig.hasPath("tag-value") ? infectionConfig.getAnyRef("tag-value") : Boolean.TRUE);

        Recovery recovery = null;
        if (options.hasPath("recovery")) {
            Config r = options.getConfig("recovery");
            recovery = new Recovery(doubleOr(r, "base-rate", 0.0), stringOr(r, "immunity-tag", null),
                    readDoubles(r, "bonus-tags"));
        }

        return new ContagionConfig(
                id,
                stringOr(options, "name", id),
                options.getString("entity-kind"),
                stringOr(options, "entity-status", null),
                marker,
                vectors,
                transmission != null ? doubleOr(transmission, "base-rate", 0.0) : 0.0,
                transmission != null ? doubleOr(transmission, "contact-multiplier", 0.0) : 0.0,
                transmission != null ? doubleOr(transmission, "max-probability", 0.95) : 0.95,
                infection,
                recovery,
                readDoubles(options, "susceptibility"),
                doubleOr(options, "throttle-chance", 1.0),
                options.hasPath("cooldown") ? options.getLong("cooldown") : 0L,
                readDoubles(options, "pressure-changes"));
    }

    private static <E extends Enum<E>> E enumOf(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " value: " + value, e);
        }
    }

    private static Map<String, Double> readDoubles(Config options, String path) {
        Map<String, Double> result = new LinkedHashMap<>();
        if (options.hasPath(path)) {
            Config block = options.getConfig(path);
            for (String key : block.root().keySet()) {
                result.put(key, block.getDouble(key));
            }
        }
        return result;
    }

    private static String stringOr(Config options, String path, String fallback) {
        return options.hasPath(path) ? options.getString(path) : fallback;
    }

    private static double doubleOr(Config options, String path, double fallback) {
        return options.hasPath(path) ? options.getDouble(path) : fallback;
    }
}

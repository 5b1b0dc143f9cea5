package org.loreweave.runtime.model;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Static knowledge about relationship kinds: default strengths, categories, lineage distance ranges,
 * contradictions and per-entity warning thresholds.
 */
public final class RelationshipKinds {

    private RelationshipKinds() {}

    /** Kind names used across templates and systems. */
    public static final String MEMBER_OF = "member_of";
    public static final String LEADER_OF = "leader_of";
    public static final String RESIDENT_OF = "resident_of";
    public static final String FOLLOWER_OF = "follower_of";
    public static final String RIVAL_OF = "rival_of";
    public static final String ENEMY_OF = "enemy_of";
    public static final String LOVER_OF = "lover_of";
    public static final String ALLIED_WITH = "allied_with";
    public static final String AT_WAR_WITH = "at_war_with";
    public static final String ADJACENT_TO = "adjacent_to";
    public static final String DISCOVERED_BY = "discovered_by";
    public static final String EXPLORER_OF = "explorer_of";
    public static final String COMMEMORATES = "commemorates";
    public static final String ORIGINATED_IN = "originated_in";
    public static final String MANIFESTS_AT = "manifests_at";
    public static final String PRACTITIONER_OF = "practitioner_of";
    public static final String BELIEVER_OF = "believer_of";
    public static final String FOUNDED_BY = "founded_by";
    public static final String SEEKS = "seeks";
    public static final String OCCUPIES = "occupies";

    private static final Map<String, Double> DEFAULT_STRENGTH = Map.ofEntries(
            entry(MEMBER_OF, 1.0), entry(LEADER_OF, 1.0),
            entry(PRACTITIONER_OF, 0.9), entry(ORIGINATED_IN, 0.9), entry(FOUNDED_BY, 0.9), entry("mastered_by", 0.9),
            entry("split_from", 0.8),
            entry("controls", 0.7), entry(COMMEMORATES, 0.7), entry("ally_of", 0.7), entry(ENEMY_OF, 0.7),
            entry("stronghold_of", 0.7), entry("supersedes", 0.7), entry(AT_WAR_WITH, 0.7), entry(ALLIED_WITH, 0.7),
            entry(FOLLOWER_OF, 0.6), entry(MANIFESTS_AT, 0.6), entry("adherent_of", 0.6), entry("derived_from", 0.6),
            entry("friend_of", 0.5), entry(RIVAL_OF, 0.5), entry("mentor_of", 0.5), entry("family_of", 0.5),
            entry(LOVER_OF, 0.5), entry("weaponized_by", 0.5), entry("kept_secret_by", 0.5),
            entry("related_to", 0.5), entry("inspired_by", 0.5),
            entry(RESIDENT_OF, 0.3), entry("located_at", 0.3), entry("slumbers_beneath", 0.3),
            entry(DISCOVERED_BY, 0.2), entry(ADJACENT_TO, 0.2), entry("contains", 0.2), entry("contained_by", 0.2)
    );

    private static final Set<String> IMMUTABLE_FACTS = Set.of(
            "derived_from", "related_to", "split_from", "supersedes", "inspired_by", ADJACENT_TO,
            "contained_by", "contains", "part_of", FOUNDED_BY, "created_by", DISCOVERED_BY, COMMEMORATES);

    private static final Set<String> POLITICAL = Set.of(
            "trades_with", AT_WAR_WITH, "ally_of", ALLIED_WITH, ENEMY_OF, "controls", "stronghold_of");

    private static final Set<String> INSTITUTIONAL = Set.of(
            MEMBER_OF, LEADER_OF, PRACTITIONER_OF, "adherent_of", "weaponized_by", "kept_secret_by",
            ORIGINATED_IN, BELIEVER_OF);

    private static final Map<String, double[]> LINEAGE_DISTANCE = Map.of(
            "derived_from", new double[]{0.05, 0.6},
            "related_to", new double[]{0.3, 0.7},
            "split_from", new double[]{0.15, 0.8},
            "supersedes", new double[]{0.1, 0.5},
            "inspired_by", new double[]{0.3, 0.6},
            "part_of", new double[]{0.0, 0.3},
            ADJACENT_TO, new double[]{0.0, 0.5},
            "contains", new double[]{0.0, 0.3},
            "contained_by", new double[]{0.0, 0.3});

    private static final Map<String, Set<String>> CONTRADICTIONS = Map.of(
            ENEMY_OF, Set.of(LOVER_OF, FOLLOWER_OF, "ally_of", ALLIED_WITH),
            LOVER_OF, Set.of(ENEMY_OF, RIVAL_OF),
            RIVAL_OF, Set.of(LOVER_OF, FOLLOWER_OF, "mentor_of"),
            FOLLOWER_OF, Set.of(ENEMY_OF, RIVAL_OF),
            AT_WAR_WITH, Set.of(ALLIED_WITH),
            ALLIED_WITH, Set.of(AT_WAR_WITH, ENEMY_OF),
            "mentor_of", Set.of(RIVAL_OF),
            "searching_for", Set.of(LOVER_OF, FOLLOWER_OF));

    private static final Map<String, Map<String, Integer>> WARNING_THRESHOLDS = Map.of(
            "npc", Map.of("default", 5, MEMBER_OF, 3, LOVER_OF, 2),
            "location", Map.of("default", 15, RESIDENT_OF, 50, ADJACENT_TO, 10),
            "faction", Map.of("default", 20, MEMBER_OF, 50),
            "rules", Map.of("default", 10),
            "abilities", Map.of("default", 10));

    private static final Set<String> SPATIAL = Set.of(RESIDENT_OF, "located_at", ADJACENT_TO, "contains",
            "contained_by", MANIFESTS_AT, "stronghold_of", "slumbers_beneath", OCCUPIES);

    private static final Set<String> CONFLICT = Set.of(ENEMY_OF, RIVAL_OF, AT_WAR_WITH);

    /**
     * Default strength of a kind, {@link org.loreweave.runtime.Config#DEFAULT_RELATIONSHIP_STRENGTH} if unknown.
     */
    public static double defaultStrength(String kind) {
        return DEFAULT_STRENGTH.getOrDefault(kind, org.loreweave.runtime.Config.DEFAULT_RELATIONSHIP_STRENGTH);
    }

    /**
     * Category of a kind; social when not listed.
     */
    public static RelationshipCategory categoryOf(String kind) {
        if (IMMUTABLE_FACTS.contains(kind)) return RelationshipCategory.IMMUTABLE_FACT;
        if (POLITICAL.contains(kind)) return RelationshipCategory.POLITICAL;
        if (INSTITUTIONAL.contains(kind)) return RelationshipCategory.INSTITUTIONAL;
        return RelationshipCategory.SOCIAL;
    }

    /**
     * @return true if relationships of this kind require a distance value
     */
    public static boolean isLineage(String kind) {
        return LINEAGE_DISTANCE.containsKey(kind);
    }

    /**
     * Distance range {min, max} of a lineage kind, or null for other kinds.
     */
    public static double[] distanceRange(String kind) {
        double[] range = LINEAGE_DISTANCE.get(kind);
        return range == null ? null : range.clone();
    }

    /**
     * @return true if a relationship of kind {@code b} cannot coexist with one of kind {@code a}
     *         between the same pair
     */
    public static boolean contradicts(String a, String b) {
        return CONTRADICTIONS.getOrDefault(a, Set.of()).contains(b)
                || CONTRADICTIONS.getOrDefault(b, Set.of()).contains(a);
    }

    /**
     * Soft per-entity limit on outgoing relationships of a kind; exceeding it only logs.
     */
    public static int warningThreshold(String entityKind, String relationshipKind) {
        Map<String, Integer> perKind = WARNING_THRESHOLDS.get(entityKind);
        if (perKind == null) return 10;
        return perKind.getOrDefault(relationshipKind, perKind.getOrDefault("default", 10));
    }

    /**
     * @return true for kinds that describe place (residence, adjacency, manifestation)
     */
    public static boolean isSpatial(String kind) {
        return SPATIAL.contains(kind);
    }

    /**
     * @return true for hostile kinds (enmity, rivalry, war)
     */
    public static boolean isConflict(String kind) {
        return CONFLICT.contains(kind);
    }
}

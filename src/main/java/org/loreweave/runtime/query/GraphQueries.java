package org.loreweave.runtime.query;

import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Point3;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipKinds;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only projections over a {@link Graph} shared by templates, systems and validation.
 * None of these methods mutate the graph.
 */
public final class GraphQueries {

    /** Relation between two factions as seen by formation and alliance logic. */
    public enum FactionStance { ALLIED, ENEMY, NEUTRAL }

    private GraphQueries() {}

    /**
     * Entities related to {@code entityId} through relationships of {@code kind}.
     *
     * @param kind relationship kind, null for any
     * @param direction {@link Direction#SRC} follows outgoing edges, {@link Direction#DST} incoming, BOTH either
     */
    public static List<Entity> getRelated(Graph graph, String entityId, String kind, Direction direction) {
        return getRelated(graph, entityId, kind, direction, 0.0, 1.0, false);
    }

    /**
     * Entities related through relationships of {@code kind} whose strength lies in [minStrength, maxStrength].
     *
     * @param sortByStrength strongest first when true
     */
    public static List<Entity> getRelated(Graph graph, String entityId, String kind, Direction direction,
                                          double minStrength, double maxStrength, boolean sortByStrength) {
        List<Relationship> matches = new ArrayList<>();
        for (Relationship r : graph.getRelationships()) {
            if (kind != null && !r.getKind().equals(kind)) continue;
            if (r.getStrength() < minStrength || r.getStrength() > maxStrength) continue;
            boolean out = r.getSrc().equals(entityId);
            boolean in = r.getDst().equals(entityId);
            if ((direction == Direction.SRC && out) || (direction == Direction.DST && in)
                    || (direction == Direction.BOTH && (out || in))) {
                matches.add(r);
            }
        }
        if (sortByStrength) {
            matches.sort(Comparator.comparingDouble(Relationship::getStrength).reversed());
        }
        Set<String> seen = new LinkedHashSet<>();
        List<Entity> result = new ArrayList<>();
        for (Relationship r : matches) {
            String other = r.otherEnd(entityId);
            Entity e = graph.getEntity(other);
            if (e != null && seen.add(other)) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * The location an entity is resident of, or null.
     */
    public static Entity getLocation(Graph graph, String entityId) {
        List<Entity> locations = getRelated(graph, entityId, RelationshipKinds.RESIDENT_OF, Direction.SRC);
        return locations.isEmpty() ? null : locations.get(0);
    }

    /**
     * Entities resident at a location.
     */
    public static List<Entity> getResidents(Graph graph, String locationId) {
        return getRelated(graph, locationId, RelationshipKinds.RESIDENT_OF, Direction.DST);
    }

    /**
     * Factions an entity is a member of.
     */
    public static List<Entity> getFactions(Graph graph, String entityId) {
        return getRelated(graph, entityId, RelationshipKinds.MEMBER_OF, Direction.SRC);
    }

    /**
     * Members of a faction, optionally restricted to a minimum membership strength.
     */
    public static List<Entity> getFactionMembers(Graph graph, String factionId, double minStrength) {
        return getRelated(graph, factionId, RelationshipKinds.MEMBER_OF, Direction.DST, minStrength, 1.0, false);
    }

    /**
     * Leaders of a faction, dead or alive.
     */
    public static List<Entity> getFactionLeaders(Graph graph, String factionId) {
        return getRelated(graph, factionId, RelationshipKinds.LEADER_OF, Direction.DST);
    }

    /**
     * Number of relationships touching an entity in either direction.
     */
    public static int connectionCount(Graph graph, String entityId) {
        int count = 0;
        for (Relationship r : graph.getRelationships()) {
            if (r.involves(entityId)) count++;
        }
        return count;
    }

    /**
     * Selection weight inversely proportional to an entity's outgoing degree, used to counter
     * rich-get-richer clustering: isolated 3.0, up to 2 links 2.0, up to 5 links 1.0, up to 10 links 0.5, else 0.2.
     */
    public static double getConnectionWeight(Entity entity) {
        int links = entity.getLinks().size();
        if (links == 0) return 3.0;
        if (links <= 2) return 2.0;
        if (links <= 5) return 1.0;
        if (links <= 10) return 0.5;
        return 0.2;
    }

    /**
     * Stance between two factions: enemy if either is at war with or an enemy of the other,
     * allied if they are allied, neutral otherwise.
     */
    public static FactionStance getFactionRelationship(Graph graph, String factionA, String factionB) {
        boolean allied = false;
        for (Relationship r : graph.getRelationships()) {
            if (!r.connects(factionA, factionB)) continue;
            if (RelationshipKinds.AT_WAR_WITH.equals(r.getKind()) || RelationshipKinds.ENEMY_OF.equals(r.getKind())) {
                return FactionStance.ENEMY;
            }
            if (RelationshipKinds.ALLIED_WITH.equals(r.getKind())) {
                allied = true;
            }
        }
        return allied ? FactionStance.ALLIED : FactionStance.NEUTRAL;
    }

    /**
     * Stance between two sets of factions: enemy if any pair is hostile, else allied if any pair is allied.
     */
    public static FactionStance getFactionStance(Graph graph, Collection<String> factionsA, Collection<String> factionsB) {
        boolean allied = false;
        for (String a : factionsA) {
            for (String b : factionsB) {
                FactionStance stance = getFactionRelationship(graph, a, b);
                if (stance == FactionStance.ENEMY) return FactionStance.ENEMY;
                if (stance == FactionStance.ALLIED) allied = true;
            }
        }
        return allied ? FactionStance.ALLIED : FactionStance.NEUTRAL;
    }

    /**
     * @return true if any existing relationship between a and b (either direction) contradicts {@code kind}
     */
    public static boolean hasContradiction(Graph graph, String a, String b, String kind) {
        for (Relationship r : graph.getRelationships()) {
            if (r.connects(a, b) && RelationshipKinds.contradicts(r.getKind(), kind)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Locations reachable from {@code locationId} over {@code adjacent_to} within {@code maxHops}, nearest first,
     * excluding the start.
     */
    public static List<Entity> findNearbyLocations(Graph graph, String locationId, int maxHops) {
        Map<String, List<String>> adjacency = adjacency(graph, List.of(RelationshipKinds.ADJACENT_TO));
        List<Entity> result = new ArrayList<>();
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depth.put(locationId, 0);
        queue.add(locationId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int d = depth.get(current);
            if (d >= maxHops) continue;
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (depth.containsKey(next)) continue;
                depth.put(next, d + 1);
                queue.add(next);
                Entity e = graph.getEntity(next);
                if (e != null) result.add(e);
            }
        }
        return result;
    }

    /**
     * Centroid of the coordinates of the given entities, ignoring entities without coordinates.
     *
     * @return the centroid, or null if none of the entities is placed
     */
    public static Point3 deriveCoordinates(Graph graph, Collection<String> referenceIds) {
        double x = 0, y = 0, z = 0;
        int n = 0;
        for (String id : referenceIds) {
            Entity e = graph.getEntity(id);
            if (e == null || e.getCoordinates() == null) continue;
            x += e.getCoordinates().x();
            y += e.getCoordinates().y();
            z += e.getCoordinates().z();
            n++;
        }
        return n == 0 ? null : new Point3(x / n, y / n, z / n);
    }

    /**
     * Picks the first non-empty bucket of candidates by subtype preference, e.g. hero before outlaw before mayor.
     */
    public static List<Entity> bySubtypePreference(Collection<Entity> candidates, List<String> preferredSubtypes) {
        for (String subtype : preferredSubtypes) {
            List<Entity> bucket = new ArrayList<>();
            for (Entity e : candidates) {
                if (Objects.equals(subtype, e.getSubtype())) bucket.add(e);
            }
            if (!bucket.isEmpty()) return bucket;
        }
        return List.of();
    }

    private static Map<String, List<String>> adjacency(Graph graph, Collection<String> kinds) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (Relationship r : graph.getRelationships()) {
            if (!kinds.isEmpty() && !kinds.contains(r.getKind())) continue;
            adjacency.computeIfAbsent(r.getSrc(), k -> new ArrayList<>()).add(r.getDst());
            adjacency.computeIfAbsent(r.getDst(), k -> new ArrayList<>()).add(r.getSrc());
        }
        return adjacency;
    }
}

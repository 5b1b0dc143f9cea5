package org.loreweave.runtime.query;

import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipKinds;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of residence, faction membership and enmity built in one pass over the relationships.
 * Systems that compare many pairs build one per run instead of scanning the graph per pair.
 * The snapshot does not follow later graph changes.
 */
public final class AffiliationIndex {

    private final Map<String, String> residence = new HashMap<>();
    private final Map<String, Set<String>> factions = new HashMap<>();
    private final Map<String, Set<String>> enemies = new HashMap<>();

    private AffiliationIndex() {}

    public static AffiliationIndex of(Graph graph) {
        AffiliationIndex index = new AffiliationIndex();
        for (Relationship r : graph.getRelationships()) {
            switch (r.getKind()) {
                case RelationshipKinds.RESIDENT_OF:
                    if (graph.hasEntity(r.getDst())) index.residence.putIfAbsent(r.getSrc(), r.getDst());
                    break;
                case RelationshipKinds.MEMBER_OF:
                    index.factions.computeIfAbsent(r.getSrc(), k -> new LinkedHashSet<>()).add(r.getDst());
                    break;
                case RelationshipKinds.ENEMY_OF:
                    index.enemies.computeIfAbsent(r.getSrc(), k -> new LinkedHashSet<>()).add(r.getDst());
                    break;
                default:
                    break;
            }
        }
        return index;
    }

    /**
     * @return the first location the entity is resident of, or null
     */
    public String locationOf(String entityId) {
        return residence.get(entityId);
    }

    public boolean sameLocation(String a, String b) {
        String la = residence.get(a);
        return la != null && Objects.equals(la, residence.get(b));
    }

    public Set<String> factionsOf(String entityId) {
        return factions.getOrDefault(entityId, Collections.emptySet());
    }

    public boolean shareFaction(String a, String b) {
        return !Collections.disjoint(factionsOf(a), factionsOf(b));
    }

    public boolean shareEnemy(String a, String b) {
        return !Collections.disjoint(enemies.getOrDefault(a, Collections.emptySet()),
                enemies.getOrDefault(b, Collections.emptySet()));
    }
}

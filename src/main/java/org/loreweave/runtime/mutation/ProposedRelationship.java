package org.loreweave.runtime.mutation;

import java.util.Objects;

/**
 * A relationship proposed by a template or system, not yet committed.
 *
 * @param kind relationship kind
 * @param src source endpoint
 * @param dst destination endpoint
 * @param strength explicit strength, or null for the kind's default
 * @param distance explicit lineage distance, or null
 */
public record ProposedRelationship(String kind, EntityRef src, EntityRef dst, Double strength, Double distance) {

    public ProposedRelationship {
        Objects.requireNonNull(kind, "Relationship kind cannot be null.");
        Objects.requireNonNull(src, "Relationship src cannot be null.");
        Objects.requireNonNull(dst, "Relationship dst cannot be null.");
    }

    /**
     * Proposal between two existing entities with default strength.
     */
    public static ProposedRelationship between(String kind, String srcId, String dstId) {
        return new ProposedRelationship(kind, EntityRef.existing(srcId), EntityRef.existing(dstId), null, null);
    }

    /**
     * Proposal between two existing entities with an explicit strength.
     */
    public static ProposedRelationship between(String kind, String srcId, String dstId, double strength) {
        return new ProposedRelationship(kind, EntityRef.existing(srcId), EntityRef.existing(dstId), strength, null);
    }

    /**
     * @return true if both endpoints are existing ids and connect the two entities in either direction
     */
    public boolean connects(String a, String b) {
        if (src.isPending() || dst.isPending()) return false;
        return (src.getId().equals(a) && dst.getId().equals(b)) || (src.getId().equals(b) && dst.getId().equals(a));
    }
}

package org.loreweave.runtime.systems;

import org.loreweave.runtime.mutation.ProposedRelationship;

import java.util.Objects;

/**
 * A relationship a system wants gone. With a replacement the removal only happens once the replacement
 * is in the graph, so a move that loses the budget race leaves the old edge in place.
 *
 * @param kind relationship kind
 * @param srcId source entity id
 * @param dstId destination entity id
 * @param replacement relationship that must exist after the commit, or null for an unconditional removal
 */
public record RelationshipRemoval(String kind, String srcId, String dstId, ProposedRelationship replacement) {

    public RelationshipRemoval {
        Objects.requireNonNull(kind, "Relationship kind cannot be null.");
        Objects.requireNonNull(srcId, "Relationship src cannot be null.");
        Objects.requireNonNull(dstId, "Relationship dst cannot be null.");
        if (replacement != null && (replacement.src().isPending() || replacement.dst().isPending())) {
            throw new IllegalArgumentException("Replacement must connect existing entities: " + replacement);
        }
    }

    public boolean isConditional() {
        return replacement != null;
    }
}

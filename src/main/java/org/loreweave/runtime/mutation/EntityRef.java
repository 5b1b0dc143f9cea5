package org.loreweave.runtime.mutation;

import java.util.Objects;

/**
 * Endpoint of a proposed relationship: either an existing entity id or the index of an entity
 * pending in the same batch. The commit step resolves pending indices to the ids assigned in pass one.
 */
public final class EntityRef {

    private final String id;
    private final int pendingIndex;

    private EntityRef(String id, int pendingIndex) {
        this.id = id;
        this.pendingIndex = pendingIndex;
    }

    /**
     * Reference to an entity already in the graph (or pre-created during expansion).
     */
    public static EntityRef existing(String id) {
        return new EntityRef(Objects.requireNonNull(id, "Entity id cannot be null."), -1);
    }

    /**
     * Reference to the entity at {@code index} in the batch's entity list.
     */
    public static EntityRef pending(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Pending index must be >= 0, was " + index);
        }
        return new EntityRef(null, index);
    }

    public boolean isPending() {
        return id == null;
    }

    public String getId() {
        return id;
    }

    public int getPendingIndex() {
        return pendingIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRef other)) return false;
        return pendingIndex == other.pendingIndex && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, pendingIndex);
    }

    @Override
    public String toString() {
        return isPending() ? "pending#" + pendingIndex : id;
    }
}

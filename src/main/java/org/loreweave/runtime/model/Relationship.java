package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A typed, attributed, directed edge between two entities.
 * <p>
 * Identity is the (kind, src, dst) triple; the graph never holds two relationships with the same
 * triple. Strength, status and archive tick are mutable; the source entity keeps a copy of every
 * relationship it owns in its cached links, which the graph keeps in step.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Relationship {

    private final String kind;
    private final String src;
    private final String dst;
    private final RelationshipCategory category;
    private double strength;
    private Double distance;
    private RelationshipStatus status;
    private Long archivedAt;

    /**
     * Creates a relationship.
     *
     * @param kind relationship kind
     * @param src source entity id
     * @param dst destination entity id
     * @param strength strength in [0, 1]
     * @param distance lineage distance in [0, 1], or null for non-lineage kinds
     * @param category category of the kind
     */
    public Relationship(String kind, String src, String dst, double strength, Double distance,
                        RelationshipCategory category) {
        this.kind = Objects.requireNonNull(kind, "Relationship kind cannot be null.");
        this.src = Objects.requireNonNull(src, "Relationship src cannot be null.");
        this.dst = Objects.requireNonNull(dst, "Relationship dst cannot be null.");
        this.category = Objects.requireNonNull(category, "Relationship category cannot be null.");
        this.strength = strength;
        this.distance = distance;
        this.status = RelationshipStatus.ACTIVE;
    }

    /**
     * Returns an independent copy of this relationship.
     */
    public Relationship copy() {
        Relationship copy = new Relationship(kind, src, dst, strength, distance, category);
        copy.status = status;
        copy.archivedAt = archivedAt;
        return copy;
    }

    /**
     * @return true if this relationship has the given identity triple
     */
    public boolean matches(String src, String dst, String kind) {
        return this.src.equals(src) && this.dst.equals(dst) && this.kind.equals(kind);
    }

    /**
     * @return true if this relationship connects the two entities in either direction
     */
    public boolean connects(String a, String b) {
        return (src.equals(a) && dst.equals(b)) || (src.equals(b) && dst.equals(a));
    }

    /**
     * @return true if the entity is either endpoint
     */
    public boolean involves(String entityId) {
        return src.equals(entityId) || dst.equals(entityId);
    }

    /**
     * Returns the endpoint opposite to the given entity.
     */
    public String otherEnd(String entityId) {
        return src.equals(entityId) ? dst : src;
    }

    @JsonProperty("kind")
    public String getKind() { return kind; }

    @JsonProperty("src")
    public String getSrc() { return src; }

    @JsonProperty("dst")
    public String getDst() { return dst; }

    @JsonProperty("category")
    public RelationshipCategory getCategory() { return category; }

    @JsonProperty("strength")
    public double getStrength() { return strength; }

    public void setStrength(double strength) { this.strength = strength; }

    @JsonProperty("distance")
    public Double getDistance() { return distance; }

    public void setDistance(Double distance) { this.distance = distance; }

    @JsonProperty("status")
    public RelationshipStatus getStatus() { return status; }

    public void setStatus(RelationshipStatus status) { this.status = status; }

    public boolean isActive() { return status == RelationshipStatus.ACTIVE; }

    @JsonProperty("archivedAt")
    public Long getArchivedAt() { return archivedAt; }

    public void setArchivedAt(Long archivedAt) { this.archivedAt = archivedAt; }

    @Override
    public String toString() {
        return kind + ": " + src + " -> " + dst;
    }
}

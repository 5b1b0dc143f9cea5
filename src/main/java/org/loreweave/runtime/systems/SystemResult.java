package org.loreweave.runtime.systems;

import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.mutation.EntityRef;
import org.loreweave.runtime.mutation.ProposedRelationship;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one system run. Everything structural is a proposal for the engine to commit: pending
 * entities, new relationships (some of them formations that start a cooldown), removals and entity
 * updates. Pressure deltas go to the controller. Only strength adjustments and culling happen in place
 * and are reported as a count.
 */
public final class SystemResult {

    private final List<EntitySpec> entities;
    private final List<ProposedRelationship> relationshipsAdded;
    private final List<ProposedRelationship> formations;
    private final List<RelationshipRemoval> relationshipsRemoved;
    private final List<EntityModification> entitiesModified;
    private final Map<String, Double> pressureChanges;
    private final int relationshipsAdjusted;
    private final String description;

    private SystemResult(Builder builder, String description) {
        this.entities = List.copyOf(builder.entities);
        this.relationshipsAdded = Collections.unmodifiableList(new ArrayList<>(builder.relationshipsAdded));
        this.formations = Collections.unmodifiableList(new ArrayList<>(builder.formations));
        this.relationshipsRemoved = List.copyOf(builder.relationshipsRemoved);
        this.entitiesModified = Collections.unmodifiableList(new ArrayList<>(builder.entitiesModified));
        this.pressureChanges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pressureChanges));
        this.relationshipsAdjusted = builder.relationshipsAdjusted;
        this.description = description;
    }

    /**
     * The all-empty result of a system that did not act this tick.
     */
    public static SystemResult dormant(String reason) {
        return new Builder().build(reason);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Entities to create; relationships refer to them with {@link EntityRef#pending(int)}.
     */
    public List<EntitySpec> getEntities() { return entities; }

    public List<ProposedRelationship> getRelationshipsAdded() { return relationshipsAdded; }

    /**
     * The subset of {@link #getRelationshipsAdded()} that records a formation cooldown for its source once committed.
     */
    public List<ProposedRelationship> getFormations() { return formations; }

    public List<RelationshipRemoval> getRelationshipsRemoved() { return relationshipsRemoved; }

    public List<EntityModification> getEntitiesModified() { return entitiesModified; }

    public Map<String, Double> getPressureChanges() { return pressureChanges; }

    /**
     * Relationships the system strengthened, weakened, archived or culled in place.
     */
    public int getRelationshipsAdjusted() { return relationshipsAdjusted; }

    public String getDescription() { return description; }

    /**
     * @return true if the system changed nothing and proposes nothing
     */
    public boolean isEmpty() {
        return entities.isEmpty() && relationshipsAdded.isEmpty() && relationshipsRemoved.isEmpty()
                && entitiesModified.isEmpty() && pressureChanges.isEmpty() && relationshipsAdjusted == 0;
    }

    @Override
    public String toString() {
        return description;
    }

    /**
     * Collects the parts of a result while a system runs.
     */
    public static final class Builder {

        private final List<EntitySpec> entities = new ArrayList<>();
        private final List<ProposedRelationship> relationshipsAdded = new ArrayList<>();
        private final List<ProposedRelationship> formations = new ArrayList<>();
        private final List<RelationshipRemoval> relationshipsRemoved = new ArrayList<>();
        private final List<EntityModification> entitiesModified = new ArrayList<>();
        private final Map<String, Double> pressureChanges = new LinkedHashMap<>();
        private int relationshipsAdjusted;

        private Builder() {}

        /**
         * Adds a pending entity.
         *
         * @return reference to it for relationships of the same result
         */
        public EntityRef addEntity(EntitySpec spec) {
            entities.add(spec);
            return EntityRef.pending(entities.size() - 1);
        }

        public Builder relate(ProposedRelationship proposal) {
            relationshipsAdded.add(proposal);
            return this;
        }

        public Builder relate(String kind, String srcId, String dstId) {
            return relate(ProposedRelationship.between(kind, srcId, dstId));
        }

        public Builder relate(String kind, String srcId, String dstId, double strength) {
            return relate(ProposedRelationship.between(kind, srcId, dstId, strength));
        }

        public Builder relate(String kind, EntityRef src, EntityRef dst) {
            return relate(new ProposedRelationship(kind, src, dst, null, null));
        }

        /**
         * Proposes a relationship whose commit starts the source's cooldown for this kind.
         */
        public Builder form(ProposedRelationship proposal) {
            relationshipsAdded.add(proposal);
            formations.add(proposal);
            return this;
        }

        public Builder form(String kind, String srcId, String dstId) {
            return form(ProposedRelationship.between(kind, srcId, dstId));
        }

        public Builder form(String kind, String srcId, String dstId, double strength) {
            return form(ProposedRelationship.between(kind, srcId, dstId, strength));
        }

        /**
         * Removes a relationship at commit time, whatever else survives.
         */
        public Builder remove(String kind, String srcId, String dstId) {
            relationshipsRemoved.add(new RelationshipRemoval(kind, srcId, dstId, null));
            return this;
        }

        /**
         * Moves a relationship: forms {@code replacement} and removes the old one only if the replacement
         * is in the graph after the commit.
         */
        public Builder replace(String kind, String srcId, String oldDstId, ProposedRelationship replacement) {
            form(replacement);
            relationshipsRemoved.add(new RelationshipRemoval(kind, srcId, oldDstId, replacement));
            return this;
        }

        /**
         * Cooldown check covering both committed formations and those queued in this result.
         */
        public boolean canForm(Graph graph, String entityId, String kind, long cooldown) {
            if (!graph.canFormRelationship(entityId, kind, cooldown)) return false;
            return cooldown <= 0 || !isForming(entityId, kind);
        }

        /**
         * @return true if a formation of this kind from the entity is already queued
         */
        public boolean isForming(String entityId, String kind) {
            for (ProposedRelationship p : formations) {
                if (p.kind().equals(kind) && !p.src().isPending() && p.src().getId().equals(entityId)) return true;
            }
            return false;
        }

        /**
         * Proposes changes to an entity; repeated calls for the same id are merged.
         */
        public Builder modify(String id, EntityChanges changes) {
            for (int i = 0; i < entitiesModified.size(); i++) {
                EntityModification existing = entitiesModified.get(i);
                if (existing.id().equals(id)) {
                    entitiesModified.set(i, new EntityModification(id, existing.changes().merge(changes)));
                    return this;
                }
            }
            entitiesModified.add(new EntityModification(id, changes));
            return this;
        }

        public Builder pressure(String pressureId, double delta) {
            pressureChanges.merge(pressureId, delta, Double::sum);
            return this;
        }

        public Builder adjusted(int count) {
            relationshipsAdjusted += count;
            return this;
        }

        /**
         * @return true if a proposal between the pair (either direction) of this kind is already queued
         */
        public boolean isProposed(String kind, String a, String b) {
            for (ProposedRelationship p : relationshipsAdded) {
                if (p.kind().equals(kind) && p.connects(a, b)) return true;
            }
            return false;
        }

        /**
         * Queued proposals between the pair, either direction.
         */
        public List<ProposedRelationship> proposalsBetween(String a, String b) {
            List<ProposedRelationship> result = new ArrayList<>();
            for (ProposedRelationship p : relationshipsAdded) {
                if (p.connects(a, b)) result.add(p);
            }
            return result;
        }

        public int relationshipCount() {
            return relationshipsAdded.size();
        }

        public int modificationCount() {
            return entitiesModified.size();
        }

        public SystemResult build(String description) {
            return new SystemResult(this, description);
        }
    }
}

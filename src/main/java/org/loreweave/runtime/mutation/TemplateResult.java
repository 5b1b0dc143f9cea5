package org.loreweave.runtime.mutation;

import org.loreweave.runtime.model.EntitySpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a template expansion: pending entities, relationships referencing them by index or by id,
 * optional pressure deltas and a human readable description.
 */
public final class TemplateResult {

    private final List<EntitySpec> entities;
    private final List<ProposedRelationship> relationships;
    private final Map<String, Double> pressureChanges;
    private final String description;
    private final boolean discovery;

    private TemplateResult(List<EntitySpec> entities, List<ProposedRelationship> relationships,
                           Map<String, Double> pressureChanges, String description, boolean discovery) {
        this.entities = Collections.unmodifiableList(entities);
        this.relationships = Collections.unmodifiableList(relationships);
        this.pressureChanges = Collections.unmodifiableMap(pressureChanges);
        this.description = description;
        this.discovery = discovery;
    }

    /**
     * The canonical "preconditions unmet" outcome.
     *
     * @param reason why nothing was generated
     */
    public static TemplateResult empty(String reason) {
        return new TemplateResult(List.of(), List.of(), Map.of(), reason, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<EntitySpec> getEntities() { return entities; }

    public List<ProposedRelationship> getRelationships() { return relationships; }

    public Map<String, Double> getPressureChanges() { return pressureChanges; }

    public String getDescription() { return description; }

    /**
     * @return true if committing this result counts as a location discovery
     */
    public boolean isDiscovery() { return discovery; }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }

    /**
     * Arena-style builder: {@link #addEntity} returns the pending reference used by later relationships.
     */
    public static final class Builder {
        private final List<EntitySpec> entities = new ArrayList<>();
        private final List<ProposedRelationship> relationships = new ArrayList<>();
        private final Map<String, Double> pressureChanges = new LinkedHashMap<>();
        private boolean discovery;

        private Builder() {}

        /**
         * Adds a pending entity.
         *
         * @return reference to it for use in relationships of the same batch
         */
        public EntityRef addEntity(EntitySpec spec) {
            entities.add(spec);
            return EntityRef.pending(entities.size() - 1);
        }

        public Builder relate(String kind, EntityRef src, EntityRef dst) {
            relationships.add(new ProposedRelationship(kind, src, dst, null, null));
            return this;
        }

        public Builder relate(String kind, EntityRef src, EntityRef dst, double strength) {
            relationships.add(new ProposedRelationship(kind, src, dst, strength, null));
            return this;
        }

        /**
         * Adds the relationship in both directions.
         */
        public Builder relateBidirectional(String kind, EntityRef a, EntityRef b) {
            relate(kind, a, b);
            return relate(kind, b, a);
        }

        public Builder pressure(String pressureId, double delta) {
            pressureChanges.merge(pressureId, delta, Double::sum);
            return this;
        }

        /**
         * Marks the result as a location discovery for the discovery rate limits.
         */
        public Builder discovery() {
            this.discovery = true;
            return this;
        }

        public TemplateResult build(String description) {
            return new TemplateResult(new ArrayList<>(entities), new ArrayList<>(relationships),
                    new LinkedHashMap<>(pressureChanges), description, discovery);
        }
    }
}

package org.loreweave.runtime.mutation;

import org.loreweave.runtime.domain.EntityKindDefinition;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.spi.IDomainSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns proposed entities and relationships into graph mutations.
 * <p>
 * A template batch is committed in two passes: pass one creates every pending entity in order and
 * records index to id; pass two resolves pending endpoints and adds the relationships. All pending
 * references are checked before pass one so that a malformed batch changes nothing.
 * </p>
 */
public final class MutationCommitter {

    private static final Logger LOG = LoggerFactory.getLogger(MutationCommitter.class);

    private final IDomainSchema schema;

    public MutationCommitter(IDomainSchema schema) {
        this.schema = Objects.requireNonNull(schema, "Domain schema cannot be null.");
    }

    /**
     * Commits a template result.
     *
     * @throws IllegalArgumentException if a relationship references a pending index outside the batch
     */
    public CommitOutcome commit(Graph graph, TemplateResult result) {
        int pendingCount = result.getEntities().size();
        for (ProposedRelationship proposal : result.getRelationships()) {
            checkRef(proposal.src(), pendingCount);
            checkRef(proposal.dst(), pendingCount);
        }

        List<String> createdIds = new ArrayList<>(pendingCount);
        for (EntitySpec spec : result.getEntities()) {
            createdIds.add(createEntity(graph, spec));
        }

        int added = 0;
        int skipped = 0;
        for (ProposedRelationship proposal : result.getRelationships()) {
            String src = resolve(proposal.src(), createdIds);
            String dst = resolve(proposal.dst(), createdIds);
            if (addRelationship(graph, proposal.kind(), src, dst, proposal.strength(), proposal.distance())) {
                added++;
            } else {
                skipped++;
            }
        }
        return new CommitOutcome(createdIds, added, skipped);
    }

    /**
     * Creates one entity, filling in the kind's default status when the spec has none.
     *
     * @return the assigned id
     */
    public String createEntity(Graph graph, EntitySpec spec) {
        applyKindDefaults(spec);
        return graph.createEntity(spec);
    }

    /**
     * Adds a relationship if the domain's matrix allows it between the two kinds.
     *
     * @return true if the relationship was new and allowed
     */
    public boolean addRelationship(Graph graph, String kind, String src, String dst, Double strength, Double distance) {
        Entity source = graph.getEntity(src);
        Entity target = graph.getEntity(dst);
        if (source != null && target != null
                && !schema.isRelationshipAllowed(source.getKind(), target.getKind(), kind)) {
            LOG.debug("Domain {} does not allow {} between {} and {}", schema.getName(), kind,
                    source.getKind(), target.getKind());
            return false;
        }
        return graph.addRelationship(kind, src, dst, strength, distance, null);
    }

    private void applyKindDefaults(EntitySpec spec) {
        if (spec.getStatus() != null) return;
        EntityKindDefinition definition = schema.getEntityKind(spec.getKind());
        if (definition != null && definition.defaultStatus() != null) {
            spec.status(definition.defaultStatus());
        }
    }

    /**
     * @throws IllegalArgumentException if the reference points past the end of a batch of {@code pendingCount} entities
     */
    public static void checkRef(EntityRef ref, int pendingCount) {
        if (ref.isPending() && ref.getPendingIndex() >= pendingCount) {
            throw new IllegalArgumentException("Pending reference " + ref + " outside batch of " + pendingCount);
        }
    }

    public static String resolve(EntityRef ref, List<String> createdIds) {
        return ref.isPending() ? createdIds.get(ref.getPendingIndex()) : ref.getId();
    }
}

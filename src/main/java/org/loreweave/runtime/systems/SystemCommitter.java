package org.loreweave.runtime.systems;

import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.mutation.CommitOutcome;
import org.loreweave.runtime.mutation.MutationCommitter;
import org.loreweave.runtime.mutation.ProposedRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Commits the structural part of a {@link SystemResult} under the per-tick relationship budget.
 * <p>
 * Order: pending entities, then relationships touching them (outside the budget, a new entity never
 * stays unconnected), then the remaining proposals until the budget runs out. Cooldowns are recorded
 * only for formations that were added, and a removal tied to a replacement only happens when that
 * replacement is in the graph. Entity modifications stay with the caller.
 * </p>
 */
public final class SystemCommitter {

    private static final Logger LOG = LoggerFactory.getLogger(SystemCommitter.class);

    private final MutationCommitter committer;

    public SystemCommitter(MutationCommitter committer) {
        this.committer = Objects.requireNonNull(committer, "Mutation committer cannot be null.");
    }

    /**
     * @param budget how many relationships between existing entities may still be added this tick
     * @return the outcome; proposals beyond the budget count as skipped
     * @throws IllegalArgumentException if a proposal references a pending index outside the result
     */
    public CommitOutcome commit(Graph graph, SystemResult result, int budget) {
        int pendingCount = result.getEntities().size();
        for (ProposedRelationship proposal : result.getRelationshipsAdded()) {
            MutationCommitter.checkRef(proposal.src(), pendingCount);
            MutationCommitter.checkRef(proposal.dst(), pendingCount);
        }

        List<String> createdIds = new ArrayList<>(pendingCount);
        for (EntitySpec spec : result.getEntities()) {
            createdIds.add(committer.createEntity(graph, spec));
        }

        Set<ProposedRelationship> committed = new HashSet<>();
        int added = 0;
        int skipped = 0;
        for (ProposedRelationship proposal : result.getRelationshipsAdded()) {
            if (proposal.src().isPending() || proposal.dst().isPending()) {
                if (add(graph, proposal, createdIds)) {
                    committed.add(proposal);
                    added++;
                } else {
                    skipped++;
                }
            }
        }
        int budgeted = 0;
        for (ProposedRelationship proposal : result.getRelationshipsAdded()) {
            if (proposal.src().isPending() || proposal.dst().isPending()) continue;
            if (budgeted >= budget) {
                skipped++;
                continue;
            }
            if (add(graph, proposal, createdIds)) {
                committed.add(proposal);
                added++;
                budgeted++;
            } else {
                skipped++;
            }
        }

        for (ProposedRelationship formation : result.getFormations()) {
            if (committed.contains(formation)) {
                graph.recordRelationshipFormation(MutationCommitter.resolve(formation.src(), createdIds), formation.kind());
            }
        }

        int removed = 0;
        for (RelationshipRemoval removal : result.getRelationshipsRemoved()) {
            if (removal.isConditional() && !isPresent(graph, removal.replacement())) {
                LOG.debug("Keeping {} {} -> {}, replacement {} was not committed", removal.kind(), removal.srcId(),
                        removal.dstId(), removal.replacement());
                continue;
            }
            if (graph.removeRelationship(removal.srcId(), removal.dstId(), removal.kind())) {
                removed++;
            }
        }
        return new CommitOutcome(createdIds, added, skipped, removed);
    }

    private boolean add(Graph graph, ProposedRelationship proposal, List<String> createdIds) {
        return committer.addRelationship(graph, proposal.kind(),
                MutationCommitter.resolve(proposal.src(), createdIds),
                MutationCommitter.resolve(proposal.dst(), createdIds),
                proposal.strength(), proposal.distance());
    }

    private static boolean isPresent(Graph graph, ProposedRelationship relationship) {
        return graph.hasRelationship(relationship.src().getId(), relationship.dst().getId(), relationship.kind());
    }
}

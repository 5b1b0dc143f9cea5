package org.loreweave.runtime.mutation;

import java.util.List;

/**
 * What a commit actually changed.
 *
 * @param createdIds ids of created entities, in batch order
 * @param relationshipsAdded relationships that were new
 * @param relationshipsSkipped proposals that were duplicates, not allowed by the domain or over budget
 * @param relationshipsRemoved relationships removed by the commit
 */
public record CommitOutcome(List<String> createdIds, int relationshipsAdded, int relationshipsSkipped,
                            int relationshipsRemoved) {

    public CommitOutcome {
        createdIds = List.copyOf(createdIds);
    }

    public CommitOutcome(List<String> createdIds, int relationshipsAdded, int relationshipsSkipped) {
        this(createdIds, relationshipsAdded, relationshipsSkipped, 0);
    }

    public boolean changedAnything() {
        return !createdIds.isEmpty() || relationshipsAdded > 0 || relationshipsRemoved > 0;
    }
}

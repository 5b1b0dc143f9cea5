package org.loreweave.runtime.domain;

import java.util.List;

/**
 * Vocabulary of one entity kind.
 *
 * @param kind kind identifier, e.g. npc
 * @param description what the kind represents
 * @param subtypes allowed subtypes
 * @param statuses allowed statuses
 * @param defaultStatus status given to new entities that do not specify one
 * @param requiredRelationships structural rules checked by validation
 */
public record EntityKindDefinition(String kind, String description, List<String> subtypes, List<String> statuses,
                                   String defaultStatus, List<RequiredRelationship> requiredRelationships) {

    public EntityKindDefinition {
        subtypes = subtypes == null ? List.of() : List.copyOf(subtypes);
        statuses = statuses == null ? List.of() : List.copyOf(statuses);
        requiredRelationships = requiredRelationships == null ? List.of() : List.copyOf(requiredRelationships);
    }
}

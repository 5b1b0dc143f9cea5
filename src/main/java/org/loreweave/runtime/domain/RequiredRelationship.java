package org.loreweave.runtime.domain;

import java.util.List;

/**
 * A relationship an entity of some kind must have, e.g. living NPCs must be resident somewhere.
 *
 * @param kind required outgoing relationship kind
 * @param whenStatus only enforced for entities with this status; null for all
 * @param exceptSubtypes subtypes exempt from the rule
 */
public record RequiredRelationship(String kind, String whenStatus, List<String> exceptSubtypes) {

    public RequiredRelationship {
        exceptSubtypes = exceptSubtypes == null ? List.of() : List.copyOf(exceptSubtypes);
    }

    /**
     * @return true if the rule applies to an entity with the given status and subtype
     */
    public boolean appliesTo(String status, String subtype) {
        return (whenStatus == null || whenStatus.equals(status)) && !exceptSubtypes.contains(subtype);
    }
}

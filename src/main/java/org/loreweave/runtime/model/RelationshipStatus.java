package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a relationship. Historical relationships stay in the graph for the record.
 */
public enum RelationshipStatus {
    ACTIVE,
    HISTORICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Broad category of a relationship kind. Immutable facts (lineage, discovery, founding) never decay
 * or get culled.
 */
public enum RelationshipCategory {
    POLITICAL,
    SOCIAL,
    INSTITUTIONAL,
    IMMUTABLE_FACT;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package org.loreweave.runtime.systems.trigger;

/**
 * How matching entities are grouped before actions run.
 */
public enum ClusterMode {
    /** Every match is its own group. */
    INDIVIDUAL,
    /** All matches share one group. */
    ALL_MATCHING,
    /** Matches sharing a relationship target are merged transitively. */
    BY_RELATIONSHIP
}

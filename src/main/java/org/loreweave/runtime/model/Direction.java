package org.loreweave.runtime.model;

/**
 * Which end of a relationship an entity occupies in a query.
 */
public enum Direction {
    /** The entity is the source; the related entity is the destination. */
    SRC,
    /** The entity is the destination; the related entity is the source. */
    DST,
    /** Either end. */
    BOTH
}

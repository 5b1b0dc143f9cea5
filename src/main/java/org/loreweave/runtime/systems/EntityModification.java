package org.loreweave.runtime.systems;

import org.loreweave.runtime.model.EntityChanges;

import java.util.Objects;

/**
 * A proposed shallow update of one existing entity.
 *
 * @param id the entity id
 * @param changes the fields to merge
 */
public record EntityModification(String id, EntityChanges changes) {

    public EntityModification {
        Objects.requireNonNull(id, "Entity id cannot be null.");
        Objects.requireNonNull(changes, "Changes cannot be null.");
    }
}

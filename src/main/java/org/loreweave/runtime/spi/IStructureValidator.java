package org.loreweave.runtime.spi;

import org.loreweave.runtime.domain.StructureCheck;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;

/**
 * Domain-specific structural check of a single entity, e.g. "living NPCs must reside somewhere".
 */
@FunctionalInterface
public interface IStructureValidator {

    StructureCheck validateEntityStructure(Graph graph, Entity entity);
}

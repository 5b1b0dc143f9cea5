package org.loreweave.runtime.spi;

import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Point3;

import java.util.List;

/**
 * Spatial placement capability supplied by the domain. Templates that create places require it.
 */
public interface IPlacementService {

    /**
     * Derives coordinates for a new entity near the given reference entities.
     *
     * @return the coordinates, or null if no valid position could be found
     */
    Point3 placeNear(Graph graph, List<String> referenceIds, IRandomProvider random);
}

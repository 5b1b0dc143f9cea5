package org.loreweave.runtime.domain;

import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Point3;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IPlacementService;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * Places new entities at a random offset around the centroid of their references, keeping a minimum
 * spacing to already placed entities and staying inside a cubic extent.
 */
public final class ScatterPlacementService implements IPlacementService {

    private final double extent;
    private final double radius;
    private final double minSpacing;
    private final int maxAttempts;

    /**
     * @param extent half-width of the world cube, coordinates stay in [-extent, extent]
     * @param radius maximum offset from the reference centroid
     * @param minSpacing minimum distance to any placed entity
     * @param maxAttempts attempts before giving up
     */
    public ScatterPlacementService(double extent, double radius, double minSpacing, int maxAttempts) {
        if (extent <= 0 || radius <= 0 || minSpacing < 0 || maxAttempts < 1) {
            throw new IllegalArgumentException("Invalid placement settings: extent=" + extent + ", radius=" + radius
                    + ", minSpacing=" + minSpacing + ", maxAttempts=" + maxAttempts);
        }
        this.extent = extent;
        this.radius = radius;
        this.minSpacing = minSpacing;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public Point3 placeNear(Graph graph, List<String> referenceIds, IRandomProvider random) {
        Point3 center = GraphQueries.deriveCoordinates(graph, referenceIds);
        if (center == null) {
            center = new Point3(0, 0, 0);
        }
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Point3 candidate = new Point3(
                    clamp(center.x() + Probabilities.between(random, -radius, radius)),
                    clamp(center.y() + Probabilities.between(random, -radius, radius)),
                    clamp(center.z() + Probabilities.between(random, -radius, radius)));
            if (isFree(graph, candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private boolean isFree(Graph graph, Point3 candidate) {
        for (Entity e : graph.getEntities()) {
            if (e.getCoordinates() != null && e.getCoordinates().distanceTo(candidate) < minSpacing) {
                return false;
            }
        }
        return true;
    }

    private double clamp(double v) {
        return Math.max(-extent, Math.min(extent, v));
    }
}

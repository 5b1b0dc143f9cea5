package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A point in the three dimensional placement space.
 */
public record Point3(@JsonProperty("x") double x, @JsonProperty("y") double y, @JsonProperty("z") double z) {

    /**
     * Euclidean distance to another point.
     */
    public double distanceTo(Point3 other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}

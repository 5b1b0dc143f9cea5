package org.loreweave.runtime.discovery;

import java.util.List;

/**
 * A detected resource need.
 *
 * @param primary need category, e.g. food or water
 * @param severity 0-100
 * @param specific concrete resource, e.g. fishing or fresh_water
 * @param affectedColonies settlements suffering the deficit
 */
public record ResourceAnalysis(String primary, double severity, String specific, List<String> affectedColonies) {

    public ResourceAnalysis {
        affectedColonies = List.copyOf(affectedColonies);
    }
}

package org.loreweave.runtime.discovery;

import java.util.List;

/**
 * A detected magical presence.
 *
 * @param instability the magical instability pressure, 0-100
 * @param existingMagicTypes names of existing magic abilities
 * @param anomalyCount number of anomaly locations
 * @param manifestation how new magic shows itself
 */
public record MagicAnalysis(double instability, List<String> existingMagicTypes, int anomalyCount,
                            Manifestation manifestation) {

    public enum Manifestation { CONVERGENCE, ARTIFACT, PHENOMENON, TEMPLE }

    public MagicAnalysis {
        existingMagicTypes = List.copyOf(existingMagicTypes);
    }
}

package org.loreweave.runtime.discovery;

import java.util.List;

/**
 * A detected conflict pattern.
 *
 * @param type what the conflict is about
 * @param intensity the conflict pressure, 0-100
 * @param factions factions involved in hostile relationships
 * @param needsAdvantage true when open attacks are frequent
 */
public record ConflictAnalysis(Type type, double intensity, List<String> factions, boolean needsAdvantage) {

    public enum Type { TERRITORIAL, IDEOLOGICAL, RESOURCE, DEFENSIVE }

    public ConflictAnalysis {
        factions = List.copyOf(factions);
    }
}

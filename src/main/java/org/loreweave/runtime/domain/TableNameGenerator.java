package org.loreweave.runtime.domain;

import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.spi.INameGenerator;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.List;
import java.util.Map;

/**
 * Name generator combining a first and last syllable table, prefixed by a title for known types
 * (e.g. "Brave Frostbeak" for a hero).
 */
public final class TableNameGenerator implements INameGenerator {

    private final List<String> firstParts;
    private final List<String> lastParts;
    private final Map<String, List<String>> titles;

    public TableNameGenerator(List<String> firstParts, List<String> lastParts, Map<String, List<String>> titles) {
        if (firstParts.isEmpty() || lastParts.isEmpty()) {
            throw new IllegalArgumentException("Name tables must not be empty");
        }
        this.firstParts = List.copyOf(firstParts);
        this.lastParts = List.copyOf(lastParts);
        this.titles = Map.copyOf(titles);
    }

    @Override
    public String generate(String type, IRandomProvider random) {
        String base = Probabilities.pickRandom(random, firstParts) + Probabilities.pickRandom(random, lastParts);
        List<String> typeTitles = type == null ? null : titles.get(type);
        if (typeTitles == null || typeTitles.isEmpty()) {
            return base;
        }
        return Probabilities.pickRandom(random, typeTitles) + " " + base;
    }
}

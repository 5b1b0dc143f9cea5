package org.loreweave.runtime.internal.services;

import org.loreweave.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Random helpers shared by templates and systems. All draws go through the supplied
 * {@link IRandomProvider}.
 */
public final class Probabilities {

    private Probabilities() {}

    /**
     * Scales a base probability by an era modifier in odds space and rolls it.
     * <p>
     * {@code odds = p / (1 - p)}, {@code scaled = odds^modifier}, {@code p' = scaled / (1 + scaled)}.
     * A modifier of 1 leaves the probability unchanged. Other modifiers move it away from or toward
     * 0.5: for {@code p < 0.5} a modifier above 1 lowers it, for {@code p > 0.5} it raises it.
     * </p>
     *
     * @param random the random source
     * @param baseProbability probability in [0, 1]
     * @param modifier era modifier, must be >= 0
     * @return true if the roll succeeds
     */
    public static boolean rollProbability(IRandomProvider random, double baseProbability, double modifier) {
        return random.nextDouble() < scaleProbability(baseProbability, modifier);
    }

    /**
     * Returns the odds-scaled probability used by {@link #rollProbability}.
     *
     * @param baseProbability probability in [0, 1]
     * @param modifier era modifier
     * @return the adjusted probability, always within [0, 1]
     */
    public static double scaleProbability(double baseProbability, double modifier) {
        if (baseProbability <= 0.0) return 0.0;
        if (baseProbability >= 1.0) return 1.0;
        if (modifier <= 0.0) return 0.0;
        double odds = baseProbability / (1.0 - baseProbability);
        double scaled = Math.pow(odds, modifier);
        if (Double.isInfinite(scaled)) return 1.0;
        return scaled / (1.0 + scaled);
    }

    /**
     * Rolls a plain probability without era scaling.
     *
     * @param random the random source
     * @param probability probability in [0, 1]
     * @return true if the roll succeeds
     */
    public static boolean chance(IRandomProvider random, double probability) {
        return random.nextDouble() < probability;
    }

    /**
     * Returns a uniformly distributed double in [min, max).
     */
    public static double between(IRandomProvider random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    /**
     * Picks one element uniformly.
     *
     * @return the element, or null if the collection is empty
     */
    public static <T> T pickRandom(IRandomProvider random, List<T> items) {
        if (items == null || items.isEmpty()) return null;
        return items.get(random.nextInt(items.size()));
    }

    /**
     * Picks up to {@code count} distinct elements in random order.
     */
    public static <T> List<T> pickMultiple(IRandomProvider random, Collection<T> items, int count) {
        List<T> copy = new ArrayList<>(items);
        Collections.shuffle(copy, random.asJavaRandom());
        return new ArrayList<>(copy.subList(0, Math.min(Math.max(count, 0), copy.size())));
    }

    /**
     * Picks one element with probability proportional to its weight. Non-positive weights are never picked.
     *
     * @return the element, or null if no element has a positive weight
     */
    public static <T> T weightedRandom(IRandomProvider random, List<T> items, ToDoubleFunction<T> weight) {
        double total = 0.0;
        for (T item : items) {
            total += Math.max(0.0, weight.applyAsDouble(item));
        }
        if (total <= 0.0) return null;
        double roll = random.nextDouble() * total;
        T last = null;
        for (T item : items) {
            double w = Math.max(0.0, weight.applyAsDouble(item));
            if (w <= 0.0) continue;
            last = item;
            roll -= w;
            if (roll < 0.0) return item;
        }
        return last;
    }

    /**
     * Samples up to {@code count} elements without replacement, each draw proportional to weight.
     */
    public static <T> List<T> weightedSampleWithoutReplacement(IRandomProvider random, List<T> items,
                                                               ToDoubleFunction<T> weight, int count) {
        List<T> pool = new ArrayList<>(items);
        List<T> selected = new ArrayList<>();
        while (selected.size() < count && !pool.isEmpty()) {
            T pick = weightedRandom(random, pool, weight);
            if (pick == null) break;
            selected.add(pick);
            pool.remove(pick);
        }
        return selected;
    }
}

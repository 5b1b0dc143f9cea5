package org.loreweave.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness for a world generation run.
 * <p>
 * Every random decision made by templates, systems and the engine (applicability rolls,
 * candidate selection, theme word choice) must draw from a provider, never from an ambient
 * source, so that runs are reproducible from their seed.
 * </p>
 */
public interface IRandomProvider extends ISerializable {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope/key.
     * The engine derives one stream per system and per template so that adding or removing a unit
     * does not shift the draws seen by the others.
     *
     * @param scope a stable, descriptive scope name (e.g., "system", "template")
     * @param key a stable numeric key (e.g., pipeline index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}

package org.loreweave.runtime.spi;

/**
 * Produces names for new entities.
 */
@FunctionalInterface
public interface INameGenerator {

    /**
     * @param type a subtype or archetype hint such as "hero"; unknown types get a plain name
     */
    String generate(String type, IRandomProvider random);
}

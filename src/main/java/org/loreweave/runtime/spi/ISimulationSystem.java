package org.loreweave.runtime.spi;

import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.systems.SystemResult;

/**
 * A tick-scoped rule that mutates existing state.
 * <p>
 * Systems run in a fixed order every tick and may read what earlier systems committed in the same tick.
 * A system that decides not to act returns {@link SystemResult#dormant(String)}. New entities, new
 * relationships and removals are proposals in the result; the engine commits them under the tick's
 * relationship budget. Only strength adjustments and culling touch the graph directly.
 * </p>
 */
public interface ISimulationSystem {

    /**
     * @return stable identifier, used for era modifiers and logs
     */
    String getId();

    /**
     * @return display name
     */
    String getName();

    /**
     * Runs the system for the current tick.
     *
     * @param modifier era modifier; 1.0 is neutral, larger amplifies, smaller dampens
     */
    SystemResult apply(Graph graph, double modifier, IRandomProvider random);
}

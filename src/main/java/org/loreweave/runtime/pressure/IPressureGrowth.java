package org.loreweave.runtime.pressure;

import org.loreweave.runtime.model.Graph;

/**
 * Computes the per-epoch growth of one pressure from the current graph state.
 */
@FunctionalInterface
public interface IPressureGrowth {

    /**
     * @return a non-negative growth amount
     */
    double compute(Graph graph);
}

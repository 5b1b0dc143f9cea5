package org.loreweave.runtime.spi;

import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.mutation.TemplateResult;

import java.util.List;

/**
 * A growth rule that creates new entities and relationships when its gate passes.
 * <p>
 * The engine calls {@link #canApply}, then {@link #findTargets}, picks one target and calls
 * {@link #expand}. A template whose preconditions turn out unmet returns
 * {@link TemplateResult#empty(String)}; it throws only when a required capability is missing from
 * the configuration.
 * </p>
 */
public interface IGrowthTemplate {

    /**
     * @return stable identifier, used for era weights and logs
     */
    String getId();

    /**
     * @return display name
     */
    String getName();

    /**
     * @return the entity kind this template mainly produces, used for deficit weighting
     */
    String getProducedKind();

    /**
     * Boolean gate combining pressures, era, saturation and random draws.
     */
    boolean canApply(Graph graph, IRandomProvider random);

    /**
     * Candidate subjects for expansion; an empty list skips the template this tick.
     */
    List<Entity> findTargets(Graph graph, IRandomProvider random);

    /**
     * Builds the proposed entities and relationships around the target.
     *
     * @param target one of the entities returned by {@link #findTargets}
     */
    TemplateResult expand(Graph graph, Entity target, IRandomProvider random);
}

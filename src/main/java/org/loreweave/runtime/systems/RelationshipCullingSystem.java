package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipCategory;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Cleanup pass that runs last in the pipeline.
 * <p>
 * Every {@code frequency} ticks it removes relationships weaker than the threshold once both endpoints
 * are older than the grace period, plus any relationship whose endpoint no longer exists. Immutable
 * facts and protected kinds are never culled.
 * </p>
 */
public class RelationshipCullingSystem implements ISimulationSystem {

    private static final Logger LOG = LoggerFactory.getLogger(RelationshipCullingSystem.class);

    private final int frequency;
    private final double threshold;
    private final long gracePeriod;
    private final Set<String> protectedKinds;

    public RelationshipCullingSystem(int frequency, double threshold, long gracePeriod, Set<String> protectedKinds) {
        if (frequency < 1) {
            throw new IllegalArgumentException("Culling frequency must be >= 1, was " + frequency);
        }
        this.frequency = frequency;
        this.threshold = threshold;
        this.gracePeriod = gracePeriod;
        this.protectedKinds = Set.copyOf(protectedKinds);
    }

    public RelationshipCullingSystem(Config options) {
        this(options.hasPath("frequency") ? options.getInt("frequency") : 5,
                options.hasPath("threshold") ? options.getDouble("threshold") : 0.15,
                options.hasPath("grace-period") ? options.getLong("grace-period") : 20L,
                Set.copyOf(options.hasPath("protected-kinds")
                        ? options.getStringList("protected-kinds")
                        : List.of("resident_of", "member_of", "leader_of")));
    }

    @Override
    public String getId() {
        return "relationship_culling";
    }

    @Override
    public String getName() {
        return "Relationship Selection";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (graph.getTick() % frequency != 0) {
            return SystemResult.dormant("Relationship culling dormant");
        }
        int[] protectedWeak = {0};
        int culled = graph.removeRelationshipsIf(r -> {
            Entity src = graph.getEntity(r.getSrc());
            Entity dst = graph.getEntity(r.getDst());
            if (src == null || dst == null) return true;
            if (r.getStrength() >= threshold || r.getCategory() == RelationshipCategory.IMMUTABLE_FACT) return false;
            if (!pastGrace(graph, src) || !pastGrace(graph, dst)) return false;
            if (protectedKinds.contains(r.getKind())) {
                protectedWeak[0]++;
                return false;
            }
            return true;
        });
        if (protectedWeak[0] > 0) {
            LOG.debug("Tick {}: kept {} weak protected relationships", graph.getTick(), protectedWeak[0]);
        }
        if (culled == 0) {
            return SystemResult.dormant("All relationships above threshold");
        }
        return SystemResult.builder().adjusted(culled).build(culled + " weak relationships fade away");
    }

    private boolean pastGrace(Graph graph, Entity entity) {
        return graph.getTick() - entity.getCreatedAt() >= gracePeriod;
    }

    /**
     * @return true if the relationship could be culled once it weakens
     */
    public boolean isCullable(Relationship relationship) {
        return relationship.getCategory() != RelationshipCategory.IMMUTABLE_FACT
                && !protectedKinds.contains(relationship.getKind());
    }
}

package org.loreweave.runtime.systems.trigger;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;
import org.loreweave.runtime.systems.SystemResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Surfaces an emergent condition as durable graph state.
 * <p>
 * Entities passing the filter and all conditions are grouped according to the cluster mode, groups
 * smaller than the minimum size are dropped, and each action runs on every remaining group.
 * Group ids have the form {@code cluster_<tick>_<index>}; in individual mode a group is keyed by its
 * entity id.
 * </p>
 */
public class ThresholdTriggerSystem implements ISimulationSystem {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdTriggerSystem.class);

    private final TriggerConfig config;

    public ThresholdTriggerSystem(TriggerConfig config) {
        this.config = config;
    }

    public ThresholdTriggerSystem(Config options) {
        this(TriggerConfig.fromConfig(options));
    }

    public TriggerConfig getConfig() {
        return config;
    }

    @Override
    public String getId() {
        return config.id();
    }

    @Override
    public String getName() {
        return config.name();
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (config.throttleChance() < 1.0 && !Probabilities.rollProbability(random, config.throttleChance(), modifier)) {
            return SystemResult.dormant(config.name() + ": dormant");
        }

        List<Entity> matching = new ArrayList<>();
        for (Entity entity : graph.getEntities()) {
            if (!config.filter().matches(entity)) continue;
            if (config.cooldownTag() != null && entity.getTags().has(config.cooldownTag())) continue;
            if (matchesAll(entity, graph)) matching.add(entity);
        }
        if (matching.isEmpty()) {
            return SystemResult.dormant(config.name() + ": no matches");
        }

        Map<String, List<Entity>> clusters = cluster(matching, graph);
        clusters.values().removeIf(members -> members.size() < config.minClusterSize());
        if (clusters.isEmpty()) {
            return SystemResult.dormant(config.name() + ": clusters too small");
        }

        SystemResult.Builder result = SystemResult.builder();
        for (Map.Entry<String, List<Entity>> cluster : clusters.entrySet()) {
            for (TriggerAction action : config.actions()) {
                apply(action, cluster.getKey(), cluster.getValue(), graph, result);
            }
        }
        config.pressureChanges().forEach(result::pressure);

        LOG.debug("Trigger {} fired for {} cluster(s) at tick {}", config.id(), clusters.size(), graph.getTick());
        return result.build(config.name() + ": " + clusters.size() + " trigger(s), "
                + result.modificationCount() + " entities tagged");
    }

    private boolean matchesAll(Entity entity, Graph graph) {
        for (TriggerCondition condition : config.conditions()) {
            if (!condition.test(entity, graph)) return false;
        }
        return true;
    }

    private Map<String, List<Entity>> cluster(List<Entity> matching, Graph graph) {
        Map<String, List<Entity>> clusters = new LinkedHashMap<>();
        switch (config.clusterMode()) {
            case ALL_MATCHING:
                clusters.put(clusterId(graph, 0), matching);
                break;
            case BY_RELATIONSHIP:
                List<List<Entity>> groups = groupBySharedTarget(matching, graph);
                for (int i = 0; i < groups.size(); i++) {
                    clusters.put(clusterId(graph, i), groups.get(i));
                }
                break;
            case INDIVIDUAL:
            default:
                for (Entity entity : matching) {
                    clusters.put(entity.getId(), List.of(entity));
                }
                break;
        }
        return clusters;
    }

    /**
     * Union-find over the matches: two matches join when they hold a relationship of the cluster kind
     * to the same entity, in either direction.
     */
    private List<List<Entity>> groupBySharedTarget(List<Entity> matching, Graph graph) {
        int[] parent = new int[matching.size()];
        for (int i = 0; i < matching.size(); i++) {
            parent[i] = i;
        }

        Map<String, Integer> firstHolder = new HashMap<>();
        for (int i = 0; i < matching.size(); i++) {
            String id = matching.get(i).getId();
            for (Relationship r : graph.getEntityRelationships(id, Direction.BOTH)) {
                if (!config.clusterRelationshipKind().equals(r.getKind())) continue;
                String target = r.getSrc().equals(id) ? r.getDst() : r.getSrc();
                Integer holder = firstHolder.putIfAbsent(target, i);
                if (holder != null) union(parent, holder, i);
            }
        }

        Map<Integer, List<Entity>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < matching.size(); i++) {
            byRoot.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(matching.get(i));
        }
        return new ArrayList<>(byRoot.values());
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
    }

    private static String clusterId(Graph graph, int index) {
        return "cluster_" + graph.getTick() + "_" + index;
    }

    private void apply(TriggerAction action, String clusterId, List<Entity> members, Graph graph,
                       SystemResult.Builder result) {
        switch (action.type()) {
            case SET_TAG:
                for (Entity member : members) {
                    result.modify(member.getId(), EntityChanges.create().putTag(action.tag(), action.tagValue()));
                }
                break;
            case SET_CLUSTER_TAG:
                for (Entity member : members) {
                    result.modify(member.getId(), EntityChanges.create().putTag(action.tag(), clusterId));
                }
                break;
            case REMOVE_TAG:
                for (Entity member : members) {
                    if (member.getTags().has(action.tag())) {
                        result.modify(member.getId(), EntityChanges.create().removeTag(action.tag()));
                    }
                }
                break;
            case MODIFY_PRESSURE:
                if (action.delta() != 0) result.pressure(action.pressureId(), action.delta());
                break;
            case CREATE_RELATIONSHIP:
                if (!action.betweenMatching() || members.size() < 2) break;
                for (int i = 0; i < members.size(); i++) {
                    for (int j = i + 1; j < members.size(); j++) {
                        String src = members.get(i).getId();
                        String dst = members.get(j).getId();
                        if (!graph.hasRelationship(src, dst, action.relationshipKind())
                                && !result.isProposed(action.relationshipKind(), src, dst)) {
                            result.relate(action.relationshipKind(), src, dst, action.strength());
                        }
                    }
                }
                break;
            default:
                break;
        }
    }
}

package org.loreweave.runtime.systems.trigger;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.query.GraphQueries;

/**
 * One test an entity must pass for a trigger to match it. All conditions of a trigger are ANDed.
 * <p>
 * Unset bounds are open: a {@code RELATIONSHIP_COUNT} condition without min and max matches every
 * entity. A tag condition without a tag never matches for {@code TAG_EXISTS} and always matches for
 * {@code TAG_ABSENT}.
 * </p>
 */
public record TriggerCondition(
        Type type,
        String relationshipKind,
        Direction direction,
        Integer minCount,
        Integer maxCount,
        String targetKind,
        String targetStatus,
        String status,
        String notStatus,
        String tag,
        String pressureId,
        double threshold,
        long minTicks) {

    public enum Type {
        RELATIONSHIP_COUNT,
        RELATIONSHIP_EXISTS,
        ENTITY_STATUS,
        TAG_EXISTS,
        TAG_ABSENT,
        PRESSURE_ABOVE,
        PRESSURE_BELOW,
        TIME_SINCE_UPDATE,
        CONNECTION_COUNT
    }

    public TriggerCondition {
        if (type == null) {
            throw new IllegalArgumentException("Trigger condition needs a type");
        }
        if (direction == null) {
            direction = Direction.BOTH;
        }
        if ((type == Type.PRESSURE_ABOVE || type == Type.PRESSURE_BELOW) && pressureId == null) {
            throw new IllegalArgumentException("Pressure condition needs a pressure id");
        }
    }

    public boolean test(Entity entity, Graph graph) {
        switch (type) {
            case RELATIONSHIP_COUNT:
                return withinBounds(graph.getEntityRelationships(entity.getId(), direction).stream()
                        .filter(r -> relationshipKind == null || relationshipKind.equals(r.getKind()))
                        .count());
            case RELATIONSHIP_EXISTS:
                for (Relationship r : graph.getEntityRelationships(entity.getId(), direction)) {
                    if (relationshipKind != null && !relationshipKind.equals(r.getKind())) continue;
                    if (targetKind == null && targetStatus == null) return true;
                    Entity target = graph.getEntity(r.getSrc().equals(entity.getId()) ? r.getDst() : r.getSrc());
                    if (target == null) continue;
                    if (targetKind != null && !targetKind.equals(target.getKind())) continue;
                    if (targetStatus != null && !targetStatus.equals(target.getStatus())) continue;
                    return true;
                }
                return false;
            case ENTITY_STATUS:
                if (status != null && !status.equals(entity.getStatus())) return false;
                return notStatus == null || !notStatus.equals(entity.getStatus());
            case TAG_EXISTS:
                return tag != null && entity.getTags().has(tag);
            case TAG_ABSENT:
                return tag == null || !entity.getTags().has(tag);
            case PRESSURE_ABOVE:
                return graph.getPressure(pressureId) >= threshold;
            case PRESSURE_BELOW:
                return graph.getPressure(pressureId) < threshold;
            case TIME_SINCE_UPDATE:
                return graph.getTick() - entity.getUpdatedAt() >= minTicks;
            case CONNECTION_COUNT:
                return withinBounds(GraphQueries.connectionCount(graph, entity.getId()));
            default:
                return false;
        }
    }

    private boolean withinBounds(long count) {
        if (minCount != null && count < minCount) return false;
        return maxCount == null || count <= maxCount;
    }

    static TriggerCondition fromConfig(Config options) {
        Type type = TriggerConfig.enumOf(Type.class, options.getString("type"));
        String minPath = type == Type.CONNECTION_COUNT ? "min-connections" : "min-count";
        String maxPath = type == Type.CONNECTION_COUNT ? "max-connections" : "max-count";
        return new TriggerCondition(
                type,
                TriggerConfig.stringOr(options, "relationship-kind"),
                options.hasPath("direction") ? TriggerConfig.enumOf(Direction.class, options.getString("direction")) : Direction.BOTH,
                options.hasPath(minPath) ? options.getInt(minPath) : null,
                options.hasPath(maxPath) ? options.getInt(maxPath) : null,
                TriggerConfig.stringOr(options, "target-kind"),
                TriggerConfig.stringOr(options, "target-status"),
                TriggerConfig.stringOr(options, "status"),
                TriggerConfig.stringOr(options, "not-status"),
                TriggerConfig.stringOr(options, "tag"),
                TriggerConfig.stringOr(options, "pressure"),
                options.hasPath("threshold") ? options.getDouble("threshold") : 0.0,
                options.hasPath("min-ticks") ? options.getLong("min-ticks") : 0L);
    }
}

package org.loreweave.runtime.systems.trigger;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.TagMap;

/**
 * Effect applied to every group a trigger produces.
 *
 * @param tagValue value for {@code SET_TAG}, {@code true} when not configured
 * @param betweenMatching {@code CREATE_RELATIONSHIP} only acts when set, linking every pair of group members
 */
public record TriggerAction(
        Type type,
        String tag,
        Object tagValue,
        String pressureId,
        double delta,
        String relationshipKind,
        double strength,
        boolean betweenMatching) {

    public enum Type { SET_TAG, SET_CLUSTER_TAG, REMOVE_TAG, MODIFY_PRESSURE, CREATE_RELATIONSHIP }

    public TriggerAction {
        if (type == null) {
            throw new IllegalArgumentException("Trigger action needs a type");
        }
        if ((type == Type.SET_TAG || type == Type.SET_CLUSTER_TAG || type == Type.REMOVE_TAG) && tag == null) {
            throw new IllegalArgumentException("Trigger action " + type + " needs a tag");
        }
        if (type == Type.SET_TAG) {
            TagMap.checkValue(tag, tagValue);
        }
        if (type == Type.MODIFY_PRESSURE && pressureId == null) {
            throw new IllegalArgumentException("Trigger action MODIFY_PRESSURE needs a pressure id");
        }
        if (type == Type.CREATE_RELATIONSHIP && relationshipKind == null) {
            throw new IllegalArgumentException("Trigger action CREATE_RELATIONSHIP needs a relationship kind");
        }
    }

    public static TriggerAction setClusterTag(String tag) {
        return new TriggerAction(Type.SET_CLUSTER_TAG, tag, null, null, 0, null, 0, false);
    }

    static TriggerAction fromConfig(Config options) {
        return new TriggerAction(
                TriggerConfig.enumOf(Type.class, options.getString("type")),
                TriggerConfig.stringOr(options, "tag"),
                options.hasPath("tag-value") ? options.getAnyRef("tag-value") : Boolean.TRUE,
                TriggerConfig.stringOr(options, "pressure"),
                options.hasPath("delta") ? options.getDouble("delta") : 0.0,
                TriggerConfig.stringOr(options, "relationship-kind"),
                options.hasPath("strength") ? options.getDouble("strength") : 0.5,
                options.hasPath("between-matching") && options.getBoolean("between-matching"));
    }
}

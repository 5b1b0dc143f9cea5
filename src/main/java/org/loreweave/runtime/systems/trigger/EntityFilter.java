package org.loreweave.runtime.systems.trigger;

import com.typesafe.config.Config;
import org.loreweave.runtime.model.Entity;

import java.util.List;

/**
 * Pre-selection of the entities a trigger evaluates.
 */
public record EntityFilter(String kind, List<String> subtypes, String status, String notStatus,
                           String hasTag, String notHasTag) {

    public EntityFilter {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Trigger entity filter needs a kind");
        }
        subtypes = subtypes == null ? List.of() : List.copyOf(subtypes);
    }

    public boolean matches(Entity entity) {
        if (!kind.equals(entity.getKind())) return false;
        if (!subtypes.isEmpty() && !subtypes.contains(entity.getSubtype())) return false;
        if (status != null && !status.equals(entity.getStatus())) return false;
        if (notStatus != null && notStatus.equals(entity.getStatus())) return false;
        if (hasTag != null && !entity.getTags().has(hasTag)) return false;
        return notHasTag == null || !entity.getTags().has(notHasTag);
    }

    static EntityFilter fromConfig(Config options) {
        return new EntityFilter(
                options.getString("kind"),
                options.hasPath("subtypes") ? options.getStringList("subtypes") : List.of(),
                TriggerConfig.stringOr(options, "status"),
                TriggerConfig.stringOr(options, "not-status"),
                TriggerConfig.stringOr(options, "has-tag"),
                TriggerConfig.stringOr(options, "not-has-tag"));
    }
}

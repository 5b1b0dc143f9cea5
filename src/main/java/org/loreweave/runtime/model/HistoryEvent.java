package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of the run history: something that changed the graph.
 *
 * @param tick tick of the change
 * @param era era id at the time
 * @param type "growth" for templates, "simulation" for system ticks, "special" for epoch events
 * @param description human readable summary
 * @param entitiesCreated ids of created entities
 * @param relationshipsCreated number of relationships committed
 * @param entitiesModified ids of modified entities
 */
public record HistoryEvent(@JsonProperty("tick") long tick,
                           @JsonProperty("era") String era,
                           @JsonProperty("type") String type,
                           @JsonProperty("description") String description,
                           @JsonProperty("entitiesCreated") List<String> entitiesCreated,
                           @JsonProperty("relationshipsCreated") int relationshipsCreated,
                           @JsonProperty("entitiesModified") List<String> entitiesModified) {

    public HistoryEvent {
        entitiesCreated = List.copyOf(entitiesCreated);
        entitiesModified = List.copyOf(entitiesModified);
    }
}

package org.loreweave.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.HistoryEvent;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.validation.ValidationReport;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializable view of a finished run, written by the CLI as JSON.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"seed", "tick", "epochs", "era", "pressures", "entities", "relationships", "history",
        "validation", "errors"})
public record WorldSnapshot(@JsonProperty("seed") long seed,
                            @JsonProperty("tick") long tick,
                            @JsonProperty("epochs") int epochs,
                            @JsonProperty("era") String era,
                            @JsonProperty("pressures") Map<String, Double> pressures,
                            @JsonProperty("entities") List<Entity> entities,
                            @JsonProperty("relationships") List<Relationship> relationships,
                            @JsonProperty("history") List<HistoryEvent> history,
                            @JsonProperty("validation") ValidationReport validation,
                            @JsonProperty("errors") List<OperationalError> errors) {

    public static WorldSnapshot of(WorldEngine engine, ValidationReport validation) {
        Graph graph = engine.getGraph();
        return new WorldSnapshot(
                engine.getSettings().seed(),
                graph.getTick(),
                engine.getEpoch(),
                graph.getCurrentEra().id(),
                new LinkedHashMap<>(graph.getPressures()),
                new ArrayList<>(graph.getEntities()),
                graph.getRelationships(),
                graph.getHistory(),
                validation,
                engine.getErrors());
    }
}

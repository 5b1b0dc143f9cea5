package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A coarse simulation phase. Weights and modifiers default to 1.0 when a unit is not listed; 0 disables it.
 *
 * @param id stable identifier
 * @param name display name
 * @param description flavour text
 * @param templateWeights multiplier on template selection weight, by template id
 * @param systemModifiers era modifier passed to each system, by system id
 * @param pressureModifiers multiplier on epoch pressure growth/decay, by pressure id
 */
public record Era(@JsonProperty("id") String id,
                  @JsonProperty("name") String name,
                  @JsonProperty("description") String description,
                  @JsonIgnore Map<String, Double> templateWeights,
                  @JsonIgnore Map<String, Double> systemModifiers,
                  @JsonIgnore Map<String, Double> pressureModifiers) {

    public Era {
        templateWeights = templateWeights == null ? Map.of() : Map.copyOf(templateWeights);
        systemModifiers = systemModifiers == null ? Map.of() : Map.copyOf(systemModifiers);
        pressureModifiers = pressureModifiers == null ? Map.of() : Map.copyOf(pressureModifiers);
    }

    /**
     * A neutral era with no weights or modifiers.
     */
    public static Era neutral(String id) {
        return new Era(id, id, "", Map.of(), Map.of(), Map.of());
    }

    public double templateWeight(String templateId) {
        return templateWeights.getOrDefault(templateId, 1.0);
    }

    public double systemModifier(String systemId) {
        return systemModifiers.getOrDefault(systemId, 1.0);
    }

    public double pressureModifier(String pressureId) {
        return pressureModifiers.getOrDefault(pressureId, 1.0);
    }
}

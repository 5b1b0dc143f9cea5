package org.loreweave.runtime.domain;

import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.spi.IStructureValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structure validator driven by the required relationships of each kind definition.
 */
public final class RequiredRelationshipValidator implements IStructureValidator {

    private final Map<String, EntityKindDefinition> definitions;

    public RequiredRelationshipValidator(Map<String, EntityKindDefinition> definitions) {
        this.definitions = Map.copyOf(definitions);
    }

    @Override
    public StructureCheck validateEntityStructure(Graph graph, Entity entity) {
        EntityKindDefinition definition = definitions.get(entity.getKind());
        if (definition == null) {
            return StructureCheck.ok();
        }
        List<String> missing = new ArrayList<>();
        for (RequiredRelationship rule : definition.requiredRelationships()) {
            if (!rule.appliesTo(entity.getStatus(), entity.getSubtype())) continue;
            boolean present = false;
            for (Relationship link : entity.getLinks()) {
                if (link.getKind().equals(rule.kind())) {
                    present = true;
                    break;
                }
            }
            if (!present) missing.add(rule.kind());
        }
        return StructureCheck.missing(missing);
    }
}

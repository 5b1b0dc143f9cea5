package org.loreweave.runtime.validation;

import org.loreweave.runtime.domain.StructureCheck;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IStructureValidator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only structural checks of a finished world. Violations are reported, never thrown.
 */
public class WorldValidator {

    static final String CONNECTED_ENTITIES = "Connected Entities";
    static final String ENTITY_STRUCTURE = "Entity Structure";
    static final String RELATIONSHIP_INTEGRITY = "Relationship Integrity";
    static final String LINK_SYNCHRONIZATION = "Link Synchronization";

    private static final int SAMPLE_LIMIT = 5;
    private static final int DETAIL_LIMIT = 10;

    private final IStructureValidator structureValidator;

    /**
     * @param structureValidator domain structure check, null to skip it
     */
    public WorldValidator(IStructureValidator structureValidator) {
        this.structureValidator = structureValidator;
    }

    public WorldValidator(IDomainSchema domain) {
        this(domain.getStructureValidator().orElse(null));
    }

    /**
     * Runs all four checks.
     */
    public ValidationReport validateWorld(Graph graph) {
        return ValidationReport.of(List.of(
                validateConnectedEntities(graph),
                validateEntityStructure(graph),
                validateRelationshipIntegrity(graph),
                validateLinkSync(graph)));
    }

    /**
     * Every entity needs at least one outgoing link or incoming relationship.
     */
    public ValidationResult validateConnectedEntities(Graph graph) {
        Set<String> hasIncoming = new HashSet<>();
        for (Relationship r : graph.getRelationships()) {
            hasIncoming.add(r.getDst());
        }
        List<Entity> unconnected = new ArrayList<>();
        for (Entity entity : graph.getEntities()) {
            if (entity.getLinks().isEmpty() && !hasIncoming.contains(entity.getId())) {
                unconnected.add(entity);
            }
        }
        if (unconnected.isEmpty()) {
            return ValidationResult.pass(CONNECTED_ENTITIES, "All entities have at least one connection");
        }

        Map<String, Integer> byKind = new LinkedHashMap<>();
        for (Entity e : unconnected) {
            byKind.merge(e.getKind() + ":" + e.getSubtype(), 1, Integer::sum);
        }
        StringBuilder details = new StringBuilder(unconnected.size() + " entities have no connections:\n");
        byKind.forEach((kind, count) -> details.append("  - ").append(kind).append(": ").append(count).append('\n'));
        details.append("Sample unconnected entities:\n");
        for (Entity e : unconnected.subList(0, Math.min(SAMPLE_LIMIT, unconnected.size()))) {
            details.append("  - ").append(e.getName()).append(" (").append(e.getKind()).append(':')
                    .append(e.getSubtype()).append(", created tick ").append(e.getCreatedAt()).append(")\n");
        }
        return new ValidationResult(CONNECTED_ENTITIES, false, unconnected.size(), details.toString(), ids(unconnected));
    }

    /**
     * Delegates to the domain structure validator; passes trivially when the domain has none.
     */
    public ValidationResult validateEntityStructure(Graph graph) {
        if (structureValidator == null) {
            return ValidationResult.pass(ENTITY_STRUCTURE, "No structure validator configured, check skipped");
        }
        List<Entity> invalid = new ArrayList<>();
        Map<String, Map<String, Integer>> missingByKind = new LinkedHashMap<>();
        for (Entity entity : graph.getEntities()) {
            StructureCheck check = structureValidator.validateEntityStructure(graph, entity);
            if (check.valid()) continue;
            invalid.add(entity);
            Map<String, Integer> missing = missingByKind.computeIfAbsent(entity.getKind() + ":" + entity.getSubtype(),
                    k -> new LinkedHashMap<>());
            for (String relationshipKind : check.missing()) {
                missing.merge(relationshipKind, 1, Integer::sum);
            }
        }
        if (invalid.isEmpty()) {
            return ValidationResult.pass(ENTITY_STRUCTURE, "All entities have required relationships");
        }
        StringBuilder details = new StringBuilder(invalid.size() + " entities missing required relationships:\n");
        missingByKind.forEach((kind, missing) -> missing.forEach((relationshipKind, count) ->
                details.append("  - ").append(kind).append(": ").append(count)
                        .append(" (missing ").append(relationshipKind).append(")\n")));
        return new ValidationResult(ENTITY_STRUCTURE, false, invalid.size(), details.toString(), ids(invalid));
    }

    /**
     * Both endpoints of every relationship must exist.
     */
    public ValidationResult validateRelationshipIntegrity(Graph graph) {
        List<String> broken = new ArrayList<>();
        List<Relationship> relationships = graph.getRelationships();
        for (int i = 0; i < relationships.size(); i++) {
            Relationship r = relationships.get(i);
            Entity src = graph.getEntity(r.getSrc());
            Entity dst = graph.getEntity(r.getDst());
            if (src != null && dst != null) continue;
            List<String> flags = new ArrayList<>(2);
            if (src == null) flags.add("src missing");
            if (dst == null) flags.add("dst missing");
            broken.add("[" + i + "] " + r.getKind() + ": "
                    + (src != null ? src.getName() : r.getSrc()) + " → "
                    + (dst != null ? dst.getName() : r.getDst())
                    + " (" + String.join(", ", flags) + ")");
        }
        if (broken.isEmpty()) {
            return ValidationResult.pass(RELATIONSHIP_INTEGRITY, "All relationships reference existing entities");
        }
        return new ValidationResult(RELATIONSHIP_INTEGRITY, false, broken.size(),
                limited(broken.size() + " broken relationships:\n", broken), List.of());
    }

    /**
     * Each entity's cached links must match, by count, the relationships it is the source of.
     */
    public ValidationResult validateLinkSync(Graph graph) {
        Map<String, Integer> outgoing = new HashMap<>();
        for (Relationship r : graph.getRelationships()) {
            outgoing.merge(r.getSrc(), 1, Integer::sum);
        }
        List<String> mismatched = new ArrayList<>();
        List<String> mismatchedIds = new ArrayList<>();
        for (Entity entity : graph.getEntities()) {
            int linkCount = entity.getLinks().size();
            int actual = outgoing.getOrDefault(entity.getId(), 0);
            if (linkCount != actual) {
                mismatched.add(entity.getName() + ": " + linkCount + " in links array, " + actual + " in relationships");
                mismatchedIds.add(entity.getId());
            }
        }
        if (mismatched.isEmpty()) {
            return ValidationResult.pass(LINK_SYNCHRONIZATION, "All entity links match relationships");
        }
        return new ValidationResult(LINK_SYNCHRONIZATION, false, mismatched.size(),
                limited(mismatched.size() + " entities with mismatched links:\n", mismatched), mismatchedIds);
    }

    private static String limited(String header, List<String> lines) {
        StringBuilder details = new StringBuilder(header);
        for (String line : lines.subList(0, Math.min(DETAIL_LIMIT, lines.size()))) {
            details.append("  - ").append(line).append('\n');
        }
        if (lines.size() > DETAIL_LIMIT) {
            details.append("  ... and ").append(lines.size() - DETAIL_LIMIT).append(" more\n");
        }
        return details.toString();
    }

    private static List<String> ids(List<Entity> entities) {
        List<String> ids = new ArrayList<>(entities.size());
        for (Entity e : entities) ids.add(e.getId());
        return ids;
    }
}

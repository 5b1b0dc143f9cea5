package org.loreweave.engine;

import com.typesafe.config.Config;
import org.loreweave.runtime.domain.EntityKindDefinition;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Point3;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.spi.IDomainSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The hand-authored starting world: entities with fixed ids and the relationships between them.
 * <p>
 * A seed world is immutable; {@link #applyTo(Graph, IDomainSchema)} builds fresh entities every time so that a
 * reset run starts from the same state.
 * </p>
 */
public final class SeedWorld {

    private static final Logger LOG = LoggerFactory.getLogger(SeedWorld.class);

    /**
     * One seed entity as configured.
     */
    public record SeedEntity(String id, String kind, String subtype, String name, String description, String status,
                             Prominence prominence, String culture, Map<String, Object> tags, Point3 coordinates) {

        public SeedEntity {
            Objects.requireNonNull(id, "Seed entity id cannot be null.");
            Objects.requireNonNull(kind, "Seed entity kind cannot be null.");
            tags = tags == null ? Map.of() : Map.copyOf(tags);
        }

        EntitySpec toSpec(IDomainSchema domain) {
            String initialStatus = status;
            EntityKindDefinition definition = domain.getEntityKind(kind);
            if (initialStatus == null && definition != null) {
                initialStatus = definition.defaultStatus();
            }
            EntitySpec spec = EntitySpec.of(kind).id(id).subtype(subtype).name(name).description(description)
                    .status(initialStatus).prominence(prominence).culture(culture).coordinates(coordinates);
            return spec.tags(tags);
        }
    }

    /**
     * One seed relationship; endpoints are entity ids or entity names.
     */
    public record SeedRelationship(String kind, String src, String dst, Double strength) {

        public SeedRelationship {
            Objects.requireNonNull(kind, "Seed relationship kind cannot be null.");
            Objects.requireNonNull(src, "Seed relationship src cannot be null.");
            Objects.requireNonNull(dst, "Seed relationship dst cannot be null.");
        }
    }

    private final List<SeedEntity> entities;
    private final List<SeedRelationship> relationships;

    public SeedWorld(List<SeedEntity> entities, List<SeedRelationship> relationships) {
        this.entities = List.copyOf(entities);
        this.relationships = List.copyOf(relationships);
    }

    public static SeedWorld empty() {
        return new SeedWorld(List.of(), List.of());
    }

    /**
     * Reads {@code entities} and {@code relationships} lists from a {@code loreweave.seed-world} block.
     */
    public static SeedWorld fromConfig(Config options) {
        List<SeedEntity> entities = new ArrayList<>();
        if (options.hasPath("entities")) {
            for (Config e : options.getConfigList("entities")) {
                Map<String, Object> tags = new LinkedHashMap<>();
                if (e.hasPath("tags")) {
                    // tags hold booleans or strings; numbers such as temperatures are kept as text
                    e.getConfig("tags").root().unwrapped().forEach((key, value) ->
                            tags.put(key, value instanceof Boolean ? value : String.valueOf(value)));
                }
                Point3 coordinates = null;
                if (e.hasPath("coordinates")) {
                    Config c = e.getConfig("coordinates");
                    coordinates = new Point3(c.getDouble("x"), c.getDouble("y"), c.hasPath("z") ? c.getDouble("z") : 0.0);
                }
                entities.add(new SeedEntity(
                        e.getString("id"),
                        e.getString("kind"),
                        e.hasPath("subtype") ? e.getString("subtype") : null,
                        e.hasPath("name") ? e.getString("name") : null,
                        e.hasPath("description") ? e.getString("description") : null,
                        e.hasPath("status") ? e.getString("status") : null,
                        e.hasPath("prominence") ? Prominence.fromId(e.getString("prominence")) : null,
                        e.hasPath("culture") ? e.getString("culture") : null,
                        tags,
                        coordinates));
            }
        }
        List<SeedRelationship> relationships = new ArrayList<>();
        if (options.hasPath("relationships")) {
            for (Config r : options.getConfigList("relationships")) {
                relationships.add(new SeedRelationship(
                        r.getString("kind"),
                        r.getString("src"),
                        r.getString("dst"),
                        r.hasPath("strength") ? r.getDouble("strength") : null));
            }
        }
        return new SeedWorld(entities, relationships);
    }

    /**
     * Creates the seed entities and relationships in an empty graph. Entities without a status get
     * the default status of their kind.
     *
     * @return ids of the created entities
     */
    public List<String> applyTo(Graph graph, IDomainSchema domain) {
        List<String> ids = new ArrayList<>(entities.size());
        for (SeedEntity entity : entities) {
            ids.add(graph.createEntity(entity.toSpec(domain)));
        }
        for (SeedRelationship relationship : relationships) {
            String src = resolve(graph, relationship.src());
            String dst = resolve(graph, relationship.dst());
            graph.addRelationship(relationship.kind(), src, dst, relationship.strength());
        }
        return ids;
    }

    private static String resolve(Graph graph, String reference) {
        if (graph.hasEntity(reference)) {
            return reference;
        }
        for (Entity entity : graph.getEntities()) {
            if (reference.equals(entity.getName())) {
                return entity.getId();
            }
        }
        LOG.debug("Seed reference '{}' matches no entity id or name", reference);
        return reference;
    }

    public List<SeedEntity> getEntities() {
        return entities;
    }

    public List<SeedRelationship> getRelationships() {
        return relationships;
    }
}

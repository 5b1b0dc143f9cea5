package org.loreweave.runtime.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A partial entity proposed by a template or seed file. Missing fields are filled with defaults
 * when the graph creates the entity.
 */
public final class EntitySpec {

    private final String kind;
    private String id;
    private String subtype;
    private String name;
    private String description;
    private String status;
    private Prominence prominence;
    private String culture;
    private final Map<String, Object> tags = new LinkedHashMap<>();
    private Point3 coordinates;

    private EntitySpec(String kind) {
        this.kind = Objects.requireNonNull(kind, "Entity kind cannot be null.");
    }

    /**
     * Starts a spec for an entity of the given kind.
     */
    public static EntitySpec of(String kind) {
        return new EntitySpec(kind);
    }

    /**
     * Fixes the id instead of letting the graph assign one. Used for seed entities.
     */
    public EntitySpec id(String id) { this.id = id; return this; }

    public EntitySpec subtype(String subtype) { this.subtype = subtype; return this; }

    public EntitySpec name(String name) { this.name = name; return this; }

    public EntitySpec description(String description) { this.description = description; return this; }

    public EntitySpec status(String status) { this.status = status; return this; }

    public EntitySpec prominence(Prominence prominence) { this.prominence = prominence; return this; }

    public EntitySpec culture(String culture) { this.culture = culture; return this; }

    public EntitySpec tag(String key, Object value) { this.tags.put(key, value); return this; }

    public EntitySpec tag(String key) { return tag(key, Boolean.TRUE); }

    public EntitySpec tags(Map<String, ?> values) { this.tags.putAll(values); return this; }

    public EntitySpec coordinates(Point3 coordinates) { this.coordinates = coordinates; return this; }

    public String getKind() { return kind; }
    public String getId() { return id; }
    public String getSubtype() { return subtype; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getStatus() { return status; }
    public Prominence getProminence() { return prominence; }
    public String getCulture() { return culture; }
    public Map<String, Object> getTags() { return tags; }
    public Point3 getCoordinates() { return coordinates; }
}

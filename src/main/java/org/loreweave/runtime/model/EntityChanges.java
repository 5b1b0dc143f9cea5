package org.loreweave.runtime.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A shallow partial update of an entity. Null fields are left unchanged; tag puts and removals are
 * applied on top of the existing tag map.
 */
public final class EntityChanges {

    private String subtype;
    private String name;
    private String description;
    private String status;
    private Prominence prominence;
    private String culture;
    private Point3 coordinates;
    private final Map<String, Object> tagPuts = new LinkedHashMap<>();
    private final Set<String> tagRemovals = new LinkedHashSet<>();

    public static EntityChanges create() {
        return new EntityChanges();
    }

    public EntityChanges subtype(String subtype) { this.subtype = subtype; return this; }

    public EntityChanges name(String name) { this.name = name; return this; }

    public EntityChanges description(String description) { this.description = description; return this; }

    public EntityChanges status(String status) { this.status = status; return this; }

    public EntityChanges prominence(Prominence prominence) { this.prominence = prominence; return this; }

    public EntityChanges culture(String culture) { this.culture = culture; return this; }

    public EntityChanges coordinates(Point3 coordinates) { this.coordinates = coordinates; return this; }

    /**
     * @throws IllegalArgumentException if the value is neither Boolean nor String
     */
    public EntityChanges putTag(String key, Object value) {
        TagMap.checkValue(key, value);
        tagRemovals.remove(key);
        tagPuts.put(key, value);
        return this;
    }

    public EntityChanges removeTag(String key) {
        tagPuts.remove(key);
        tagRemovals.add(key);
        return this;
    }

    /**
     * Merges later changes into this one; fields set in {@code other} win.
     */
    public EntityChanges merge(EntityChanges other) {
        if (other.subtype != null) subtype = other.subtype;
        if (other.name != null) name = other.name;
        if (other.description != null) description = other.description;
        if (other.status != null) status = other.status;
        if (other.prominence != null) prominence = other.prominence;
        if (other.culture != null) culture = other.culture;
        if (other.coordinates != null) coordinates = other.coordinates;
        other.tagPuts.forEach(this::putTag);
        other.tagRemovals.forEach(this::removeTag);
        return this;
    }

    /**
     * Applies the changes to the entity. Does not stamp {@code updatedAt}; the graph does.
     */
    void applyTo(Entity entity) {
        if (subtype != null) entity.setSubtype(subtype);
        if (name != null) entity.setName(name);
        if (description != null) entity.setDescription(description);
        if (status != null) entity.setStatus(status);
        if (prominence != null) entity.setProminence(prominence);
        if (culture != null) entity.setCulture(culture);
        if (coordinates != null) entity.setCoordinates(coordinates);
        tagRemovals.forEach(entity.getTags()::remove);
        tagPuts.forEach(entity.getTags()::put);
    }

    public boolean isEmpty() {
        return subtype == null && name == null && description == null && status == null && prominence == null
                && culture == null && coordinates == null && tagPuts.isEmpty() && tagRemovals.isEmpty();
    }

    public String getStatus() { return status; }
    public Prominence getProminence() { return prominence; }
    public String getName() { return name; }
    public String getCulture() { return culture; }
    public Map<String, Object> getTagPuts() { return tagPuts; }
    public Set<String> getTagRemovals() { return tagRemovals; }
}

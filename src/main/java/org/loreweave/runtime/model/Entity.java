package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A typed node of the world graph ("hard state").
 * <p>
 * Kind, subtype and status are open string identifiers validated by the domain schema rather
 * than compile-time enums. {@link #getLinks()} caches copies of the relationships this entity is
 * the source of; only {@link Graph} mutates that cache.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "kind", "subtype", "name", "description", "status", "prominence", "culture",
        "tags", "links", "createdAt", "updatedAt", "coordinates"})
public final class Entity {

    private final String id;
    private final String kind;
    private String subtype;
    private String name;
    private String description;
    private String status;
    private Prominence prominence;
    private String culture;
    private TagMap tags;
    private final List<Relationship> links = new ArrayList<>();
    private long createdAt;
    private long updatedAt;
    private Point3 coordinates;

    /**
     * Creates an entity with empty tags and no links.
     *
     * @param id unique id
     * @param kind entity kind, e.g. npc or location
     */
    public Entity(String id, String kind) {
        this.id = Objects.requireNonNull(id, "Entity id cannot be null.");
        this.kind = Objects.requireNonNull(kind, "Entity kind cannot be null.");
        this.subtype = "";
        this.name = "";
        this.description = "";
        this.status = "";
        this.prominence = Prominence.MARGINAL;
        this.culture = "";
        this.tags = new TagMap();
    }

    @JsonProperty("id")
    public String getId() { return id; }

    @JsonProperty("kind")
    public String getKind() { return kind; }

    @JsonProperty("subtype")
    public String getSubtype() { return subtype; }

    public void setSubtype(String subtype) { this.subtype = subtype; }

    @JsonProperty("name")
    public String getName() { return name; }

    public void setName(String name) { this.name = name; }

    @JsonProperty("description")
    public String getDescription() { return description; }

    public void setDescription(String description) { this.description = description; }

    @JsonProperty("status")
    public String getStatus() { return status; }

    public void setStatus(String status) { this.status = status; }

    @JsonProperty("prominence")
    public Prominence getProminence() { return prominence; }

    public void setProminence(Prominence prominence) { this.prominence = prominence; }

    @JsonProperty("culture")
    public String getCulture() { return culture; }

    public void setCulture(String culture) { this.culture = culture; }

    @JsonProperty("tags")
    public TagMap getTags() { return tags; }

    public void setTags(TagMap tags) { this.tags = Objects.requireNonNull(tags, "Tags cannot be null."); }

    /**
     * Cached outgoing relationships. Read-only view.
     */
    @JsonProperty("links")
    public List<Relationship> getLinks() { return Collections.unmodifiableList(links); }

    @JsonProperty("createdAt")
    public long getCreatedAt() { return createdAt; }

    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }

    @JsonProperty("updatedAt")
    public long getUpdatedAt() { return updatedAt; }

    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }

    @JsonProperty("coordinates")
    public Point3 getCoordinates() { return coordinates; }

    public void setCoordinates(Point3 coordinates) { this.coordinates = coordinates; }

    /**
     * @return true if this entity has the given kind and, when non-null, subtype
     */
    public boolean is(String kind, String subtype) {
        return this.kind.equals(kind) && (subtype == null || subtype.equals(this.subtype));
    }

    // Link cache maintenance, owned by Graph.

    void addLink(Relationship copy) {
        links.add(copy);
    }

    boolean removeLinksIf(Predicate<Relationship> filter) {
        return links.removeIf(filter);
    }

    Relationship findLink(String dst, String kind) {
        for (Relationship link : links) {
            if (link.getDst().equals(dst) && link.getKind().equals(kind)) {
                return link;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + ":" + subtype + " " + id + " (" + name + ")";
    }
}

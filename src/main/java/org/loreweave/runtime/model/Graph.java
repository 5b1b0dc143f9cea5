package org.loreweave.runtime.model;

import org.loreweave.runtime.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The world graph: entities, relationships and the global simulation state around them.
 * <p>
 * The graph is the single owned aggregate of a run. It is mutated in place by the tick driver and
 * is not thread-safe. Every relationship mutation keeps the source entity's cached links in step
 * with the global relationship list.
 * </p>
 */
public class Graph {

    private static final Logger LOG = LoggerFactory.getLogger(Graph.class);

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final List<Relationship> relationships = new ArrayList<>();
    private final Map<String, Double> pressures = new LinkedHashMap<>();
    private final Map<String, Map<String, Long>> relationshipCooldowns = new HashMap<>();
    private final DiscoveryState discoveryState = new DiscoveryState();
    private final GrowthMetrics growthMetrics = new GrowthMetrics();
    private final List<HistoryEvent> history = new ArrayList<>();
    private final Set<String> thresholdWarnings = new HashSet<>();
    private final IRandomProvider random;
    private long tick;
    private Era currentEra = Era.neutral("initial");
    private long nextId = 1;

    /**
     * Creates an empty graph at tick 0.
     *
     * @param random source for lineage distances drawn when a relationship is added without one
     */
    public Graph(IRandomProvider random) {
        this.random = Objects.requireNonNull(random, "Random provider cannot be null.");
    }

    // ---------------------------------------------------------------- entities

    /**
     * @return the entity, or null if no entity has this id
     */
    public Entity getEntity(String id) {
        return entities.get(id);
    }

    public boolean hasEntity(String id) {
        return entities.containsKey(id);
    }

    /**
     * Read-only view of all entities in insertion order.
     */
    public Collection<Entity> getEntities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    /**
     * Returns all entities matching the criteria, in insertion order.
     */
    public List<Entity> findEntities(Predicate<Entity> criteria) {
        return entities.values().stream().filter(criteria).collect(Collectors.toList());
    }

    /**
     * Counts entities by kind and subtype; null arguments match anything.
     */
    public int getEntityCount(String kind, String subtype) {
        int count = 0;
        for (Entity e : entities.values()) {
            if ((kind == null || kind.equals(e.getKind())) && (subtype == null || subtype.equals(e.getSubtype()))) {
                count++;
            }
        }
        return count;
    }

    public int getEntityCount() {
        return entities.size();
    }

    /**
     * Creates an entity from a spec, filling defaults and stamping createdAt/updatedAt with the current tick.
     *
     * @return the id of the new entity
     * @throws IllegalArgumentException if the spec carries an id that is already taken
     */
    public String createEntity(EntitySpec spec) {
        String id = spec.getId() != null ? spec.getId() : nextIdFor(spec.getKind());
        if (entities.containsKey(id)) {
            throw new IllegalArgumentException("Entity id already exists: " + id);
        }
        Entity entity = new Entity(id, spec.getKind());
        if (spec.getSubtype() != null) entity.setSubtype(spec.getSubtype());
        entity.setName(spec.getName() != null ? spec.getName() : id);
        if (spec.getDescription() != null) entity.setDescription(spec.getDescription());
        if (spec.getStatus() != null) entity.setStatus(spec.getStatus());
        entity.setProminence(spec.getProminence() != null ? spec.getProminence() : Prominence.MARGINAL);
        if (spec.getCulture() != null) entity.setCulture(spec.getCulture());
        entity.setTags(TagMap.of(spec.getTags()));
        entity.setCoordinates(spec.getCoordinates());
        entity.setCreatedAt(tick);
        entity.setUpdatedAt(tick);
        entities.put(id, entity);
        return id;
    }

    /**
     * Inserts a fully formed entity, keeping its id and timestamps. Used for seed entities and for
     * entities a template must place before the rest of its batch is committed.
     *
     * @throws IllegalArgumentException if the id is taken or the entity already carries links
     */
    public void addEntity(Entity entity) {
        if (entities.containsKey(entity.getId())) {
            throw new IllegalArgumentException("Entity id already exists: " + entity.getId());
        }
        if (!entity.getLinks().isEmpty()) {
            throw new IllegalArgumentException("Entity " + entity.getId() + " must be added without links");
        }
        entities.put(entity.getId(), entity);
    }

    private String nextIdFor(String kind) {
        String id;
        do {
            id = kind + "_" + nextId++;
        } while (entities.containsKey(id));
        return id;
    }

    /**
     * Shallow-merges changes into an entity and stamps updatedAt.
     *
     * @return false if the entity does not exist
     */
    public boolean updateEntity(String id, EntityChanges changes) {
        Entity entity = entities.get(id);
        if (entity == null) {
            LOG.debug("Ignoring update of missing entity {}", id);
            return false;
        }
        changes.applyTo(entity);
        entity.setUpdatedAt(tick);
        return true;
    }

    /**
     * Deletes an entity together with every relationship that touches it.
     *
     * @return false if the entity did not exist
     */
    public boolean deleteEntity(String id) {
        if (entities.remove(id) == null) {
            return false;
        }
        removeRelationshipsIf(r -> r.involves(id));
        relationshipCooldowns.remove(id);
        return true;
    }

    // ----------------------------------------------------------- relationships

    /**
     * Adds a relationship with default strength, distance and category.
     *
     * @see #addRelationship(String, String, String, Double, Double, RelationshipCategory)
     */
    public boolean addRelationship(String kind, String src, String dst) {
        return addRelationship(kind, src, dst, null, null, null);
    }

    /**
     * Adds a relationship with an explicit strength.
     */
    public boolean addRelationship(String kind, String src, String dst, Double strength) {
        return addRelationship(kind, src, dst, strength, null, null);
    }

    /**
     * Adds a relationship unless an identical (kind, src, dst) triple already exists.
     * <p>
     * On success an identical copy is pushed onto the source entity's links and both endpoints get
     * {@code updatedAt} stamped. Endpoints are not required to exist: a dangling relationship is
     * inserted and logged, and is reported later by validation.
     * </p>
     *
     * @param strength strength in [0, 1], null for the kind's default
     * @param distance lineage distance, null to draw one for lineage kinds
     * @param category category, null to derive it from the kind
     * @return true if the relationship was added, false if it already existed
     */
    public boolean addRelationship(String kind, String src, String dst, Double strength, Double distance,
                                   RelationshipCategory category) {
        if (hasRelationship(src, dst, kind)) {
            return false;
        }
        double s = strength != null ? clamp01(strength) : RelationshipKinds.defaultStrength(kind);
        Double d = distance;
        if (d == null && RelationshipKinds.isLineage(kind)) {
            double[] range = RelationshipKinds.distanceRange(kind);
            d = Probabilities.between(random, range[0], range[1]);
        }
        RelationshipCategory c = category != null ? category : RelationshipKinds.categoryOf(kind);
        Relationship relationship = new Relationship(kind, src, dst, s, d, c);
        relationships.add(relationship);

        Entity source = entities.get(src);
        Entity target = entities.get(dst);
        if (source == null || target == null) {
            LOG.warn("Relationship {} references a missing entity ({})", relationship,
                    source == null && target == null ? "src and dst missing" : source == null ? "src missing" : "dst missing");
        }
        if (source != null) {
            source.addLink(relationship.copy());
            source.setUpdatedAt(tick);
            checkWarningThreshold(source, kind);
        }
        if (target != null) {
            target.setUpdatedAt(tick);
        }
        return true;
    }

    private void checkWarningThreshold(Entity source, String kind) {
        int threshold = RelationshipKinds.warningThreshold(source.getKind(), kind);
        long count = source.getLinks().stream().filter(l -> l.getKind().equals(kind)).count();
        if (count > threshold && thresholdWarnings.add(source.getId() + "|" + kind)) {
            LOG.warn("Entity {} has {} '{}' relationships (soft limit {})", source.getId(), count, kind, threshold);
        }
    }

    /**
     * Removes the relationship with the given identity triple and its cached link.
     *
     * @return true if a relationship was removed
     */
    public boolean removeRelationship(String src, String dst, String kind) {
        return removeRelationshipsIf(r -> r.matches(src, dst, kind)) > 0;
    }

    /**
     * Removes every relationship matching the filter, keeping links in sync.
     *
     * @return the number of relationships removed
     */
    public int removeRelationshipsIf(Predicate<Relationship> filter) {
        int removed = 0;
        Iterator<Relationship> it = relationships.iterator();
        while (it.hasNext()) {
            Relationship r = it.next();
            if (filter.test(r)) {
                it.remove();
                removed++;
                Entity source = entities.get(r.getSrc());
                if (source != null) {
                    source.removeLinksIf(l -> l.matches(r.getSrc(), r.getDst(), r.getKind()));
                }
            }
        }
        return removed;
    }

    public boolean hasRelationship(String src, String dst, String kind) {
        return findRelationship(src, dst, kind) != null;
    }

    /**
     * @return the relationship with the identity triple, or null
     */
    public Relationship findRelationship(String src, String dst, String kind) {
        for (Relationship r : relationships) {
            if (r.matches(src, dst, kind)) {
                return r;
            }
        }
        return null;
    }

    /**
     * Relationships touching an entity from the given side.
     */
    public List<Relationship> getEntityRelationships(String id, Direction direction) {
        List<Relationship> result = new ArrayList<>();
        for (Relationship r : relationships) {
            boolean out = r.getSrc().equals(id);
            boolean in = r.getDst().equals(id);
            if ((direction == Direction.SRC && out) || (direction == Direction.DST && in)
                    || (direction == Direction.BOTH && (out || in))) {
                result.add(r);
            }
        }
        return result;
    }

    /**
     * Read-only view of all relationships in insertion (chronological) order.
     */
    public List<Relationship> getRelationships() {
        return Collections.unmodifiableList(relationships);
    }

    /**
     * Marks a relationship historical. It stays in the graph.
     *
     * @return false if no such relationship exists
     */
    public boolean archiveRelationship(String src, String dst, String kind) {
        Relationship r = findRelationship(src, dst, kind);
        if (r == null) return false;
        r.setStatus(RelationshipStatus.HISTORICAL);
        r.setArchivedAt(tick);
        Entity source = entities.get(src);
        if (source != null) {
            Relationship link = source.findLink(dst, kind);
            if (link != null) {
                link.setStatus(RelationshipStatus.HISTORICAL);
                link.setArchivedAt(tick);
            }
        }
        return true;
    }

    /**
     * Adds {@code delta} to a relationship's strength, clamped to [0, 1], and mirrors it into the link.
     *
     * @return false if no such relationship exists
     */
    public boolean modifyRelationshipStrength(String src, String dst, String kind, double delta) {
        Relationship r = findRelationship(src, dst, kind);
        if (r == null) return false;
        setStrength(r, r.getStrength() + delta);
        return true;
    }

    /**
     * Sets a relationship's strength, clamped to [0, 1], and mirrors it into the cached link.
     */
    public void setStrength(Relationship r, double strength) {
        double clamped = clamp01(strength);
        r.setStrength(clamped);
        Entity source = entities.get(r.getSrc());
        if (source != null) {
            Relationship link = source.findLink(r.getDst(), r.getKind());
            if (link != null) {
                link.setStrength(clamped);
            }
        }
    }

    // -------------------------------------------------------------- cooldowns

    /**
     * @return true if the entity formed no relationship of this kind within the last {@code cooldown} ticks
     */
    public boolean canFormRelationship(String entityId, String kind, long cooldown) {
        Map<String, Long> perKind = relationshipCooldowns.get(entityId);
        if (perKind == null) return true;
        Long last = perKind.get(kind);
        return last == null || tick - last >= cooldown;
    }

    /**
     * Records that the entity formed a relationship of this kind at the current tick.
     */
    public void recordRelationshipFormation(String entityId, String kind) {
        relationshipCooldowns.computeIfAbsent(entityId, k -> new HashMap<>()).put(kind, tick);
    }

    /**
     * @return the tick the entity last formed this kind, or null
     */
    public Long getLastFormation(String entityId, String kind) {
        Map<String, Long> perKind = relationshipCooldowns.get(entityId);
        return perKind == null ? null : perKind.get(kind);
    }

    // -------------------------------------------------------------- pressures

    /**
     * @return the pressure value, 0 if unset
     */
    public double getPressure(String id) {
        return pressures.getOrDefault(id, 0.0);
    }

    /**
     * Sets a pressure, clamped to [{@link Config#PRESSURE_MIN}, {@link Config#PRESSURE_MAX}].
     */
    public void setPressure(String id, double value) {
        pressures.put(id, Math.max(Config.PRESSURE_MIN, Math.min(Config.PRESSURE_MAX, value)));
    }

    public Map<String, Double> getPressures() {
        return Collections.unmodifiableMap(pressures);
    }

    // ------------------------------------------------------------ bookkeeping

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }

    public void advanceTick() {
        tick++;
    }

    public Era getCurrentEra() {
        return currentEra;
    }

    public void setCurrentEra(Era era) {
        this.currentEra = Objects.requireNonNull(era, "Era cannot be null.");
    }

    public DiscoveryState getDiscoveryState() {
        return discoveryState;
    }

    public GrowthMetrics getGrowthMetrics() {
        return growthMetrics;
    }

    public void addHistoryEvent(HistoryEvent event) {
        history.add(event);
    }

    public List<HistoryEvent> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * The random source this graph draws lineage distances from.
     */
    public IRandomProvider getRandom() {
        return random;
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}

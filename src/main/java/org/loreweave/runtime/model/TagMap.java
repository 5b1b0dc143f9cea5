package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.loreweave.runtime.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Bounded tag map of an entity. Values are either {@link Boolean} flags or {@link String} values
 * (cluster ids, temperatures, belief markers).
 * <p>
 * At most {@link Config#MAX_TAGS} entries are held. Overwriting an existing key always succeeds; inserting
 * a new key into a full map evicts the oldest entry (insertion order).
 * </p>
 */
public final class TagMap {

    private static final Logger LOG = LoggerFactory.getLogger(TagMap.class);

    private final LinkedHashMap<String, Object> tags = new LinkedHashMap<>();
    private final int capacity;

    /**
     * Creates an empty tag map with the default capacity.
     */
    public TagMap() {
        this(Config.MAX_TAGS);
    }

    /**
     * Creates an empty tag map with a custom capacity.
     *
     * @param capacity maximum number of entries, must be positive
     */
    public TagMap(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Tag capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Creates a tag map from existing entries, applying the eviction policy in iteration order.
     */
    @JsonCreator
    public static TagMap of(Map<String, ?> entries) {
        TagMap map = new TagMap();
        if (entries != null) {
            entries.forEach(map::put);
        }
        return map;
    }

    /**
     * Sets a tag.
     *
     * @param key tag key
     * @param value a Boolean or String value
     * @return the key evicted to make room, or null if nothing was evicted
     * @throws IllegalArgumentException if the value is neither Boolean nor String
     */
    public String put(String key, Object value) {
        checkValue(key, value);
        String evicted = null;
        if (!tags.containsKey(key) && tags.size() >= capacity) {
            Iterator<String> oldest = tags.keySet().iterator();
            evicted = oldest.next();
            oldest.remove();
            LOG.debug("Tag map full, evicted '{}' to store '{}'", evicted, key);
        }
        tags.put(key, value);
        return evicted;
    }

    /**
     * Rejects keys and values a tag map cannot hold.
     *
     * @throws IllegalArgumentException if the value is neither Boolean nor String
     */
    public static void checkValue(String key, Object value) {
        Objects.requireNonNull(key, "Tag key cannot be null.");
        if (!(value instanceof Boolean) && !(value instanceof String)) {
            throw new IllegalArgumentException("Tag '" + key + "' must be a boolean or string, was " + value);
        }
    }

    /**
     * Sets a boolean flag tag.
     */
    public String putFlag(String key) {
        return put(key, Boolean.TRUE);
    }

    public Object get(String key) {
        return tags.get(key);
    }

    /**
     * Returns the tag value if it is a string.
     */
    public Optional<String> getString(String key) {
        Object value = tags.get(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Returns true if the key is present with any value other than {@code false}.
     */
    public boolean has(String key) {
        Object value = tags.get(key);
        return value != null && !Boolean.FALSE.equals(value);
    }

    public boolean remove(String key) {
        return tags.remove(key) != null;
    }

    public int size() {
        return tags.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(tags.keySet());
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(tags);
    }

    /**
     * Returns an independent copy with the same capacity.
     */
    public TagMap copy() {
        TagMap copy = new TagMap(capacity);
        copy.tags.putAll(tags);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagMap other)) return false;
        return tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}

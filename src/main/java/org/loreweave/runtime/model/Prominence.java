package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered renown of an entity, from {@link #FORGOTTEN} to {@link #MYTHIC}.
 */
public enum Prominence {
    FORGOTTEN,
    MARGINAL,
    RECOGNIZED,
    RENOWNED,
    MYTHIC;

    /**
     * Returns the prominence {@code steps} levels away, clamped to the ends of the scale.
     *
     * @param steps positive to rise, negative to fall
     * @return the shifted prominence
     */
    public Prominence shift(int steps) {
        int index = Math.max(0, Math.min(values().length - 1, ordinal() + steps));
        return values()[index];
    }

    /**
     * @return true if this prominence is at least {@code other}
     */
    public boolean isAtLeast(Prominence other) {
        return ordinal() >= other.ordinal();
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a prominence from its lowercase identifier.
     *
     * @throws IllegalArgumentException if the value is unknown
     */
    @JsonCreator
    public static Prominence fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Prominence cannot be null");
        }
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}

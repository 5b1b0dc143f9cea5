package org.loreweave.runtime.pressure;

import com.typesafe.config.Config;

import java.util.Objects;

/**
 * A named pressure with its starting value, the decay that pulls it toward equilibrium at each
 * epoch and the growth function feeding it.
 *
 * @param id stable identifier, e.g. conflict
 * @param name display name
 * @param initialValue value at tick 0, in [0, 100]
 * @param decay amount moved toward equilibrium per epoch
 * @param growth growth function
 */
public record PressureDefinition(String id, String name, double initialValue, double decay, IPressureGrowth growth) {

    public PressureDefinition {
        Objects.requireNonNull(id, "Pressure id cannot be null.");
        Objects.requireNonNull(growth, "Pressure growth cannot be null.");
        if (initialValue < 0 || initialValue > 100) {
            throw new IllegalArgumentException("Initial value of pressure " + id + " must be in [0, 100]: " + initialValue);
        }
        if (decay < 0) {
            throw new IllegalArgumentException("Decay of pressure " + id + " must not be negative: " + decay);
        }
    }

    /**
     * Reads a definition from one entry of {@code loreweave.pressures}.
     * Growth is selected by {@code growth.type} through {@link PressureGrowthFunctions}.
     */
    public static PressureDefinition fromConfig(Config options) {
        String id = options.getString("id");
        Config growthConfig = options.hasPath("growth") ? options.getConfig("growth") : null;
        IPressureGrowth growth = growthConfig == null
                ? PressureGrowthFunctions.create("constant", null)
                : PressureGrowthFunctions.create(growthConfig.getString("type"), growthConfig);
        return new PressureDefinition(
                id,
                options.hasPath("name") ? options.getString("name") : id,
                options.hasPath("initial-value") ? options.getDouble("initial-value") : 0.0,
                options.hasPath("decay") ? options.getDouble("decay") : 0.0,
                growth);
    }
}

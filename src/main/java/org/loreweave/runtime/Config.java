package org.loreweave.runtime;

/**
 * Central constants of the world generation runtime. Tunable values that vary per world live in
 * Typesafe Config ({@code reference.conf}); the values here are structural limits of the model.
 * It is not meant to be instantiated.
 */
public final class Config {

    private Config() {}

    /**
     * The maximum number of entries an entity's tag map may hold.
     */
    public static final int MAX_TAGS = 10;

    /**
     * Lower bound of every pressure value.
     */
    public static final double PRESSURE_MIN = 0.0;

    /**
     * Upper bound of every pressure value.
     */
    public static final double PRESSURE_MAX = 100.0;

    /**
     * The point pressure decay pulls toward at epoch boundaries.
     */
    public static final double PRESSURE_EQUILIBRIUM = 50.0;

    /**
     * Strength given to a relationship whose kind has no entry in the default strength table.
     */
    public static final double DEFAULT_RELATIONSHIP_STRENGTH = 0.5;

    /**
     * Number of per-tick relationship deltas kept for growth monitoring.
     */
    public static final int GROWTH_WINDOW_SIZE = 20;

    /**
     * Average relationships per tick above which high growth is reported.
     */
    public static final double GROWTH_WARNING_RATE = 30.0;

    /**
     * Minimum window fill before the growth warning may fire.
     */
    public static final int GROWTH_WARNING_MIN_SAMPLES = 10;

    /**
     * Initial discovery threshold of a fresh graph.
     */
    public static final double INITIAL_DISCOVERY_THRESHOLD = 0.3;

    /**
     * Initial "last discovery" tick, far enough in the past that the first discovery is never on cooldown.
     */
    public static final long INITIAL_LAST_DISCOVERY_TICK = -999L;

    /**
     * Maximum number of operational errors retained by the engine.
     */
    public static final int MAX_RECORDED_ERRORS = 100;

    /**
     * Tag key holding the diffused temperature of a location.
     */
    public static final String TEMPERATURE_TAG = "temp";

    /**
     * Temperature assumed for locations without a temperature tag.
     */
    public static final double DEFAULT_TEMPERATURE = 0.5;
}

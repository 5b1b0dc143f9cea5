package org.loreweave.runtime.spi;

/**
 * Interface for components whose internal state can be captured and restored.
 * <p>
 * The world engine uses this to snapshot the random stream at construction time so that
 * {@code reset()} replays a run from exactly the same point. Implementations should produce
 * a deterministic binary form of their state.
 * </p>
 */
public interface ISerializable {

    /**
     * Serializes the complete internal state of this component.
     *
     * @return byte array with the full state, or an empty array for stateless components
     */
    byte[] saveState();

    /**
     * Restores the internal state of this component from a previously saved state.
     *
     * @param state the bytes previously returned by {@link #saveState()}
     * @throws IllegalArgumentException if state is null or incompatible with this component
     */
    void loadState(byte[] state);
}

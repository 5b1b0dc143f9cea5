package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.spi.ISimulationSystem;

/**
 * Creates a simulation system from its options block.
 */
@FunctionalInterface
public interface ISystemCreator {

    /**
     * @param options the system's {@code params} block, empty when none is configured
     */
    ISimulationSystem create(Config options);
}

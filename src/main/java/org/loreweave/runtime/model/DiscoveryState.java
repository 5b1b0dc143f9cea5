package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.loreweave.runtime.Config;

/**
 * Rate-limit state for emergent location discovery.
 */
public final class DiscoveryState {

    private double currentThreshold = Config.INITIAL_DISCOVERY_THRESHOLD;
    private long lastDiscoveryTick = Config.INITIAL_LAST_DISCOVERY_TICK;
    private int discoveriesThisEpoch;

    /**
     * Records a discovery made at the given tick.
     */
    public void recordDiscovery(long tick) {
        lastDiscoveryTick = tick;
        discoveriesThisEpoch++;
    }

    /**
     * Clears the per-epoch counter. Called at every epoch boundary.
     */
    public void resetEpoch() {
        discoveriesThisEpoch = 0;
    }

    @JsonProperty("currentThreshold")
    public double getCurrentThreshold() { return currentThreshold; }

    public void setCurrentThreshold(double currentThreshold) { this.currentThreshold = currentThreshold; }

    @JsonProperty("lastDiscoveryTick")
    public long getLastDiscoveryTick() { return lastDiscoveryTick; }

    @JsonProperty("discoveriesThisEpoch")
    public int getDiscoveriesThisEpoch() { return discoveriesThisEpoch; }
}

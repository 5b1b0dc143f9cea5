package org.loreweave.runtime.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.loreweave.runtime.Config;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rolling window of relationships added per tick.
 */
public final class GrowthMetrics {

    private final Deque<Integer> relationshipsPerTick = new ArrayDeque<>();
    private double averageGrowthRate;

    /**
     * Pushes a per-tick delta, dropping the oldest sample once the window is full, and recomputes the average.
     *
     * @return the new average
     */
    public double record(int delta) {
        relationshipsPerTick.addLast(delta);
        if (relationshipsPerTick.size() > Config.GROWTH_WINDOW_SIZE) {
            relationshipsPerTick.removeFirst();
        }
        double sum = 0;
        for (int d : relationshipsPerTick) sum += d;
        averageGrowthRate = sum / relationshipsPerTick.size();
        return averageGrowthRate;
    }

    /**
     * @return true when the window is full enough and the average exceeds the warning rate
     */
    public boolean isGrowthExcessive() {
        return relationshipsPerTick.size() >= Config.GROWTH_WARNING_MIN_SAMPLES
                && averageGrowthRate > Config.GROWTH_WARNING_RATE;
    }

    @JsonProperty("relationshipsPerTick")
    public List<Integer> getRelationshipsPerTick() { return new ArrayList<>(relationshipsPerTick); }

    @JsonProperty("averageGrowthRate")
    public double getAverageGrowthRate() { return averageGrowthRate; }
}

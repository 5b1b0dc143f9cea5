package org.loreweave.runtime.pressure;

import org.loreweave.runtime.Config;
import org.loreweave.runtime.model.Era;
import org.loreweave.runtime.model.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the pressure values of a graph.
 * <p>
 * Systems and templates propose deltas during a tick. {@link #flush()} sums them per pressure,
 * limits each sum to {@code maxDeltaPerTick} and clamps the result to [0, 100]. At every epoch
 * boundary {@link #updateEpoch(Era)} applies the growth functions and the decay toward equilibrium.
 * </p>
 */
public class PressureController {

    private static final Logger LOG = LoggerFactory.getLogger(PressureController.class);

    private final Graph graph;
    private final List<PressureDefinition> definitions;
    private final double maxDeltaPerTick;
    private final Map<String, Double> pending = new LinkedHashMap<>();

    /**
     * @param maxDeltaPerTick largest absolute change a pressure may take in one flush; must be positive
     */
    public PressureController(Graph graph, List<PressureDefinition> definitions, double maxDeltaPerTick) {
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null.");
        this.definitions = List.copyOf(definitions);
        if (maxDeltaPerTick <= 0) {
            throw new IllegalArgumentException("maxDeltaPerTick must be positive: " + maxDeltaPerTick);
        }
        this.maxDeltaPerTick = maxDeltaPerTick;
    }

    /**
     * Writes every definition's initial value into the graph and drops pending deltas.
     */
    public void initialize() {
        pending.clear();
        for (PressureDefinition definition : definitions) {
            graph.setPressure(definition.id(), definition.initialValue());
        }
    }

    /**
     * @return the pressure value, 0 if unset
     */
    public double getPressure(String id) {
        return graph.getPressure(id);
    }

    /**
     * Queues a delta to be applied by the next {@link #flush()}.
     */
    public void propose(String id, double delta) {
        if (delta == 0 || Double.isNaN(delta)) return;
        pending.merge(id, delta, Double::sum);
    }

    /**
     * Queues every entry of a change map.
     */
    public void proposeAll(Map<String, Double> changes) {
        changes.forEach(this::propose);
    }

    /**
     * Applies the summed, smoothed and clamped pending deltas.
     *
     * @return the delta actually applied per pressure
     */
    public Map<String, Double> flush() {
        if (pending.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> applied = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : pending.entrySet()) {
            double limited = Math.max(-maxDeltaPerTick, Math.min(maxDeltaPerTick, entry.getValue()));
            double before = graph.getPressure(entry.getKey());
            graph.setPressure(entry.getKey(), before + limited);
            applied.put(entry.getKey(), graph.getPressure(entry.getKey()) - before);
        }
        pending.clear();
        return applied;
    }

    /**
     * Epoch update: {@code value + (growth + decayTowardEquilibrium) × eraModifier}, clamped.
     * Decay never carries a value past equilibrium.
     */
    public void updateEpoch(Era era) {
        for (PressureDefinition definition : definitions) {
            double current = graph.getPressure(definition.id());
            double growth = safeGrowth(definition);
            double gap = Config.PRESSURE_EQUILIBRIUM - current;
            double decay = Math.copySign(Math.min(definition.decay(), Math.abs(gap)), gap);
            double next = current + (growth + decay) * era.pressureModifier(definition.id());
            graph.setPressure(definition.id(), next);
            LOG.debug("Pressure {}: {} -> {} (growth {}, decay {})", definition.id(),
                    round(current), round(graph.getPressure(definition.id())), round(growth), round(decay));
        }
    }

    private double safeGrowth(PressureDefinition definition) {
        double growth = definition.growth().compute(graph);
        if (Double.isNaN(growth) || Double.isInfinite(growth)) {
            LOG.warn("Growth of pressure {} is not finite, using 0", definition.id());
            return 0.0;
        }
        return growth;
    }

    public List<PressureDefinition> getDefinitions() {
        return Collections.unmodifiableList(new ArrayList<>(definitions));
    }

    /**
     * Pending, not yet flushed deltas.
     */
    public Map<String, Double> getPending() {
        return Collections.unmodifiableMap(pending);
    }

    private static String round(double v) {
        return String.format("%.2f", v);
    }
}

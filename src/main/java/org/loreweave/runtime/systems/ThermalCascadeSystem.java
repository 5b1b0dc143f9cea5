package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.mutation.ProposedRelationship;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Heat diffusion over the {@code adjacent_to} network of locations.
 * <p>
 * Every {@code frequency} ticks each location moves toward the mean temperature of its neighbours:
 * {@code T' = T + alpha * mean(T_neighbour - T)}. Temperatures live in the {@value #TEMPERATURE_TAG}
 * tag as a string in [0, 1], 0.5 when absent. A location whose temperature jumps by at least the
 * excursion threshold, or sits outside [0.2, 0.8], has an excursion: thriving colonies wane at the
 * extremes, waning colonies may recover in the temperate band, residents flee extreme heat or cold,
 * and warming may let abilities manifest again.
 * </p>
 */
public class ThermalCascadeSystem implements ISimulationSystem {

    public static final String TEMPERATURE_TAG = org.loreweave.runtime.Config.TEMPERATURE_TAG;
    static final double NEUTRAL_TEMPERATURE = org.loreweave.runtime.Config.DEFAULT_TEMPERATURE;

    private final int frequency;
    private final double alpha;
    private final double excursionThreshold;
    private final double recoveryChance;
    private final double migrationChance;
    private final long migrationCooldown;
    private final double rediscoveryChance;

    public ThermalCascadeSystem(Config options) {
        this.frequency = options.hasPath("frequency") ? options.getInt("frequency") : 5;
        this.alpha = options.hasPath("alpha") ? options.getDouble("alpha") : 0.1;
        this.excursionThreshold = options.hasPath("excursion-threshold") ? options.getDouble("excursion-threshold") : 0.3;
        this.recoveryChance = options.hasPath("recovery-chance") ? options.getDouble("recovery-chance") : 0.3;
        this.migrationChance = options.hasPath("migration-chance") ? options.getDouble("migration-chance") : 0.5;
        this.migrationCooldown = options.hasPath("migration-cooldown") ? options.getLong("migration-cooldown") : 10L;
        this.rediscoveryChance = options.hasPath("rediscovery-chance") ? options.getDouble("rediscovery-chance") : 0.1;
        if (frequency < 1) {
            throw new IllegalArgumentException("Thermal cascade frequency must be >= 1, was " + frequency);
        }
    }

    @Override
    public String getId() {
        return "thermal_cascade";
    }

    @Override
    public String getName() {
        return "Thermal Dynamics";
    }

    /**
     * Temperature of a location, {@value #NEUTRAL_TEMPERATURE} if untagged or unparsable.
     */
    public static double temperatureOf(Entity location) {
        return location.getTags().getString(TEMPERATURE_TAG).map(value -> {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                return NEUTRAL_TEMPERATURE;
            }
        }).orElse(NEUTRAL_TEMPERATURE);
    }

    static String formatTemperature(double temperature) {
        return String.format(Locale.ROOT, "%.3f", temperature);
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (graph.getTick() % frequency != 0) {
            return SystemResult.dormant("Thermal cascade dormant");
        }

        List<Entity> locations = graph.findEntities(e -> "location".equals(e.getKind()));
        Map<Entity, Double> updated = new LinkedHashMap<>();
        for (Entity location : locations) {
            double current = temperatureOf(location);
            List<Entity> neighbors = GraphQueries.getRelated(graph, location.getId(), RelationshipKinds.ADJACENT_TO, Direction.BOTH);
            if (neighbors.isEmpty()) {
                updated.put(location, current);
                continue;
            }
            double laplacian = 0;
            for (Entity neighbor : neighbors) {
                laplacian += temperatureOf(neighbor) - current;
            }
            laplacian /= neighbors.size();
            updated.put(location, Math.max(0, Math.min(1, current + alpha * laplacian)));
        }

        SystemResult.Builder result = SystemResult.builder();
        List<Entity> excursions = new ArrayList<>();
        Map<String, Double> oldTemperatures = new LinkedHashMap<>();
        for (Map.Entry<Entity, Double> entry : updated.entrySet()) {
            Entity location = entry.getKey();
            double oldTemp = temperatureOf(location);
            double newTemp = entry.getValue();
            if (Math.abs(newTemp - NEUTRAL_TEMPERATURE) > 0.05 && newTemp != oldTemp) {
                result.modify(location.getId(), EntityChanges.create().putTag(TEMPERATURE_TAG, formatTemperature(newTemp)));
            }
            if (Math.abs(newTemp - oldTemp) >= excursionThreshold || newTemp > 0.8 || newTemp < 0.2) {
                excursions.add(location);
                oldTemperatures.put(location.getId(), oldTemp);
            }
        }

        for (Entity location : excursions) {
            double newTemp = updated.get(location);
            boolean warming = newTemp > oldTemperatures.get(location.getId()) || newTemp > 0.8;
            if ("colony".equals(location.getSubtype())) {
                if ((newTemp > 0.8 || newTemp < 0.2) && "thriving".equals(location.getStatus())) {
                    result.modify(location.getId(), EntityChanges.create()
                            .status("waning")
                            .description(location.getDescription() + (warming
                                    ? " Warming ice threatens the colony's foundations."
                                    : " Extreme cold makes survival difficult.")));
                } else if (newTemp >= 0.3 && newTemp <= 0.7 && "waning".equals(location.getStatus())
                        && Probabilities.rollProbability(random, Math.min(0.95, recoveryChance * modifier), modifier)) {
                    result.modify(location.getId(), EntityChanges.create()
                            .status("thriving")
                            .description(location.getDescription() + " Stabilizing temperatures allow the colony to recover."));
                }
            }

            if (newTemp > 0.85 || newTemp < 0.15) {
                migrate(graph, result, location, updated, modifier, random);
            }

            if (warming && newTemp > 0.6 && random.nextInt(2) == 1
                    && Probabilities.rollProbability(random, Math.min(0.95, rediscoveryChance * modifier), modifier)) {
                Entity ability = Probabilities.pickRandom(random,
                        graph.findEntities(e -> "abilities".equals(e.getKind()) && "active".equals(e.getStatus())));
                if (ability != null && !graph.hasRelationship(ability.getId(), location.getId(), RelationshipKinds.MANIFESTS_AT)
                        && !result.isProposed(RelationshipKinds.MANIFESTS_AT, ability.getId(), location.getId())) {
                    result.relate(RelationshipKinds.MANIFESTS_AT, ability.getId(), location.getId());
                }
            }
        }

        if (excursions.size() > 2) {
            result.pressure("conflict", 5);
            result.pressure("stability", -10);
        }
        return result.build(excursions.isEmpty()
                ? "Temperatures stabilizing"
                : "Thermal cascade: " + excursions.size() + " locations experience significant temperature shifts");
    }

    private void migrate(Graph graph, SystemResult.Builder result, Entity location, Map<Entity, Double> temperatures,
                         double modifier, IRandomProvider random) {
        List<Entity> refuges = new ArrayList<>();
        for (Map.Entry<Entity, Double> entry : temperatures.entrySet()) {
            if (entry.getValue() >= 0.3 && entry.getValue() <= 0.7 && entry.getKey() != location) {
                refuges.add(entry.getKey());
            }
        }
        if (refuges.isEmpty()) return;
        List<Entity> residents = new ArrayList<>();
        for (Entity resident : GraphQueries.getResidents(graph, location.getId())) {
            if ("alive".equals(resident.getStatus())) residents.add(resident);
        }
        for (Entity migrant : Probabilities.pickMultiple(random, residents, 2)) {
            if (!result.canForm(graph, migrant.getId(), RelationshipKinds.RESIDENT_OF, migrationCooldown)) continue;
            Entity refuge = Probabilities.pickRandom(random, refuges);
            if (!Probabilities.rollProbability(random, Math.min(0.95, migrationChance * modifier), modifier)) continue;
            result.replace(RelationshipKinds.RESIDENT_OF, migrant.getId(), location.getId(),
                    ProposedRelationship.between(RelationshipKinds.RESIDENT_OF, migrant.getId(), refuge.getId()));
        }
    }
}

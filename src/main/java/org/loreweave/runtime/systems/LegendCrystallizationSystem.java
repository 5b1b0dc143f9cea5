package org.loreweave.runtime.systems;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntityChanges;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.mutation.EntityRef;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;
import org.loreweave.runtime.spi.ISimulationSystem;

import java.util.List;
import java.util.Map;

/**
 * Turns long-dead renowned or mythic NPCs into legends.
 * <p>
 * An NPC qualifies once {@code tick - updatedAt} reaches the threshold. It becomes fictional and
 * mythic, its location gains a commemorative suffix, and a pending memorial rule is proposed together
 * with its {@code commemorates} and {@code originated_in} relationships.
 * </p>
 */
public class LegendCrystallizationSystem implements ISimulationSystem {

    static final String LEGEND_STATUS = "fictional";

    private record Archetype(String ruleSubtype, String verb, String theme) {}

    private static final Map<String, Archetype> ARCHETYPES = Map.of(
            "hero", new Archetype("taboo", "Never forget", "courage"),
            "mayor", new Archetype("social", "Honor the memory of", "leadership"),
            "merchant", new Archetype("social", "Trade fairly in memory of", "prosperity"),
            "outlaw", new Archetype("taboo", "Never speak ill of", "freedom"));

    private static final Archetype DEFAULT_ARCHETYPE = new Archetype("social", "Remember", "honor");

    private final double throttleChance;
    private final long threshold;

    public LegendCrystallizationSystem(double throttleChance, long threshold) {
        this.throttleChance = throttleChance;
        this.threshold = threshold;
    }

    public LegendCrystallizationSystem(Config options) {
        this(options.hasPath("throttle-chance") ? options.getDouble("throttle-chance") : 0.2,
                options.hasPath("threshold") ? options.getLong("threshold") : 50L);
    }

    @Override
    public String getId() {
        return "legend_crystallization";
    }

    @Override
    public String getName() {
        return "Legend Formation";
    }

    @Override
    public SystemResult apply(Graph graph, double modifier, IRandomProvider random) {
        if (!Probabilities.rollProbability(random, throttleChance, modifier)) {
            return SystemResult.dormant("Legend crystallization dormant");
        }

        SystemResult.Builder result = SystemResult.builder();
        int legends = 0;
        List<Entity> dead = graph.findEntities(e -> "npc".equals(e.getKind()) && "dead".equals(e.getStatus()));
        for (Entity npc : dead) {
            if (graph.getTick() - npc.getUpdatedAt() < threshold) continue;
            if (!npc.getProminence().isAtLeast(Prominence.RENOWNED)) continue;

            result.modify(npc.getId(), EntityChanges.create()
                    .status(LEGEND_STATUS)
                    .prominence(Prominence.MYTHIC)
                    .description(npc.getDescription() + " Their deeds have passed into legend, becoming larger than life."));
            legends++;

            Entity location = GraphQueries.getLocation(graph, npc.getId());
            if (location != null && !location.getName().contains("(") && !location.getName().contains(npc.getName())) {
                String suffix = Probabilities.pickRandom(random, List.of(
                        "(" + npc.getName() + "'s Fall)",
                        "(" + npc.getName() + "'s Rest)",
                        "(Echo of " + npc.getName() + ")",
                        "(Where " + npc.getName() + " Fell)",
                        "(" + npc.getName() + "'s Memorial)"));
                result.modify(location.getId(), EntityChanges.create()
                        .name(location.getName() + " " + suffix)
                        .description(location.getDescription() + " This place is forever marked by the legend of "
                                + npc.getName() + "."));
                result.relate(RelationshipKinds.COMMEMORATES, location.getId(), npc.getId());
            }

            Archetype archetype = ARCHETYPES.getOrDefault(npc.getSubtype(), DEFAULT_ARCHETYPE);
            EntitySpec memorial = EntitySpec.of("rules")
                    .subtype(archetype.ruleSubtype())
                    .name(archetype.verb() + " " + npc.getName())
                    .description("A memorial tradition honoring " + npc.getName() + ", who embodied "
                            + archetype.theme() + " in life and legend.")
                    .status("enacted")
                    .prominence(Prominence.RENOWNED)
                    .tag("memorial")
                    .tag(archetype.theme());
            if (npc.getSubtype() != null) {
                memorial.tag(npc.getSubtype());
            }
            EntityRef rule = result.addEntity(memorial);
            result.relate(RelationshipKinds.COMMEMORATES, rule, EntityRef.existing(npc.getId()));
            if (location != null) {
                result.relate(RelationshipKinds.ORIGINATED_IN, rule, EntityRef.existing(location.getId()));
            }
        }

        return result.build(legends > 0
                ? legends + " heroes crystallize into legend"
                : "No heroes ready for mythic transformation");
    }
}

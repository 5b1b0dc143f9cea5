package org.loreweave.runtime.templates;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Point3;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.mutation.EntityRef;
import org.loreweave.runtime.mutation.TemplateResult;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IGrowthTemplate;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.List;

/**
 * A hero rises in a thriving colony when there is conflict to answer.
 * <p>
 * The gate is bidirectional: conflict must lie in [min, max], and above the suppression start the
 * chance of applying falls linearly so that runaway conflict does not flood the world with heroes.
 * Heroes stop appearing once their count reaches the saturation threshold.
 * </p>
 */
public class HeroEmergenceTemplate implements IGrowthTemplate {

    static final String CONFLICT = "conflict";

    private final IDomainSchema domain;
    private final double minConflict;
    private final double maxConflict;
    private final double suppressionStart;
    private final int saturationTarget;
    private final double conflictRelief;

    public HeroEmergenceTemplate(Config options, IDomainSchema domain) {
        this.domain = domain;
        this.minConflict = options.hasPath("min-conflict") ? options.getDouble("min-conflict") : 5.0;
        this.maxConflict = options.hasPath("max-conflict") ? options.getDouble("max-conflict") : 80.0;
        this.suppressionStart = options.hasPath("suppression-start") ? options.getDouble("suppression-start") : 60.0;
        this.saturationTarget = options.hasPath("saturation-target") ? options.getInt("saturation-target")
                : TemplateHelpers.DEFAULT_SATURATION_TARGET;
        this.conflictRelief = options.hasPath("conflict-relief") ? options.getDouble("conflict-relief") : 2.0;
        if (minConflict > maxConflict) {
            throw new IllegalArgumentException("hero_emergence min-conflict " + minConflict
                    + " exceeds max-conflict " + maxConflict);
        }
    }

    @Override
    public String getId() {
        return "hero_emergence";
    }

    @Override
    public String getName() {
        return "Hero Emergence";
    }

    @Override
    public String getProducedKind() {
        return "npc";
    }

    @Override
    public boolean canApply(Graph graph, IRandomProvider random) {
        double conflict = graph.getPressure(CONFLICT);
        if (conflict < minConflict || conflict > maxConflict) return false;
        if (TemplateHelpers.isSaturated(graph, "npc", "hero", saturationTarget, TemplateHelpers.DEFAULT_OVERSHOOT)) {
            return false;
        }
        if (conflict > suppressionStart) {
            double suppression = (conflict - suppressionStart) / (maxConflict - suppressionStart + 1e-9);
            if (random.nextDouble() < Math.min(0.9, suppression)) return false;
        }
        return !thrivingColonies(graph).isEmpty();
    }

    @Override
    public List<Entity> findTargets(Graph graph, IRandomProvider random) {
        return thrivingColonies(graph);
    }

    @Override
    public TemplateResult expand(Graph graph, Entity colony, IRandomProvider random) {
        if (colony == null || !graph.hasEntity(colony.getId())) {
            return TemplateResult.empty("No colony to raise a hero in");
        }
        Point3 coordinates = TemplateHelpers.placeNearIfPossible(domain, graph, List.of(colony.getId()), random);
        String name = domain.getNameGenerator().generate("hero", random);
        String trait = Probabilities.pickRandom(random, List.of("brave", "wise", "cunning", "resolute"));

        TemplateResult.Builder result = TemplateResult.builder();
        EntityRef hero = result.addEntity(EntitySpec.of("npc")
                .subtype("hero")
                .name(name)
                .description("A " + trait + " hero who rose from " + colony.getName() + " in troubled times")
                .status("alive")
                .prominence(Prominence.MARGINAL)
                .culture(colony.getCulture())
                .tag(trait)
                .coordinates(coordinates));
        result.relate(RelationshipKinds.RESIDENT_OF, hero, EntityRef.existing(colony.getId()));
        result.pressure(CONFLICT, -conflictRelief);
        return result.build(name + " emerges as a hero in " + colony.getName());
    }

    private static List<Entity> thrivingColonies(Graph graph) {
        return graph.findEntities(e -> e.is("location", "colony") && "thriving".equals(e.getStatus()));
    }
}

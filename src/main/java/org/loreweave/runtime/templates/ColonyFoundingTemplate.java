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
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IGrowthTemplate;
import org.loreweave.runtime.spi.IPlacementService;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * A resident of a thriving colony leads settlers out to found a new colony next door.
 * Each founding adds to resource scarcity.
 */
public class ColonyFoundingTemplate implements IGrowthTemplate {

    private final IDomainSchema domain;
    private final int saturationTarget;
    private final double maxScarcity;
    private final double scarcityDelta;

    public ColonyFoundingTemplate(Config options, IDomainSchema domain) {
        this.domain = domain;
        this.saturationTarget = options.hasPath("saturation-target") ? options.getInt("saturation-target") : 6;
        this.maxScarcity = options.hasPath("max-scarcity") ? options.getDouble("max-scarcity") : 70.0;
        this.scarcityDelta = options.hasPath("scarcity-delta") ? options.getDouble("scarcity-delta") : 2.0;
    }

    @Override
    public String getId() {
        return "colony_founding";
    }

    @Override
    public String getName() {
        return "Colony Founding";
    }

    @Override
    public String getProducedKind() {
        return "location";
    }

    @Override
    public boolean canApply(Graph graph, IRandomProvider random) {
        if (graph.getPressure("resource_scarcity") > maxScarcity) return false;
        if (TemplateHelpers.isSaturated(graph, "location", "colony", saturationTarget, TemplateHelpers.DEFAULT_OVERSHOOT)) {
            return false;
        }
        return !findTargets(graph, random).isEmpty();
    }

    /**
     * Thriving colonies with at least one living resident.
     */
    @Override
    public List<Entity> findTargets(Graph graph, IRandomProvider random) {
        List<Entity> targets = new ArrayList<>();
        for (Entity colony : graph.findEntities(e -> e.is("location", "colony") && "thriving".equals(e.getStatus()))) {
            if (!livingResidents(graph, colony).isEmpty()) targets.add(colony);
        }
        return targets;
    }

    @Override
    public TemplateResult expand(Graph graph, Entity parent, IRandomProvider random) {
        IPlacementService placement = TemplateHelpers.requirePlacement(domain, getId());
        if (parent == null || !graph.hasEntity(parent.getId())) {
            return TemplateResult.empty("No colony to found from");
        }
        Entity founder = Probabilities.pickRandom(random, livingResidents(graph, parent));
        if (founder == null) {
            return TemplateResult.empty("No one in " + parent.getName() + " willing to found a colony");
        }
        Point3 coordinates = placement.placeNear(graph, List.of(parent.getId()), random);
        if (coordinates == null) {
            return TemplateResult.empty("No free position near " + parent.getName());
        }

        String name = domain.getNameGenerator().generate("colony", random);
        TemplateResult.Builder result = TemplateResult.builder();
        EntityRef colony = result.addEntity(EntitySpec.of("location")
                .subtype("colony")
                .name(name)
                .description("A young colony founded by settlers from " + parent.getName())
                .status("thriving")
                .prominence(Prominence.MARGINAL)
                .culture(parent.getCulture())
                .coordinates(coordinates));
        result.relate(RelationshipKinds.FOUNDED_BY, colony, EntityRef.existing(founder.getId()));
        result.relateBidirectional(RelationshipKinds.ADJACENT_TO, colony, EntityRef.existing(parent.getId()));
        result.pressure("resource_scarcity", scarcityDelta);
        return result.build(founder.getName() + " founds " + name + " beside " + parent.getName());
    }

    private static List<Entity> livingResidents(Graph graph, Entity colony) {
        List<Entity> residents = new ArrayList<>();
        for (Entity resident : GraphQueries.getResidents(graph, colony.getId())) {
            if ("alive".equals(resident.getStatus())) residents.add(resident);
        }
        return residents;
    }
}

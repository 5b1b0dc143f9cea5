package org.loreweave.runtime.templates;

import com.typesafe.config.Config;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.EntitySpec;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.mutation.EntityRef;
import org.loreweave.runtime.mutation.TemplateResult;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IGrowthTemplate;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * A mystical cult gathers around a magical anomaly.
 * <p>
 * Creates the cult faction and its prophet (leader, member and resident of the anomaly), recruits
 * up to {@code cultists} living NPCs that do not yet belong to a faction, and links the cult to
 * the anomaly. The prophet practises a magic ability when one exists.
 * </p>
 */
public class CultFormationTemplate implements IGrowthTemplate {

    static final String MAGICAL_INSTABILITY = "magical_instability";

    private final IDomainSchema domain;
    private final double minInstability;
    private final int saturationTarget;
    private final int cultists;

    public CultFormationTemplate(Config options, IDomainSchema domain) {
        this.domain = domain;
        this.minInstability = options.hasPath("min-instability") ? options.getDouble("min-instability") : 30.0;
        this.saturationTarget = options.hasPath("saturation-target") ? options.getInt("saturation-target") : 10;
        this.cultists = options.hasPath("cultists") ? options.getInt("cultists") : 1;
    }

    @Override
    public String getId() {
        return "cult_formation";
    }

    @Override
    public String getName() {
        return "Cult Awakening";
    }

    @Override
    public String getProducedKind() {
        return "faction";
    }

    @Override
    public boolean canApply(Graph graph, IRandomProvider random) {
        if (graph.getPressure(MAGICAL_INSTABILITY) < minInstability) return false;
        if (graph.getEntityCount("location", "anomaly") == 0) return false;
        return !TemplateHelpers.isSaturated(graph, "faction", "cult", saturationTarget, TemplateHelpers.DEFAULT_OVERSHOOT);
    }

    @Override
    public List<Entity> findTargets(Graph graph, IRandomProvider random) {
        return graph.findEntities(e -> e.is("location", "anomaly"));
    }

    @Override
    public TemplateResult expand(Graph graph, Entity anomaly, IRandomProvider random) {
        if (anomaly == null || !graph.hasEntity(anomaly.getId())) {
            return TemplateResult.empty("Cannot form cult - no anomaly exists");
        }
        String prophetName = domain.getNameGenerator().generate("hero", random);

        TemplateResult.Builder result = TemplateResult.builder();
        EntityRef location = EntityRef.existing(anomaly.getId());
        EntityRef cult = result.addEntity(EntitySpec.of("faction")
                .subtype("cult")
                .name("Cult of " + anomaly.getName())
                .description("A mystical cult drawn to the power near " + anomaly.getName())
                .status("illegal")
                .prominence(Prominence.MARGINAL)
                .culture(anomaly.getCulture())
                .tag("mystical")
                .tag("secretive")
                .coordinates(TemplateHelpers.placeNearIfPossible(domain, graph, List.of(anomaly.getId()), random)));
        EntityRef prophet = result.addEntity(EntitySpec.of("npc")
                .subtype("hero")
                .name(prophetName)
                .description("The enigmatic prophet of a mystical cult near " + anomaly.getName())
                .status("alive")
                .prominence(Prominence.MARGINAL)
                .culture(anomaly.getCulture())
                .tag("prophet")
                .tag("mystical")
                .coordinates(TemplateHelpers.placeNearIfPossible(domain, graph, List.of(anomaly.getId()), random)));

        result.relate(RelationshipKinds.OCCUPIES, cult, location);
        result.relate(RelationshipKinds.LEADER_OF, prophet, cult);
        result.relate(RelationshipKinds.MEMBER_OF, prophet, cult);
        result.relate(RelationshipKinds.RESIDENT_OF, prophet, location);

        List<Entity> recruits = new ArrayList<>();
        for (Entity npc : graph.findEntities(e -> "npc".equals(e.getKind()) && "alive".equals(e.getStatus()))) {
            if (GraphQueries.getRelated(graph, npc.getId(), RelationshipKinds.MEMBER_OF, Direction.SRC).isEmpty()) {
                recruits.add(npc);
            }
        }
        for (Entity recruit : Probabilities.pickMultiple(random, recruits, cultists)) {
            result.relate(RelationshipKinds.MEMBER_OF, EntityRef.existing(recruit.getId()), cult);
            result.relate(RelationshipKinds.FOLLOWER_OF, EntityRef.existing(recruit.getId()), prophet);
        }

        Entity magic = Probabilities.pickRandom(random, graph.findEntities(e -> e.is("abilities", "magic")));
        if (magic != null) {
            result.relate(RelationshipKinds.SEEKS, cult, EntityRef.existing(magic.getId()));
            result.relate(RelationshipKinds.PRACTITIONER_OF, prophet, EntityRef.existing(magic.getId()));
        }
        return result.build(prophetName + " founds a cult at " + anomaly.getName());
    }
}

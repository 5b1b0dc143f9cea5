package org.loreweave.runtime.templates;

import org.loreweave.runtime.discovery.EmergentDiscovery;
import org.loreweave.runtime.discovery.LocationTheme;
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

import java.util.List;

/**
 * Base class for templates that discover a new, procedurally themed location.
 * <p>
 * Subclasses decide whether the world currently needs a place of their kind and describe it; this
 * class applies the shared discovery gate, places the location next to its explorer, links it with
 * {@code explorer_of}/{@code discovered_by} and a bidirectional {@code adjacent_to} to a nearby place,
 * and marks the result as a discovery so the engine updates the discovery state on commit.
 * </p>
 */
public abstract class AbstractLocationDiscoveryTemplate implements IGrowthTemplate {

    private static final int MAX_THEME_TAGS = 5;

    /**
     * What a subclass wants discovered.
     *
     * @param theme procedural theme of the place
     * @param prominence starting prominence
     * @param description entity description
     * @param reason suffix of the history line, e.g. "for territorial advantage"
     */
    protected record Finding(LocationTheme theme, Prominence prominence, String description, String reason) {}

    protected final IDomainSchema domain;
    protected final EmergentDiscovery discovery;

    protected AbstractLocationDiscoveryTemplate(IDomainSchema domain) {
        this.domain = domain;
        this.discovery = new EmergentDiscovery(domain.getDiscoveryConfig().orElse(null), domain.getThemeVocabulary());
    }

    /**
     * @return true if the world currently calls for a place of this kind
     */
    protected abstract boolean hasNeed(Graph graph, IRandomProvider random);

    /**
     * @return what to discover, or null if the need vanished
     */
    protected abstract Finding describe(Graph graph, Entity explorer, IRandomProvider random);

    @Override
    public String getProducedKind() {
        return "location";
    }

    @Override
    public boolean canApply(Graph graph, IRandomProvider random) {
        return hasNeed(graph, random) && discovery.shouldDiscoverLocation(graph, random);
    }

    @Override
    public TemplateResult expand(Graph graph, Entity explorer, IRandomProvider random) {
        IPlacementService placement = TemplateHelpers.requirePlacement(domain, getId());
        if (explorer == null || !graph.hasEntity(explorer.getId())) {
            return TemplateResult.empty("No eligible explorer found");
        }
        Finding finding = describe(graph, explorer, random);
        if (finding == null) {
            return TemplateResult.empty(getName() + ": nothing left to discover");
        }
        Point3 coordinates = placement.placeNear(graph, List.of(explorer.getId()), random);
        if (coordinates == null) {
            return TemplateResult.empty("No free position near " + explorer.getName());
        }

        LocationTheme theme = finding.theme();
        TemplateResult.Builder result = TemplateResult.builder();
        EntityRef location = result.addEntity(EntitySpec.of("location")
                .subtype(theme.subtype())
                .name(TemplateHelpers.formatTheme(theme.themeString()))
                .description(finding.description())
                .status("unspoiled")
                .prominence(finding.prominence())
                .culture(explorer.getCulture())
                .tags(TemplateHelpers.themeTags(theme, MAX_THEME_TAGS))
                .coordinates(coordinates));
        EntityRef discoverer = EntityRef.existing(explorer.getId());
        result.relate(RelationshipKinds.EXPLORER_OF, discoverer, location);
        result.relate(RelationshipKinds.DISCOVERED_BY, location, discoverer);

        Entity neighbour = Probabilities.pickRandom(random, EmergentDiscovery.findNearbyLocations(graph, explorer));
        if (neighbour == null) {
            neighbour = GraphQueries.getLocation(graph, explorer.getId());
        }
        if (neighbour != null) {
            result.relateBidirectional(RelationshipKinds.ADJACENT_TO, location, EntityRef.existing(neighbour.getId()));
        }
        result.discovery();
        return result.build(explorer.getName() + " discovered " + theme.themeString().replace('_', ' ')
                + " " + finding.reason());
    }
}

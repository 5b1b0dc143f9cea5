package org.loreweave.runtime.templates;

import com.typesafe.config.Config;
import org.loreweave.runtime.discovery.LocationTheme;
import org.loreweave.runtime.discovery.MagicAnalysis;
import org.loreweave.runtime.model.Direction;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.List;
import java.util.Locale;

/**
 * Discovers a place of magical manifestation while instability is high. Practitioners of magic are
 * preferred as seekers, heroes otherwise.
 */
public class MysticalLocationDiscoveryTemplate extends AbstractLocationDiscoveryTemplate {

    public MysticalLocationDiscoveryTemplate(Config options, IDomainSchema domain) {
        super(domain);
    }

    @Override
    public String getId() {
        return "mystical_location_discovery";
    }

    @Override
    public String getName() {
        return "Mystical Location Discovery";
    }

    @Override
    protected boolean hasNeed(Graph graph, IRandomProvider random) {
        return discovery.analyzeMagicPresence(graph) != null;
    }

    @Override
    public List<Entity> findTargets(Graph graph, IRandomProvider random) {
        List<Entity> practitioners = graph.findEntities(e -> "npc".equals(e.getKind()) && "alive".equals(e.getStatus())
                && !GraphQueries.getRelated(graph, e.getId(), RelationshipKinds.PRACTITIONER_OF, Direction.SRC).isEmpty());
        if (!practitioners.isEmpty()) return practitioners;
        return TemplateHelpers.selectByPreference(graph, "npc", List.of("hero"), "alive");
    }

    @Override
    protected Finding describe(Graph graph, Entity explorer, IRandomProvider random) {
        MagicAnalysis magic = discovery.analyzeMagicPresence(graph);
        if (magic == null) return null;
        LocationTheme theme = discovery.getThemes().mysticalTheme(magic, random);
        String manifestation = magic.manifestation().name().toLowerCase(Locale.ROOT);
        return new Finding(theme, Prominence.RECOGNIZED,
                "A mystical " + TemplateHelpers.formatTheme(theme.themeString()).toLowerCase(Locale.ROOT)
                        + " manifesting " + manifestation + " energies",
                "manifestation");
    }
}

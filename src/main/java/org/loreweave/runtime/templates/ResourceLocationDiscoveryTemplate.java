package org.loreweave.runtime.templates;

import com.typesafe.config.Config;
import org.loreweave.runtime.discovery.LocationTheme;
import org.loreweave.runtime.discovery.ResourceAnalysis;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.List;
import java.util.Locale;

/**
 * Discovers a resource-rich place when settlements struggle or resources run short.
 */
public class ResourceLocationDiscoveryTemplate extends AbstractLocationDiscoveryTemplate {

    private final List<String> explorerSubtypes;

    public ResourceLocationDiscoveryTemplate(Config options, IDomainSchema domain) {
        super(domain);
        this.explorerSubtypes = options.hasPath("explorer-subtypes") ? options.getStringList("explorer-subtypes")
                : List.of("hero", "outlaw", "merchant");
    }

    @Override
    public String getId() {
        return "resource_location_discovery";
    }

    @Override
    public String getName() {
        return "Resource Location Discovery";
    }

    @Override
    protected boolean hasNeed(Graph graph, IRandomProvider random) {
        return discovery.analyzeResourceDeficit(graph, random) != null;
    }

    @Override
    public List<Entity> findTargets(Graph graph, IRandomProvider random) {
        return TemplateHelpers.selectByPreference(graph, "npc", explorerSubtypes, "alive");
    }

    @Override
    protected Finding describe(Graph graph, Entity explorer, IRandomProvider random) {
        ResourceAnalysis deficit = discovery.analyzeResourceDeficit(graph, random);
        if (deficit == null) return null;
        LocationTheme theme = discovery.getThemes().resourceTheme(deficit, graph.getCurrentEra().id(), random);
        return new Finding(theme, Prominence.MARGINAL,
                "A resource-rich " + TemplateHelpers.formatTheme(theme.themeString()).toLowerCase(Locale.ROOT)
                        + " discovered to address " + deficit.specific().replace('_', ' ') + " scarcity",
                "to address " + deficit.primary() + " scarcity");
    }
}

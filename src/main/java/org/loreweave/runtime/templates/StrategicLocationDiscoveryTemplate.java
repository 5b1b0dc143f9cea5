package org.loreweave.runtime.templates;

import com.typesafe.config.Config;
import org.loreweave.runtime.discovery.ConflictAnalysis;
import org.loreweave.runtime.discovery.LocationTheme;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Prominence;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.List;
import java.util.Locale;

/**
 * Discovers a position of tactical value while factions are in conflict.
 */
public class StrategicLocationDiscoveryTemplate extends AbstractLocationDiscoveryTemplate {

    private final List<String> scoutSubtypes;

    public StrategicLocationDiscoveryTemplate(Config options, IDomainSchema domain) {
        super(domain);
        this.scoutSubtypes = options.hasPath("scout-subtypes") ? options.getStringList("scout-subtypes")
                : List.of("hero", "outlaw", "mayor");
    }

    @Override
    public String getId() {
        return "strategic_location_discovery";
    }

    @Override
    public String getName() {
        return "Strategic Location Discovery";
    }

    @Override
    protected boolean hasNeed(Graph graph, IRandomProvider random) {
        return discovery.analyzeConflictPatterns(graph) != null;
    }

    @Override
    public List<Entity> findTargets(Graph graph, IRandomProvider random) {
        return TemplateHelpers.selectByPreference(graph, "npc", scoutSubtypes, "alive");
    }

    @Override
    protected Finding describe(Graph graph, Entity explorer, IRandomProvider random) {
        ConflictAnalysis conflict = discovery.analyzeConflictPatterns(graph);
        if (conflict == null) return null;
        LocationTheme theme = discovery.getThemes().strategicTheme(conflict, random);
        String type = conflict.type().name().toLowerCase(Locale.ROOT);
        return new Finding(theme, Prominence.RECOGNIZED,
                "A strategic " + TemplateHelpers.formatTheme(theme.themeString()).toLowerCase(Locale.ROOT)
                        + " providing tactical advantage in the " + type + " conflict",
                "for " + type + " advantage");
    }
}

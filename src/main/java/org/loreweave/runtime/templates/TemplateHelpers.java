package org.loreweave.runtime.templates;

import org.loreweave.runtime.discovery.LocationTheme;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Point3;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IPlacementService;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared checks and selections used by growth templates.
 */
public final class TemplateHelpers {

    public static final int DEFAULT_SATURATION_TARGET = 20;
    public static final double DEFAULT_OVERSHOOT = 1.5;

    private TemplateHelpers() {}

    /**
     * @return true once the count of {@code kind}/{@code subtype} reaches {@code target * overshoot}
     */
    public static boolean isSaturated(Graph graph, String kind, String subtype, int target, double overshoot) {
        return graph.getEntityCount(kind, subtype) >= target * overshoot;
    }

    public static boolean isSaturated(Graph graph, String kind, String subtype) {
        return isSaturated(graph, kind, subtype, DEFAULT_SATURATION_TARGET, DEFAULT_OVERSHOOT);
    }

    /**
     * @throws MissingCapabilityException if the domain has no placement service
     */
    public static IPlacementService requirePlacement(IDomainSchema domain, String templateId) {
        return domain.getPlacementService()
                .orElseThrow(() -> new MissingCapabilityException(templateId, "placement"));
    }

    /**
     * Coordinates near the references, or null when the domain has no spatial model or no position was found.
     */
    public static Point3 placeNearIfPossible(IDomainSchema domain, Graph graph, List<String> referenceIds,
                                             IRandomProvider random) {
        return domain.getPlacementService()
                .map(placement -> placement.placeNear(graph, referenceIds, random))
                .orElse(null);
    }

    /**
     * Entities of a kind and status in the first subtype bucket that is not empty, in preference order.
     */
    public static List<Entity> selectByPreference(Graph graph, String kind, List<String> subtypes, String status) {
        List<Entity> candidates = graph.findEntities(e -> kind.equals(e.getKind())
                && (status == null || status.equals(e.getStatus())));
        return GraphQueries.bySubtypePreference(candidates, subtypes);
    }

    /**
     * {@code deep_krill_channel} becomes {@code Deep Krill Channel}.
     */
    public static String formatTheme(String themeString) {
        StringBuilder sb = new StringBuilder();
        for (String word : themeString.split("_")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    /**
     * Theme tags as boolean flags, at most {@code max} of them.
     */
    public static Map<String, Object> themeTags(LocationTheme theme, int max) {
        Map<String, Object> tags = new LinkedHashMap<>();
        for (String tag : theme.tags()) {
            if (tags.size() >= max) break;
            tags.put(tag.toLowerCase(Locale.ROOT), Boolean.TRUE);
        }
        return tags;
    }
}

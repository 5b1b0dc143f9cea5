package org.loreweave.runtime.discovery;

import org.loreweave.runtime.domain.ThemeVocabulary;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.model.DiscoveryState;
import org.loreweave.runtime.model.Entity;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.model.Relationship;
import org.loreweave.runtime.model.RelationshipKinds;
import org.loreweave.runtime.query.GraphQueries;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads graph and pressure state to decide whether, and what kind of, new location the world needs.
 * <p>
 * The analyses return null when their condition does not hold. Without a {@link DiscoveryConfig}
 * the config-dependent operations degrade to "no discovery": {@link #analyzeResourceDeficit} and
 * {@link #explorationTheme} return null and {@link #shouldDiscoverLocation} returns false.
 * </p>
 */
public class EmergentDiscovery {

    public static final String RESOURCE_SCARCITY = "resource_scarcity";
    public static final String CONFLICT = "conflict";
    public static final String CULTURAL_TENSION = "cultural_tension";
    public static final String MAGICAL_INSTABILITY = "magical_instability";

    private final DiscoveryConfig config;
    private final ThemeGenerator themes;

    /**
     * @param config discovery settings, null when the domain does not discover locations
     */
    public EmergentDiscovery(DiscoveryConfig config, ThemeVocabulary vocabulary) {
        this.config = config;
        this.themes = new ThemeGenerator(vocabulary, config != null ? config.anomalySubtype() : "anomaly");
    }

    public boolean isConfigured() {
        return config != null;
    }

    public ThemeGenerator getThemes() {
        return themes;
    }

    /**
     * Resource need derived from settlement health and population.
     */
    public ResourceAnalysis analyzeResourceDeficit(Graph graph, IRandomProvider random) {
        if (config == null) return null;
        List<Entity> colonies = graph.findEntities(e -> "location".equals(e.getKind())
                && config.settlementSubtypes().contains(e.getSubtype()));
        if (colonies.isEmpty()) return null;

        List<String> waning = new ArrayList<>();
        int thriving = 0;
        for (Entity colony : colonies) {
            if (config.waningStatus().equals(colony.getStatus())) waning.add(colony.getId());
            if (config.thrivingStatus().equals(colony.getStatus())) thriving++;
        }
        double scarcity = graph.getPressure(RESOURCE_SCARCITY);
        if (waning.size() > thriving) {
            return new ResourceAnalysis("food", scarcity, "fishing", waning);
        }

        List<String> all = colonies.stream().map(Entity::getId).collect(Collectors.toList());
        int npcs = graph.getEntityCount("npc", null);
        double locationsPerNpc = (double) colonies.size() / Math.max(npcs, 1);
        if (locationsPerNpc < 0.1 && colonies.size() > 2) {
            return new ResourceAnalysis("water", 60, "fresh_water", all);
        }
        if (scarcity > 50) {
            return new ResourceAnalysis("food", scarcity, Probabilities.pickRandom(random, config.foodResources()), all);
        }
        return null;
    }

    /**
     * Conflict pattern; null below conflict 30 or without hostile relationships.
     */
    public ConflictAnalysis analyzeConflictPatterns(Graph graph) {
        double conflict = graph.getPressure(CONFLICT);
        if (conflict < 30) return null;

        List<Relationship> enemies = new ArrayList<>();
        int attacks = 0;
        for (Relationship r : graph.getRelationships()) {
            if (RelationshipKinds.ENEMY_OF.equals(r.getKind()) || RelationshipKinds.AT_WAR_WITH.equals(r.getKind())) {
                enemies.add(r);
            } else if ("attacking".equals(r.getKind())) {
                attacks++;
            }
        }
        if (enemies.isEmpty()) return null;

        ConflictAnalysis.Type type = ConflictAnalysis.Type.TERRITORIAL;
        if (graph.getPressure(RESOURCE_SCARCITY) > 50) {
            type = ConflictAnalysis.Type.RESOURCE;
        } else if (graph.getPressure(CULTURAL_TENSION) > 40) {
            type = ConflictAnalysis.Type.IDEOLOGICAL;
        } else if (attacks > 0) {
            type = ConflictAnalysis.Type.DEFENSIVE;
        }

        Set<String> factions = new LinkedHashSet<>();
        for (Relationship r : enemies) {
            Entity src = graph.getEntity(r.getSrc());
            Entity dst = graph.getEntity(r.getDst());
            if (src != null && "faction".equals(src.getKind())) factions.add(src.getId());
            if (dst != null && "faction".equals(dst.getKind())) factions.add(dst.getId());
        }
        return new ConflictAnalysis(type, conflict, new ArrayList<>(factions), attacks > 2);
    }

    /**
     * Magical presence; null below instability 25.
     */
    public MagicAnalysis analyzeMagicPresence(Graph graph) {
        double instability = graph.getPressure(MAGICAL_INSTABILITY);
        if (instability < 25) return null;
        String anomalySubtype = config != null ? config.anomalySubtype() : "anomaly";
        List<String> magic = graph.findEntities(e -> e.is("abilities", "magic")).stream()
                .map(Entity::getName).collect(Collectors.toList());
        int anomalies = graph.getEntityCount("location", anomalySubtype);

        MagicAnalysis.Manifestation manifestation = MagicAnalysis.Manifestation.PHENOMENON;
        if (anomalies > 2) {
            manifestation = MagicAnalysis.Manifestation.CONVERGENCE;
        } else if (magic.size() > 3) {
            manifestation = MagicAnalysis.Manifestation.ARTIFACT;
        } else if ("expansion".equals(graph.getCurrentEra().id())) {
            manifestation = MagicAnalysis.Manifestation.TEMPLE;
        }
        return new MagicAnalysis(instability, magic, anomalies, manifestation);
    }

    /**
     * Neutral exploration theme for the current era; null without configuration.
     */
    public LocationTheme explorationTheme(Graph graph, IRandomProvider random) {
        if (config == null) return null;
        return themes.explorationTheme(graph.getCurrentEra().id(), random);
    }

    /**
     * The shared discovery gate. Checks, in order: the location cap, the cooldown since the last
     * discovery, the per-epoch limit, the presence of an active explorer and finally the era roll.
     */
    public boolean shouldDiscoverLocation(Graph graph, IRandomProvider random) {
        if (config == null) return false;
        if (graph.getEntityCount("location", null) >= config.maxLocations()) return false;

        DiscoveryState state = graph.getDiscoveryState();
        if (graph.getTick() - state.getLastDiscoveryTick() < config.minTicksBetweenDiscoveries()) return false;
        if (state.getDiscoveriesThisEpoch() >= config.maxDiscoveriesPerEpoch()) return false;
        if (findExplorers(graph).isEmpty()) return false;

        return random.nextDouble() < config.eraChance(graph.getCurrentEra().id());
    }

    /**
     * NPCs able to discover places: an explorer subtype with the active status.
     */
    public List<Entity> findExplorers(Graph graph) {
        if (config == null) return List.of();
        return graph.findEntities(e -> "npc".equals(e.getKind())
                && config.explorerSubtypes().contains(e.getSubtype())
                && config.explorerActiveStatus().equals(e.getStatus()));
    }

    /**
     * Similarity of an existing location to a theme: overlapping tag/word count × 0.4, × 1.2 for
     * geographic features, × 1.3 when the location was created within 10 ticks of its last update.
     */
    public static double calculateThemeSimilarity(Entity location, String themeString) {
        List<String> words = List.of(themeString.split("_"));
        long overlap = location.getTags().keys().stream().filter(words::contains).count();
        double geographic = ThemeGenerator.GEOGRAPHIC_FEATURE.equals(location.getSubtype()) ? 1.2 : 1.0;
        double recency = location.getCreatedAt() > location.getUpdatedAt() - 10 ? 1.3 : 1.0;
        return overlap * 0.4 * geographic * recency;
    }

    /**
     * Locations next to an explorer's home: locations one {@code adjacent_to} hop away, in either
     * direction, from the location the explorer resides in or leads, plus what that location contains.
     */
    public static List<Entity> findNearbyLocations(Graph graph, Entity explorer) {
        Relationship residence = null;
        for (Relationship link : explorer.getLinks()) {
            if (RelationshipKinds.RESIDENT_OF.equals(link.getKind()) || RelationshipKinds.LEADER_OF.equals(link.getKind())) {
                residence = link;
                break;
            }
        }
        if (residence == null) return List.of();
        Entity home = graph.getEntity(residence.getDst());
        if (home == null) return List.of();

        List<Entity> nearby = new ArrayList<>();
        for (Entity e : GraphQueries.findNearbyLocations(graph, home.getId(), 1)) {
            if ("location".equals(e.getKind())) nearby.add(e);
        }
        for (Relationship link : home.getLinks()) {
            if (!"contains".equals(link.getKind())) continue;
            Entity e = graph.getEntity(link.getDst());
            if (e != null && "location".equals(e.getKind()) && !nearby.contains(e)) nearby.add(e);
        }
        return nearby;
    }
}

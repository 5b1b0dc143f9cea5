package org.loreweave.runtime.domain;

import com.typesafe.config.Config;
import org.loreweave.runtime.discovery.DiscoveryConfig;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.INameGenerator;
import org.loreweave.runtime.spi.IPlacementService;
import org.loreweave.runtime.spi.IStructureValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Domain schema read from a Typesafe Config block (by default {@code loreweave.domain}).
 * <p>
 * The relationship matrix lists allowed kinds per (srcKind, dstKind). With
 * {@code strict-relationships = false} a pair that is not listed allows every kind; with
 * {@code true} only listed pairs are allowed. Placement, structure validation and discovery are
 * optional and only present when their blocks are configured.
 * </p>
 */
public final class ConfigDomainSchema implements IDomainSchema {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigDomainSchema.class);

    private final String name;
    private final Map<String, EntityKindDefinition> kinds;
    private final Map<String, Set<String>> matrix;
    private final boolean strictRelationships;
    private final IStructureValidator structureValidator;
    private final INameGenerator nameGenerator;
    private final ThemeVocabulary themeVocabulary;
    private final IPlacementService placementService;
    private final DiscoveryConfig discoveryConfig;

    /**
     * Reads the schema from a domain configuration block.
     *
     * @throws IllegalArgumentException if an entity kind is defined twice or the name tables are empty
     */
    public ConfigDomainSchema(Config options) {
        this.name = options.hasPath("name") ? options.getString("name") : "default";
        this.strictRelationships = options.hasPath("strict-relationships") && options.getBoolean("strict-relationships");
        this.kinds = readKinds(options);
        this.matrix = readMatrix(options);

        boolean validate = !options.hasPath("structure-validation") || options.getBoolean("structure-validation");
        this.structureValidator = validate ? new RequiredRelationshipValidator(kinds) : null;
        this.nameGenerator = readNames(options);
        this.themeVocabulary = readThemes(options);
        this.placementService = readPlacement(options);
        this.discoveryConfig = options.hasPath("discovery") ? DiscoveryConfig.fromConfig(options.getConfig("discovery")) : null;

        LOG.debug("Loaded domain '{}' with {} entity kinds, {} relationship pairs, placement {}",
                name, kinds.size(), matrix.size(), placementService != null ? "enabled" : "disabled");
    }

    private static Map<String, EntityKindDefinition> readKinds(Config options) {
        Map<String, EntityKindDefinition> result = new LinkedHashMap<>();
        if (!options.hasPath("entity-kinds")) {
            return result;
        }
        for (Config kindConfig : options.getConfigList("entity-kinds")) {
            String kind = kindConfig.getString("kind");
            List<RequiredRelationship> required = new ArrayList<>();
            if (kindConfig.hasPath("required-relationships")) {
                for (Config rule : kindConfig.getConfigList("required-relationships")) {
                    required.add(new RequiredRelationship(
                            rule.getString("kind"),
                            rule.hasPath("when-status") ? rule.getString("when-status") : null,
                            rule.hasPath("except-subtypes") ? rule.getStringList("except-subtypes") : List.of()));
                }
            }
            EntityKindDefinition definition = new EntityKindDefinition(
                    kind,
                    kindConfig.hasPath("description") ? kindConfig.getString("description") : "",
                    kindConfig.hasPath("subtypes") ? kindConfig.getStringList("subtypes") : List.of(),
                    kindConfig.hasPath("statuses") ? kindConfig.getStringList("statuses") : List.of(),
                    kindConfig.hasPath("default-status") ? kindConfig.getString("default-status") : null,
                    required);
            if (result.put(kind, definition) != null) {
                throw new IllegalArgumentException("Entity kind defined twice: " + kind);
            }
        }
        return result;
    }

    private static Map<String, Set<String>> readMatrix(Config options) {
        Map<String, Set<String>> result = new HashMap<>();
        if (!options.hasPath("relationships")) {
            return result;
        }
        for (Config pair : options.getConfigList("relationships")) {
            result.computeIfAbsent(pairKey(pair.getString("src"), pair.getString("dst")), k -> new HashSet<>())
                    .addAll(pair.getStringList("kinds"));
        }
        return result;
    }

    private static INameGenerator readNames(Config options) {
        if (!options.hasPath("names")) {
            return (type, random) -> type + "-" + random.nextInt(100000);
        }
        Config names = options.getConfig("names");
        Map<String, List<String>> titles = new HashMap<>();
        if (names.hasPath("titles")) {
            Config titleConfig = names.getConfig("titles");
            for (String type : titleConfig.root().keySet()) {
                titles.put(type, titleConfig.getStringList(type));
            }
        }
        return new TableNameGenerator(names.getStringList("first"), names.getStringList("last"), titles);
    }

    private static ThemeVocabulary readThemes(Config options) {
        if (!options.hasPath("themes")) {
            return ThemeVocabulary.defaults();
        }
        Config themes = options.getConfig("themes");
        return new ThemeVocabulary(
                readWordMap(themes, "depth-words"),
                readWordMap(themes, "descriptors"),
                readWordMap(themes, "resource-words"),
                themes.hasPath("default-depth-words") ? themes.getStringList("default-depth-words") : List.of(),
                themes.hasPath("default-descriptors") ? themes.getStringList("default-descriptors") : List.of());
    }

    private static Map<String, List<String>> readWordMap(Config themes, String path) {
        Map<String, List<String>> result = new HashMap<>();
        if (themes.hasPath(path)) {
            Config words = themes.getConfig(path);
            for (String key : words.root().keySet()) {
                result.put(key, words.getStringList(key));
            }
        }
        return result;
    }

    private static IPlacementService readPlacement(Config options) {
        if (!options.hasPath("placement")) {
            return null;
        }
        Config placement = options.getConfig("placement");
        if (placement.hasPath("enabled") && !placement.getBoolean("enabled")) {
            return null;
        }
        return new ScatterPlacementService(
                placement.hasPath("extent") ? placement.getDouble("extent") : 100.0,
                placement.hasPath("radius") ? placement.getDouble("radius") : 15.0,
                placement.hasPath("min-spacing") ? placement.getDouble("min-spacing") : 1.0,
                placement.hasPath("max-attempts") ? placement.getInt("max-attempts") : 20);
    }

    private static String pairKey(String srcKind, String dstKind) {
        return srcKind + "->" + dstKind;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<EntityKindDefinition> getEntityKinds() {
        return Collections.unmodifiableList(new ArrayList<>(kinds.values()));
    }

    @Override
    public EntityKindDefinition getEntityKind(String kind) {
        return kinds.get(kind);
    }

    @Override
    public boolean isRelationshipAllowed(String srcKind, String dstKind, String relationshipKind) {
        Set<String> allowed = matrix.get(pairKey(srcKind, dstKind));
        if (allowed == null) {
            return !strictRelationships;
        }
        return allowed.contains(relationshipKind);
    }

    @Override
    public Optional<IStructureValidator> getStructureValidator() {
        return Optional.ofNullable(structureValidator);
    }

    @Override
    public INameGenerator getNameGenerator() {
        return nameGenerator;
    }

    @Override
    public ThemeVocabulary getThemeVocabulary() {
        return themeVocabulary;
    }

    @Override
    public Optional<IPlacementService> getPlacementService() {
        return Optional.ofNullable(placementService);
    }

    @Override
    public Optional<DiscoveryConfig> getDiscoveryConfig() {
        return Optional.ofNullable(discoveryConfig);
    }
}

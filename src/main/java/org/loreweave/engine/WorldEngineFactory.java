package org.loreweave.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.loreweave.runtime.domain.ConfigDomainSchema;
import org.loreweave.runtime.model.Era;
import org.loreweave.runtime.pressure.PressureDefinition;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IGrowthTemplate;
import org.loreweave.runtime.spi.ISimulationSystem;
import org.loreweave.runtime.systems.SystemFactory;
import org.loreweave.runtime.templates.TemplateFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link WorldEngine} from the {@code loreweave} configuration tree.
 */
public final class WorldEngineFactory {

    private static final Logger LOG = LoggerFactory.getLogger(WorldEngineFactory.class);

    public static final String ROOT_PATH = "loreweave";

    private WorldEngineFactory() {
        // Private constructor to prevent instantiation
    }

    /**
     * Creates an engine from an application configuration containing a {@code loreweave} block.
     *
     * @throws IllegalArgumentException for unknown system, template or pressure growth types and invalid settings
     */
    public static WorldEngine create(Config config) {
        Config root = rootOf(config);
        EngineSettings settings = EngineSettings.fromConfig(section(root, "engine"));
        return create(root, settings);
    }

    /**
     * Creates an engine from the {@code loreweave} block with explicit settings (used for CLI overrides).
     */
    public static WorldEngine create(Config root, EngineSettings settings) {
        IDomainSchema domain = new ConfigDomainSchema(section(root, "domain"));
        List<PressureDefinition> pressures = readPressures(root);
        List<Era> eras = readEras(root);
        List<ISimulationSystem> systems = root.hasPath("systems")
                ? SystemFactory.createAll(root.getConfigList("systems")) : List.of();
        List<IGrowthTemplate> templates = root.hasPath("templates")
                ? TemplateFactory.createAll(root.getConfigList("templates"), domain) : List.of();
        SeedWorld seedWorld = SeedWorld.fromConfig(section(root, "seed-world"));

        LOG.debug("Building engine for domain '{}': {} pressures, {} eras, {} systems, {} templates, {} seed entities",
                domain.getName(), pressures.size(), eras.size(), systems.size(), templates.size(),
                seedWorld.getEntities().size());
        return new WorldEngine(settings, domain, pressures, eras, systems, templates, seedWorld);
    }

    /**
     * @return the {@code loreweave} block of an application configuration, empty if absent
     */
    public static Config rootOf(Config config) {
        return config.hasPath(ROOT_PATH) ? config.getConfig(ROOT_PATH) : ConfigFactory.empty();
    }

    static List<PressureDefinition> readPressures(Config root) {
        List<PressureDefinition> pressures = new ArrayList<>();
        if (root.hasPath("pressures")) {
            for (Config entry : root.getConfigList("pressures")) {
                pressures.add(PressureDefinition.fromConfig(entry));
            }
        }
        return pressures;
    }

    /**
     * Reads the era list; a configuration without eras runs in a single neutral era.
     */
    static List<Era> readEras(Config root) {
        List<Era> eras = new ArrayList<>();
        if (root.hasPath("eras")) {
            for (Config entry : root.getConfigList("eras")) {
                String id = entry.getString("id");
                eras.add(new Era(
                        id,
                        entry.hasPath("name") ? entry.getString("name") : id,
                        entry.hasPath("description") ? entry.getString("description") : "",
                        readWeights(entry, "template-weights"),
                        readWeights(entry, "system-modifiers"),
                        readWeights(entry, "pressure-modifiers")));
            }
        }
        if (eras.isEmpty()) {
            eras.add(Era.neutral("default"));
        }
        return eras;
    }

    private static Map<String, Double> readWeights(Config entry, String path) {
        Map<String, Double> weights = new LinkedHashMap<>();
        if (!entry.hasPath(path)) {
            return weights;
        }
        for (Map.Entry<String, ConfigValue> weight : entry.getConfig(path).root().entrySet()) {
            Object value = weight.getValue().unwrapped();
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException(path + "." + weight.getKey() + " must be a number: " + value);
            }
            weights.put(weight.getKey(), ((Number) value).doubleValue());
        }
        return weights;
    }

    private static Config section(Config root, String path) {
        return root.hasPath(path) ? root.getConfig(path) : ConfigFactory.empty();
    }
}

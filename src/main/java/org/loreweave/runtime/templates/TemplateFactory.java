package org.loreweave.runtime.templates;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IGrowthTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for creating growth templates.
 * It uses a registry to map type names to creators.
 */
public class TemplateFactory {

    private static final Map<String, ITemplateCreator> registry = new HashMap<>();

    static {
        register("hero_emergence", HeroEmergenceTemplate::new);
        register("cult_formation", CultFormationTemplate::new);
        register("strategic_location_discovery", StrategicLocationDiscoveryTemplate::new);
        register("resource_location_discovery", ResourceLocationDiscoveryTemplate::new);
        register("mystical_location_discovery", MysticalLocationDiscoveryTemplate::new);
        register("colony_founding", ColonyFoundingTemplate::new);
    }

    /**
     * Registers a new template creator.
     * @param type The type of the template.
     * @param creator The creator for the template.
     */
    public static void register(String type, ITemplateCreator creator) {
        registry.put(type.toLowerCase(), creator);
    }

    /**
     * Creates a new growth template.
     * @param type The type of the template to create.
     * @param options The template's options, may be null.
     * @param domain The domain the template generates for.
     * @return The created template.
     * @throws IllegalArgumentException if the template type is unknown.
     */
    public static IGrowthTemplate create(String type, Config options, IDomainSchema domain) {
        Objects.requireNonNull(type, "Template type cannot be null.");
        ITemplateCreator creator = registry.get(type.toLowerCase());
        if (creator == null) {
            throw new IllegalArgumentException("Unknown template type: " + type);
        }
        return creator.create(options != null ? options : ConfigFactory.empty(), domain);
    }

    /**
     * Creates templates from a list of blocks, each carrying a {@code type}. Blocks with
     * {@code enabled = false} are skipped.
     */
    public static List<IGrowthTemplate> createAll(List<? extends Config> blocks, IDomainSchema domain) {
        List<IGrowthTemplate> templates = new ArrayList<>();
        for (Config block : blocks) {
            if (block.hasPath("enabled") && !block.getBoolean("enabled")) continue;
            templates.add(create(block.getString("type"), block, domain));
        }
        return templates;
    }
}

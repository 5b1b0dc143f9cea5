package org.loreweave.runtime.spi;

import org.loreweave.runtime.discovery.DiscoveryConfig;
import org.loreweave.runtime.domain.EntityKindDefinition;
import org.loreweave.runtime.domain.ThemeVocabulary;

import java.util.List;
import java.util.Optional;

/**
 * The domain collaborator: vocabularies, the relationship matrix and the optional capabilities
 * (structure validation, placement) of a concrete world. Injected as configuration.
 */
public interface IDomainSchema {

    /**
     * @return domain name for logs
     */
    String getName();

    List<EntityKindDefinition> getEntityKinds();

    /**
     * @return the definition of a kind, or null if the domain does not know it
     */
    EntityKindDefinition getEntityKind(String kind);

    /**
     * Checks a relationship kind against the (srcKind, dstKind) matrix.
     */
    boolean isRelationshipAllowed(String srcKind, String dstKind, String relationshipKind);

    /**
     * Structure validator; empty when the domain supplies none, in which case the check is skipped.
     */
    Optional<IStructureValidator> getStructureValidator();

    INameGenerator getNameGenerator();

    ThemeVocabulary getThemeVocabulary();

    /**
     * Placement service; empty when the domain has no spatial model.
     */
    Optional<IPlacementService> getPlacementService();

    /**
     * Emergent discovery settings; empty when the domain does not discover locations.
     */
    Optional<DiscoveryConfig> getDiscoveryConfig();
}

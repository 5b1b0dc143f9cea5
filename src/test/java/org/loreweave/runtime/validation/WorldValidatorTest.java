package org.loreweave.runtime.validation;

import com.typesafe.config.ConfigFactory;
import org.loreweave.junit.extensions.logging.ExpectLog;
import org.loreweave.junit.extensions.logging.LogLevel;
import org.loreweave.runtime.domain.ConfigDomainSchema;
import org.loreweave.runtime.model.Graph;
import org.loreweave.runtime.spi.IStructureValidator;
import org.loreweave.runtime.testing.TestWorlds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link WorldValidator} checks.
 */
@Tag("unit")
class WorldValidatorTest {

    private Graph graph;
    private WorldValidator validator;

    @BeforeEach
    void setUp() {
        graph = TestWorlds.emptyGraph();
        validator = new WorldValidator(new ConfigDomainSchema(ConfigFactory.parseString(
                "entity-kinds = [{ kind = npc, required-relationships = ["
                        + "{ kind = resident_of, when-status = alive, except-subtypes = [orca] }] }]")));
        TestWorlds.colony(graph, "home", "thriving", 0, 0);
        TestWorlds.npc(graph, "a", "hero");
        graph.addRelationship("resident_of", "a", "home");
    }

    /**
     * A connected world that satisfies the domain passes all four checks.
     */
    @Test
    void validateWorld_passesForSoundWorld() {
        ValidationReport report = validator.validateWorld(graph);

        assertThat(report.isValid()).isTrue();
        assertThat(report.totalChecks()).isEqualTo(4);
        assertThat(report.passed()).isEqualTo(4);
        assertThat(report.format()).contains("Validation: 4/4 checks passed");
    }

    /**
     * Entities without any relationship are reported by id.
     */
    @Test
    void validateConnectedEntities_reportsIsolatedEntities() {
        TestWorlds.faction(graph, "loners");

        ValidationResult result = validator.validateConnectedEntities(graph);

        assertThat(result.passed()).isFalse();
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.failedEntities()).containsExactly("loners");
        assertThat(result.details()).contains("faction:political: 1");
    }

    /**
     * Living NPCs need a residence, except for exempt subtypes; the dead need none.
     */
    @Test
    void validateEntityStructure_appliesRequiredRelationships() {
        TestWorlds.npc(graph, "drifter", "merchant");
        TestWorlds.npc(graph, "ghost", "merchant");
        graph.getEntity("ghost").setStatus("dead");
        TestWorlds.npc(graph, "swimmer", "orca");

        ValidationResult result = validator.validateEntityStructure(graph);

        assertThat(result.passed()).isFalse();
        assertThat(result.failedEntities()).containsExactly("drifter");
        assertThat(result.details()).contains("missing resident_of");
        assertThat(new WorldValidator((IStructureValidator) null)
                .validateEntityStructure(graph).passed()).isTrue();
    }

    /**
     * Relationships pointing at missing entities are listed with the missing side.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Relationship .* references a missing entity.*")
    void validateRelationshipIntegrity_reportsMissingEndpoint() {
        graph.addRelationship("follower_of", "a", "nobody");

        ValidationResult result = validator.validateRelationshipIntegrity(graph);

        assertThat(result.passed()).isFalse();
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.details()).contains("(dst missing)").doesNotContain("src missing");
        assertThat(result.failedEntities()).isEmpty();
    }

    /**
     * When both endpoints are gone the two flags are listed together, separated by a comma.
     */
    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Relationship .* references a missing entity \\(src and dst missing\\)")
    void validateRelationshipIntegrity_joinsMissingFlags() {
        graph.addRelationship("follower_of", "ghost", "nobody");

        ValidationResult result = validator.validateRelationshipIntegrity(graph);

        assertThat(result.details()).contains("follower_of: ghost → nobody (src missing, dst missing)");
    }

    /**
     * Link caches that disagree with the relationship list are reported per entity.
     */
    @Test
    void validateLinkSync_detectsStaleLinks() {
        Graph stale = mock(Graph.class);
        when(stale.getEntities()).thenReturn(graph.getEntities());
        when(stale.getRelationships()).thenReturn(List.of());

        ValidationResult result = validator.validateLinkSync(stale);

        assertThat(result.passed()).isFalse();
        assertThat(result.failedEntities()).containsExactly("a");
        assertThat(result.details()).contains("a: 1 in links array, 0 in relationships");
        assertThat(validator.validateLinkSync(graph).passed()).isTrue();
    }
}

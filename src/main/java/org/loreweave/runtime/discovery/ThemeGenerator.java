package org.loreweave.runtime.discovery;

import org.loreweave.runtime.domain.ThemeVocabulary;
import org.loreweave.runtime.internal.services.Probabilities;
import org.loreweave.runtime.spi.IRandomProvider;

import java.util.List;
import java.util.Map;

/**
 * Composes location themes from analysis records. Word choice draws from the supplied random
 * provider only, so a seeded run always produces the same places.
 */
public final class ThemeGenerator {

    private static final List<String> RESOURCE_FORMS =
            List.of("grounds", "channel", "pool", "canyon", "valley", "shelf", "zone", "field");
    private static final List<String> GEOGRAPHIC_FORMS =
            List.of("shelf", "terrace", "ledge", "plateau", "hollow", "valley");
    private static final List<String> ADVANTAGE_WORDS = List.of("defensible", "fortified", "strategic", "elevated");
    private static final List<String> CONCEALMENT_WORDS = List.of("hidden", "neutral", "secret", "isolated");
    private static final Map<ConflictAnalysis.Type, List<String>> STRATEGIC_FORMS = Map.of(
            ConflictAnalysis.Type.TERRITORIAL, List.of("ridge", "pass", "bridge", "crossing"),
            ConflictAnalysis.Type.DEFENSIVE, List.of("peak", "fortress", "bulwark", "rampart"),
            ConflictAnalysis.Type.RESOURCE, List.of("cache", "reserve", "depot", "stockpile"),
            ConflictAnalysis.Type.IDEOLOGICAL, List.of("sanctuary", "refuge", "haven", "retreat"));
    private static final List<String> VOLATILE_WORDS = List.of("chaotic", "wild", "unstable", "volatile");
    private static final List<String> DORMANT_WORDS = List.of("ancient", "dormant", "sleeping", "sealed");
    private static final Map<MagicAnalysis.Manifestation, List<String>> MANIFESTATION_FORMS = Map.of(
            MagicAnalysis.Manifestation.CONVERGENCE, List.of("nexus", "focus", "node", "junction"),
            MagicAnalysis.Manifestation.ARTIFACT, List.of("vault", "chamber", "repository", "archive"),
            MagicAnalysis.Manifestation.PHENOMENON, List.of("aurora", "glow", "shimmer", "echo"),
            MagicAnalysis.Manifestation.TEMPLE, List.of("shrine", "temple", "sanctum", "altar"));

    static final String GEOGRAPHIC_FEATURE = "geographic_feature";

    private final ThemeVocabulary vocabulary;
    private final String anomalySubtype;

    public ThemeGenerator(ThemeVocabulary vocabulary, String anomalySubtype) {
        this.vocabulary = vocabulary;
        this.anomalySubtype = anomalySubtype;
    }

    /**
     * depth_resource_form, e.g. {@code deep_krill_channel}.
     */
    public LocationTheme resourceTheme(ResourceAnalysis analysis, String eraId, IRandomProvider random) {
        String depth = Probabilities.pickRandom(random, vocabulary.depthWords(eraId));
        String resource = Probabilities.pickRandom(random, vocabulary.resourceWords(analysis.specific()));
        String form = Probabilities.pickRandom(random, RESOURCE_FORMS);
        return new LocationTheme(GEOGRAPHIC_FEATURE, depth + "_" + resource + "_" + form,
                List.of("resource", analysis.primary(), analysis.specific(), depth), analysis.affectedColonies());
    }

    /**
     * advantage_form, e.g. {@code fortified_pass}.
     */
    public LocationTheme strategicTheme(ConflictAnalysis analysis, IRandomProvider random) {
        String advantage = Probabilities.pickRandom(random, analysis.needsAdvantage() ? ADVANTAGE_WORDS : CONCEALMENT_WORDS);
        String form = Probabilities.pickRandom(random, STRATEGIC_FORMS.get(analysis.type()));
        String type = analysis.type().name().toLowerCase();
        return new LocationTheme(GEOGRAPHIC_FEATURE, advantage + "_" + form,
                List.of("strategic", type, advantage), analysis.factions());
    }

    /**
     * intensity_manifestation, e.g. {@code dormant_shrine}.
     */
    public LocationTheme mysticalTheme(MagicAnalysis analysis, IRandomProvider random) {
        String intensity = Probabilities.pickRandom(random, analysis.instability() > 60 ? VOLATILE_WORDS : DORMANT_WORDS);
        String manifestation = Probabilities.pickRandom(random, MANIFESTATION_FORMS.get(analysis.manifestation()));
        return new LocationTheme(anomalySubtype, intensity + "_" + manifestation,
                List.of("mystical", analysis.manifestation().name().toLowerCase(), intensity), List.of());
    }

    /**
     * descriptor_geographic, e.g. {@code uncharted_plateau}.
     */
    public LocationTheme explorationTheme(String eraId, IRandomProvider random) {
        String descriptor = Probabilities.pickRandom(random, vocabulary.descriptors(eraId));
        String geographic = Probabilities.pickRandom(random, GEOGRAPHIC_FORMS);
        return new LocationTheme(GEOGRAPHIC_FEATURE, descriptor + "_" + geographic,
                List.of("exploration", "neutral", descriptor), List.of());
    }
}

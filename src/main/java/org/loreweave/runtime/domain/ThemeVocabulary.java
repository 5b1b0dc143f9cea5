package org.loreweave.runtime.domain;

import java.util.List;
import java.util.Map;

/**
 * Word lists used by the discovery theme generators. Data, not algorithm: supplied by the domain.
 *
 * @param eraDepthWords depth words per era id, e.g. "deep", "surface"
 * @param eraDescriptors exploration descriptors per era id, e.g. "uncharted"
 * @param resourceWords words per specific resource, e.g. fishing to krill, fish
 * @param defaultDepthWords depth words for eras without an entry
 * @param defaultDescriptors descriptors for eras without an entry
 */
public record ThemeVocabulary(Map<String, List<String>> eraDepthWords,
                              Map<String, List<String>> eraDescriptors,
                              Map<String, List<String>> resourceWords,
                              List<String> defaultDepthWords,
                              List<String> defaultDescriptors) {

    public ThemeVocabulary {
        eraDepthWords = eraDepthWords == null ? Map.of() : Map.copyOf(eraDepthWords);
        eraDescriptors = eraDescriptors == null ? Map.of() : Map.copyOf(eraDescriptors);
        resourceWords = resourceWords == null ? Map.of() : Map.copyOf(resourceWords);
        defaultDepthWords = defaultDepthWords == null || defaultDepthWords.isEmpty()
                ? List.of("underground", "deep", "surface") : List.copyOf(defaultDepthWords);
        defaultDescriptors = defaultDescriptors == null || defaultDescriptors.isEmpty()
                ? List.of("mysterious", "unknown", "uncharted", "distant") : List.copyOf(defaultDescriptors);
    }

    /**
     * A vocabulary with only the built-in defaults.
     */
    public static ThemeVocabulary defaults() {
        return new ThemeVocabulary(Map.of(), Map.of(), Map.of(), List.of(), List.of());
    }

    public List<String> depthWords(String eraId) {
        return eraDepthWords.getOrDefault(eraId, defaultDepthWords);
    }

    public List<String> descriptors(String eraId) {
        return eraDescriptors.getOrDefault(eraId, defaultDescriptors);
    }

    public List<String> resourceWords(String specific) {
        return resourceWords.getOrDefault(specific, List.of("resource"));
    }
}

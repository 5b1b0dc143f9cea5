package org.loreweave.runtime.discovery;

import java.util.List;

/**
 * A procedurally composed location theme such as {@code deep_krill_channel}.
 *
 * @param subtype location subtype to create
 * @param themeString underscore-joined theme words, used as the location's name seed
 * @param tags tags for the new location
 * @param relatedTo entity ids the location relates to
 */
public record LocationTheme(String subtype, String themeString, List<String> tags, List<String> relatedTo) {

    public LocationTheme {
        tags = List.copyOf(tags);
        relatedTo = List.copyOf(relatedTo);
    }
}

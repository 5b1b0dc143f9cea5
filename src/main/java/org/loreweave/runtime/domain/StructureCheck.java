package org.loreweave.runtime.domain;

import java.util.List;

/**
 * Outcome of a domain structure check on one entity.
 *
 * @param valid true if nothing is missing
 * @param missing names of the missing required relationships
 */
public record StructureCheck(boolean valid, List<String> missing) {

    public StructureCheck {
        missing = List.copyOf(missing);
    }

    public static StructureCheck ok() {
        return new StructureCheck(true, List.of());
    }

    public static StructureCheck missing(List<String> missing) {
        return new StructureCheck(missing.isEmpty(), missing);
    }
}

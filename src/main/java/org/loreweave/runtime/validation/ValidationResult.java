package org.loreweave.runtime.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one validation check.
 *
 * @param name display name of the check
 * @param passed true if no violation was found
 * @param failureCount number of violations
 * @param details human readable summary, one violation per line when failed
 * @param failedEntities ids of the offending entities, empty for checks that report relationships
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ValidationResult(@JsonProperty("name") String name,
                               @JsonProperty("passed") boolean passed,
                               @JsonProperty("failureCount") int failureCount,
                               @JsonProperty("details") String details,
                               @JsonProperty("failedEntities") List<String> failedEntities) {

    public ValidationResult {
        failedEntities = failedEntities == null ? List.of() : List.copyOf(failedEntities);
    }

    static ValidationResult pass(String name, String details) {
        return new ValidationResult(name, true, 0, details, List.of());
    }
}

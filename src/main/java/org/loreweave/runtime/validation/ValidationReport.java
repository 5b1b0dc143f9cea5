package org.loreweave.runtime.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Aggregate of all validation checks of a world.
 */
@JsonPropertyOrder({"totalChecks", "passed", "failed", "results"})
public record ValidationReport(@JsonProperty("results") List<ValidationResult> results,
                               @JsonProperty("totalChecks") int totalChecks,
                               @JsonProperty("passed") int passed,
                               @JsonProperty("failed") int failed) {

    public ValidationReport {
        results = List.copyOf(results);
    }

    public static ValidationReport of(List<ValidationResult> results) {
        int passed = (int) results.stream().filter(ValidationResult::passed).count();
        return new ValidationReport(results, results.size(), passed, results.size() - passed);
    }

    @JsonIgnore
    public boolean isValid() {
        return failed == 0;
    }

    /**
     * Multi-line summary, one line per check followed by the details of failed checks.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Validation: %d/%d checks passed%n", passed, totalChecks));
        for (ValidationResult result : results) {
            sb.append(String.format("  [%s] %s%n", result.passed() ? "PASS" : "FAIL", result.name()));
            if (!result.passed()) {
                for (String line : result.details().split("\n")) {
                    sb.append("      ").append(line).append(System.lineSeparator());
                }
            }
        }
        return sb.toString();
    }
}

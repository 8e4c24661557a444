package ai.codegauge.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Metrics computed from a single parse of one source file. Holds no reference to the syntax tree.
 *
 * @param nodeCount total syntax tree nodes visited, named and anonymous
 * @param complexityScore number of control-flow nodes (cyclomatic proxy)
 * @param cognitiveComplexity nesting-weighted control-flow score
 * @param halsteadVolume {@code (N1 + N2) * log2(n1 + n2)}, rounded to 2 decimals
 * @param maintainabilityIndex composite score in {@code [0, 100]}, higher is better
 * @param sqaleDebtHours estimated remediation effort in hours
 * @param linesOfCode non-blank, non-comment-only lines
 * @param description the module docstring, if the file starts with one
 */
public record AnalysisResult(
        @JsonProperty("node_count") int nodeCount,
        @JsonProperty("complexity_score") int complexityScore,
        @JsonProperty("cognitive_complexity") int cognitiveComplexity,
        @JsonProperty("halstead_volume") double halsteadVolume,
        @JsonProperty("maintainability_index") double maintainabilityIndex,
        @JsonProperty("sqale_debt_hours") double sqaleDebtHours,
        @JsonProperty("lines_of_code") int linesOfCode,
        @JsonProperty("description") @Nullable String description) {

    /** Result for empty or whitespace-only input. */
    public static final AnalysisResult EMPTY = new AnalysisResult(0, 0, 0, 0.0, 100.0, 0.0, 0, null);

    public AnalysisResult {
        if (nodeCount < 0 || complexityScore < 0 || cognitiveComplexity < 0 || linesOfCode < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
        if (maintainabilityIndex < 0.0 || maintainabilityIndex > 100.0) {
            throw new IllegalArgumentException("maintainabilityIndex out of range: " + maintainabilityIndex);
        }
    }

    @JsonIgnore
    public Optional<String> descriptionOpt() {
        return Optional.ofNullable(description);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return equals(EMPTY);
    }
}

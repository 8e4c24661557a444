package ai.codegauge.scan;

import ai.codegauge.util.MetricRounding;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Comparator;
import java.util.List;

/**
 * Aggregate of one scan. Files are ordered by cyclomatic complexity, highest first, then by path.
 *
 * @param root the scanned directory
 * @param files per-file metrics
 * @param filesScanned number of files analyzed
 * @param skippedFiles number of files that could not be read or decoded
 * @param totalComplexity sum of cyclomatic complexity
 * @param totalCognitiveComplexity sum of cognitive complexity
 * @param totalDebtHours sum of SQALE debt, rounded to 2 decimals
 * @param averageMaintainabilityIndex mean maintainability index, 100.0 when nothing was scanned
 */
public record ScanReport(
        @JsonProperty("root") String root,
        @JsonProperty("files") List<FileMetrics> files,
        @JsonProperty("files_scanned") int filesScanned,
        @JsonProperty("skipped_files") int skippedFiles,
        @JsonProperty("total_complexity") int totalComplexity,
        @JsonProperty("total_cognitive_complexity") int totalCognitiveComplexity,
        @JsonProperty("total_debt_hours") double totalDebtHours,
        @JsonProperty("average_maintainability_index") double averageMaintainabilityIndex) {

    static final Comparator<FileMetrics> BY_COMPLEXITY_DESC = Comparator.comparingInt(
                    (FileMetrics f) -> f.result().complexityScore())
            .reversed()
            .thenComparing(FileMetrics::filePath);

    public ScanReport {
        files = List.copyOf(files);
    }

    static ScanReport of(String root, List<FileMetrics> files, int skippedFiles) {
        var sorted = files.stream().sorted(BY_COMPLEXITY_DESC).toList();
        int totalComplexity = 0;
        int totalCognitive = 0;
        double totalDebt = 0.0;
        double miSum = 0.0;
        for (var f : sorted) {
            totalComplexity += f.result().complexityScore();
            totalCognitive += f.result().cognitiveComplexity();
            totalDebt += f.result().sqaleDebtHours();
            miSum += f.result().maintainabilityIndex();
        }
        double averageMi = sorted.isEmpty() ? 100.0 : MetricRounding.round2(miSum / sorted.size());
        return new ScanReport(
                root,
                sorted,
                sorted.size(),
                skippedFiles,
                totalComplexity,
                totalCognitive,
                MetricRounding.round2(totalDebt),
                averageMi);
    }

    public static ScanReport empty(String root) {
        return of(root, List.of(), 0);
    }
}

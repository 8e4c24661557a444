package ai.codegauge.scan;

import ai.codegauge.analyzer.AnalysisResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/** One scanned file and its metrics, serialized as a single flat object. */
public record FileMetrics(
        @JsonProperty("file_path") String filePath, @JsonUnwrapped AnalysisResult result) {}

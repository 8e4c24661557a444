package ai.codegauge.analyzer;

import java.util.Set;

/**
 * Computes an {@link AnalysisResult} from the full text of one source file.
 *
 * <p>Implementations are pure and total: the same text always yields an equal result, malformed source degrades into
 * (possibly meaningless) numbers instead of an exception, and no file system or network access takes place. Callers
 * that need a time bound must impose it themselves.
 */
public interface MetricsAnalyzer {

    /**
     * Analyzes the given source text.
     *
     * @param source full file contents, may be empty
     * @return a freshly built result, never {@code null}
     */
    AnalysisResult analyze(String source);

    /** Lower-cased file extensions (without the dot) this analyzer understands. */
    Set<String> getExtensions();

    /** Whether this analyzer should be used for the given file. */
    default boolean supports(SourceFile file) {
        return getExtensions().contains(file.extension());
    }
}

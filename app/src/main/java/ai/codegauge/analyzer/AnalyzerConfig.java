package ai.codegauge.analyzer;

/**
 * Immutable engine configuration, built once at startup and handed to {@link TreeSitterMetricsAnalyzer}.
 *
 * @param language grammar and node tables to measure with
 * @param debtHoursPerPoint SQALE remediation hours charged per cognitive complexity point
 */
public record AnalyzerConfig(MetricsLanguage language, double debtHoursPerPoint) {

    public static final double DEFAULT_DEBT_HOURS_PER_POINT = 0.15;

    public AnalyzerConfig {
        if (!(debtHoursPerPoint >= 0.0) || Double.isInfinite(debtHoursPerPoint)) {
            throw new IllegalArgumentException("debtHoursPerPoint must be a finite, non-negative number");
        }
    }

    public static AnalyzerConfig defaults(MetricsLanguage language) {
        return new AnalyzerConfig(language, DEFAULT_DEBT_HOURS_PER_POINT);
    }

    public AnalyzerConfig withDebtHoursPerPoint(double hours) {
        return new AnalyzerConfig(language, hours);
    }
}

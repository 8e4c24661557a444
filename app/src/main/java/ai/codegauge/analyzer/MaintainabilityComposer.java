package ai.codegauge.analyzer;

import ai.codegauge.util.MetricRounding;

/**
 * Maintainability index and SQALE remediation debt.
 *
 * <p>The index uses the cyclomatic count, not cognitive complexity, as the classic formula does:
 * {@code (171 - 5.2 ln(V) - 0.23 CC - 16.2 ln(LOC)) * 100 / 171}, clamped to {@code [0, 100]}. Inputs are floored at
 * 1 so that no logarithm is taken of zero.
 */
final class MaintainabilityComposer {
    private final double debtHoursPerPoint;

    MaintainabilityComposer(double debtHoursPerPoint) {
        this.debtHoursPerPoint = debtHoursPerPoint;
    }

    static double maintainabilityIndex(double halsteadVolume, int cyclomaticComplexity, int linesOfCode) {
        double v = Math.max(halsteadVolume, 1.0);
        int loc = Math.max(linesOfCode, 1);
        int cc = Math.max(cyclomaticComplexity, 1);

        double raw = 171 - 5.2 * Math.log(v) - 0.23 * cc - 16.2 * Math.log(loc);
        double normalized = Math.max(0.0, raw * 100 / 171);
        return MetricRounding.round2(Math.min(100.0, normalized));
    }

    double sqaleDebtHours(int cognitiveComplexity) {
        return MetricRounding.round2(cognitiveComplexity * debtHoursPerPoint);
    }
}

package ai.codegauge.analyzer;

/**
 * Halstead counts for one file.
 *
 * @param totalOperators N1
 * @param totalOperands N2
 * @param distinctOperators n1
 * @param distinctOperands n2
 */
public record HalsteadMetrics(int totalOperators, int totalOperands, int distinctOperators, int distinctOperands) {

    public static final HalsteadMetrics EMPTY = new HalsteadMetrics(0, 0, 0, 0);

    public int vocabulary() {
        return distinctOperators + distinctOperands;
    }

    public int length() {
        return totalOperators + totalOperands;
    }

    /** {@code (N1 + N2) * log2(n1 + n2)}, or 0 when nothing was counted. */
    public double volume() {
        int vocabulary = vocabulary();
        if (vocabulary == 0) {
            return 0.0;
        }
        return length() * (Math.log(vocabulary) / Math.log(2));
    }
}

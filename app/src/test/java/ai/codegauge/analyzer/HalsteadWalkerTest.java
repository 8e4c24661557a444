package ai.codegauge.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class HalsteadWalkerTest {
    private final TreeBuilder builder = new TreeBuilder(Languages.PYTHON);
    private final HalsteadWalker walker = new HalsteadWalker(Languages.PYTHON.getSyntaxProfile());

    private HalsteadMetrics halstead(String code) {
        return walker.compute(builder.parse(code));
    }

    @Test
    void assignmentWithRepeatedIdentifier() {
        var metrics = halstead("x = x + 1");
        assertEquals(2, metrics.totalOperators());
        assertEquals(2, metrics.distinctOperators());
        assertEquals(3, metrics.totalOperands());
        assertEquals(2, metrics.distinctOperands());
        assertEquals(10.0, metrics.volume(), 1e-9);
    }

    @Test
    void keywordTokensCountAsOperators() {
        var metrics = halstead("def f(a):\n    return a\n");
        // def, return
        assertEquals(2, metrics.totalOperators());
        // f, a, a
        assertEquals(3, metrics.totalOperands());
        assertEquals(2, metrics.distinctOperands());
        assertEquals(10.0, metrics.volume(), 1e-9);
    }

    @Test
    void booleanOperatorsCountNodeAndKeyword() {
        var metrics = halstead("a and b or not c");
        assertEquals(6, metrics.totalOperators());
        assertEquals(5, metrics.distinctOperators());
        assertEquals(3, metrics.distinctOperands());
        assertEquals(27.0, metrics.volume(), 1e-9);
    }

    @Test
    void operandsAreKeyedByText() {
        var metrics = halstead("s = \"hi\"\nt = \"hi\"\n");
        assertEquals(2, metrics.totalOperators());
        assertEquals(1, metrics.distinctOperators());
        assertEquals(4, metrics.totalOperands());
        // s, t and one "hi"
        assertEquals(3, metrics.distinctOperands());
        assertEquals(12.0, metrics.volume(), 1e-9);
    }

    @Test
    void nothingCountedMeansZeroVolume() {
        var metrics = halstead("# only a comment\n");
        assertEquals(0, metrics.vocabulary());
        assertEquals(0.0, metrics.volume());
    }

    @Test
    void singleDistinctTokenHasZeroVolume() {
        // log2(1) == 0
        var metrics = halstead("pass\npass\n");
        assertEquals(2, metrics.totalOperators());
        assertEquals(1, metrics.vocabulary());
        assertEquals(0.0, metrics.volume());
    }

    @Test
    void volumeFormula() {
        var metrics = new HalsteadMetrics(10, 6, 4, 4);
        assertEquals(8, metrics.vocabulary());
        assertEquals(16, metrics.length());
        assertEquals(48.0, metrics.volume(), 1e-9);
        assertEquals(0.0, HalsteadMetrics.EMPTY.volume());
    }
}

package ai.codegauge.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class MaintainabilityComposerTest {

    @Test
    void inputsAreFlooredBeforeTakingLogarithms() {
        assertEquals(99.87, MaintainabilityComposer.maintainabilityIndex(0.0, 0, 0), 1e-9);
        assertEquals(
                MaintainabilityComposer.maintainabilityIndex(1.0, 1, 1),
                MaintainabilityComposer.maintainabilityIndex(0.5, 0, 0));
    }

    @Test
    void typicalValues() {
        assertEquals(56.94, MaintainabilityComposer.maintainabilityIndex(100.0, 5, 20), 1e-9);
    }

    @Test
    void clampedAtZero() {
        assertEquals(0.0, MaintainabilityComposer.maintainabilityIndex(1e30, 1000, 100_000));
    }

    @Test
    void neverAboveHundred() {
        for (int cc = 0; cc < 5; cc++) {
            double mi = MaintainabilityComposer.maintainabilityIndex(0.0, cc, 1);
            assertTrue(mi <= 100.0 && mi >= 0.0, "mi=" + mi);
        }
    }

    @Test
    void moreComplexityNeverImprovesTheIndex() {
        double simple = MaintainabilityComposer.maintainabilityIndex(250.0, 2, 30);
        double complex = MaintainabilityComposer.maintainabilityIndex(250.0, 20, 30);
        assertTrue(complex < simple);
    }

    @Test
    void sqaleDebtIsLinearInCognitiveComplexity() {
        var composer = new MaintainabilityComposer(AnalyzerConfig.DEFAULT_DEBT_HOURS_PER_POINT);
        assertEquals(0.0, composer.sqaleDebtHours(0));
        assertEquals(2.4, composer.sqaleDebtHours(16), 1e-9);
        assertEquals(0.9, composer.sqaleDebtHours(6), 1e-9);
        assertEquals(15.0, composer.sqaleDebtHours(100), 1e-9);
    }
}

package ai.codegauge.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class CognitiveComplexityWalkerTest {
    private final TreeBuilder builder = new TreeBuilder(Languages.PYTHON);
    private final CognitiveComplexityWalker walker =
            new CognitiveComplexityWalker(Languages.PYTHON.getSyntaxProfile());

    private int cognitive(String code) {
        return walker.compute(builder.parse(code).root());
    }

    @Test
    void ifElseAtSameLevelCountsTwo() {
        var code =
                """
                def test():
                    if True:
                        x = 1
                    else:
                        x = 2
                """;
        assertEquals(2, cognitive(code));
    }

    @Test
    void loopInsideConditionalCountsThree() {
        var code =
                """
                def test():
                    if True:
                        for i in x:
                            pass
                """;
        assertEquals(3, cognitive(code));
    }

    @Test
    void elifChainIsCountedPerClauseAtOpeningDepth() {
        var code =
                """
                def grade(x):
                    if x > 5:
                        y = 1
                    elif x > 3:
                        y = 2
                    elif x > 0:
                        y = 3
                    else:
                        y = 4
                    return y
                """;
        assertEquals(4, cognitive(code));
    }

    @Test
    void tryExceptClausesStayAtTryDepth() {
        var code =
                """
                try:
                    run()
                except ValueError:
                    pass
                except KeyError:
                    pass
                finally:
                    cleanup()
                """;
        // try + two excepts; finally is not a control-flow node
        assertEquals(3, cognitive(code));
    }

    @Test
    void nestedTryInsideLoopInsideConditional() {
        var code =
                """
                if ready:
                    for job in jobs:
                        try:
                            job.run()
                        except Exception:
                            pass
                """;
        // if 1 + for 2 + try 3 + except 3
        assertEquals(9, cognitive(code));
    }

    @Test
    void whileElseAndWith() {
        var code =
                """
                while running:
                    with lock:
                        step()
                else:
                    stop()
                """;
        // while 1 + with 2 + else 1
        assertEquals(4, cognitive(code));
    }

    @Test
    void methodBodiesDoNotAddNesting() {
        var code =
                """
                class Outer:
                    class Inner:
                        def method(self):
                            if self.flag:
                                return 1
                            return 0
                """;
        assertEquals(1, cognitive(code));
    }

    @Test
    void functionDefinedInsideConditionalStartsAtDepthZero() {
        var code =
                """
                if enabled:
                    def handler():
                        if event:
                            pass
                """;
        // outer if 1 + inner if 1: the nested function body resets nesting
        assertEquals(2, cognitive(code));
    }

    @Test
    void siblingSubtreesDoNotShareDepth() {
        var code =
                """
                if a:
                    if b:
                        pass
                if c:
                    pass
                """;
        // 1 + 2 + 1
        assertEquals(4, cognitive(code));
    }

    @Test
    void matchStatementCounts() {
        var code =
                """
                match command:
                    case "go":
                        pass
                    case _:
                        pass
                """;
        assertEquals(1, cognitive(code));
    }

    @Test
    void noControlFlowMeansZero() {
        assertEquals(0, cognitive("x = 1\ny = x + 2\nprint(y)\n"));
    }
}

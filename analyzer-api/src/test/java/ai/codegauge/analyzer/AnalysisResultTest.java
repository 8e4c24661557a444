package ai.codegauge.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class AnalysisResultTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void emptySentinel() {
        var empty = AnalysisResult.EMPTY;
        assertEquals(0, empty.nodeCount());
        assertEquals(0, empty.complexityScore());
        assertEquals(0, empty.cognitiveComplexity());
        assertEquals(0.0, empty.halsteadVolume());
        assertEquals(100.0, empty.maintainabilityIndex());
        assertEquals(0.0, empty.sqaleDebtHours());
        assertEquals(0, empty.linesOfCode());
        assertEquals(Optional.empty(), empty.descriptionOpt());
        assertTrue(empty.isEmpty());
    }

    @Test
    void serializesAsFlatSnakeCaseObject() throws Exception {
        var result = new AnalysisResult(42, 3, 5, 120.5, 71.25, 0.75, 12, "Parses things.");
        var json = mapper.readTree(mapper.writeValueAsString(result));

        assertEquals(
                List.of(
                        "node_count",
                        "complexity_score",
                        "cognitive_complexity",
                        "halstead_volume",
                        "maintainability_index",
                        "sqale_debt_hours",
                        "lines_of_code",
                        "description"),
                iteratorToList(json.fieldNames()));
        assertEquals(42, json.get("node_count").asInt());
        assertEquals(71.25, json.get("maintainability_index").asDouble());
        assertEquals("Parses things.", json.get("description").asText());
        assertFalse(result.isEmpty());
    }

    @Test
    void absentDescriptionSerializesAsNull() throws Exception {
        var json = mapper.readTree(mapper.writeValueAsString(AnalysisResult.EMPTY));
        assertTrue(json.get("description").isNull());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisResult(-1, 0, 0, 0.0, 50.0, 0.0, 0, null));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisResult(1, 0, 0, 0.0, 100.5, 0.0, 1, null));
        assertThrows(IllegalArgumentException.class, () -> new AnalysisResult(1, 0, 0, 0.0, -0.1, 0.0, 1, null));
    }

    private static List<String> iteratorToList(Iterator<String> it) {
        var list = new ArrayList<String>();
        it.forEachRemaining(list::add);
        return list;
    }
}

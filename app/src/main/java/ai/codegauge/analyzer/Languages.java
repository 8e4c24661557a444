package ai.codegauge.analyzer;

import ai.codegauge.analyzer.python.PythonLanguage;
import java.util.List;
import java.util.Optional;

public final class Languages {
    public static final MetricsLanguage PYTHON = new PythonLanguage();

    public static final List<MetricsLanguage> ALL_LANGUAGES = List.of(PYTHON);

    private Languages() {}

    public static Optional<MetricsLanguage> valueOf(String internalName) {
        return ALL_LANGUAGES.stream()
                .filter(l -> l.internalName().equalsIgnoreCase(internalName))
                .findFirst();
    }
}

package ai.codegauge.util;

import ai.codegauge.analyzer.AnalyzerConfig;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scanner and command line settings.
 *
 * <p>Stored as a plain properties file: - scan.ignoreDirs: comma-separated directory names - scan.extensions:
 * comma-separated file extensions, without the dot - scan.threads: int (worker threads) - debt.hoursPerPoint: double
 * (SQALE hours per cognitive complexity point)
 *
 * <p>Unknown keys are ignored; malformed values fall back to the default with a warning.
 */
public record CodeGaugeSettings(
        Set<String> ignoreDirs, Set<String> extensions, int threads, double debtHoursPerPoint) {
    private static final Logger logger = LogManager.getLogger(CodeGaugeSettings.class);

    public static final String FILE_NAME = "codegauge.properties";

    static final String KEY_IGNORE_DIRS = "scan.ignoreDirs";
    static final String KEY_EXTENSIONS = "scan.extensions";
    static final String KEY_THREADS = "scan.threads";
    static final String KEY_DEBT_HOURS = "debt.hoursPerPoint";

    public static final Set<String> DEFAULT_IGNORE_DIRS = Set.of(
            "venv",
            ".venv",
            "env",
            ".env",
            "__pycache__",
            ".git",
            ".hg",
            ".svn",
            "node_modules",
            ".tox",
            ".pytest_cache",
            ".mypy_cache",
            "dist",
            "build",
            "egg-info");

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of("py");

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    public CodeGaugeSettings {
        ignoreDirs = Set.copyOf(ignoreDirs);
        extensions = Set.copyOf(extensions);
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
    }

    public static CodeGaugeSettings defaults() {
        return new CodeGaugeSettings(
                DEFAULT_IGNORE_DIRS,
                DEFAULT_EXTENSIONS,
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                AnalyzerConfig.DEFAULT_DEBT_HOURS_PER_POINT);
    }

    /** Loads settings from {@code file}; a missing file yields the defaults. */
    public static CodeGaugeSettings load(Path file) throws IOException {
        var props = new Properties();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            }
            logger.debug("Loaded settings from {}", file);
        } else {
            logger.debug("No settings file at {}, using defaults", file);
        }
        return fromProperties(props);
    }

    public static CodeGaugeSettings fromProperties(Properties props) {
        var defaults = defaults();
        return new CodeGaugeSettings(
                parseList(props, KEY_IGNORE_DIRS, defaults.ignoreDirs(), false),
                parseList(props, KEY_EXTENSIONS, defaults.extensions(), true),
                parseThreads(props, defaults.threads()),
                parseDebtHours(props, defaults.debtHoursPerPoint()));
    }

    public CodeGaugeSettings withThreads(int threads) {
        return new CodeGaugeSettings(ignoreDirs, extensions, threads, debtHoursPerPoint);
    }

    private static Set<String> parseList(Properties props, String key, Set<String> fallback, boolean lowerCase) {
        var raw = props.getProperty(key);
        if (raw == null) return fallback;
        var values = new LinkedHashSet<String>();
        for (var value : LIST_SPLITTER.split(raw)) {
            values.add(lowerCase ? value.toLowerCase(Locale.ROOT) : value);
        }
        return values;
    }

    private static int parseThreads(Properties props, int fallback) {
        var raw = props.getProperty(KEY_THREADS);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            int threads = Integer.parseInt(raw.strip());
            if (threads >= 1) {
                return threads;
            }
            logger.warn("Ignoring {}={}: must be >= 1", KEY_THREADS, raw);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: {}", KEY_THREADS, raw, e.getMessage());
        }
        return fallback;
    }

    private static double parseDebtHours(Properties props, double fallback) {
        var raw = props.getProperty(KEY_DEBT_HOURS);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            double hours = Double.parseDouble(raw.strip());
            if (hours >= 0.0 && !Double.isInfinite(hours)) {
                return hours;
            }
            logger.warn("Ignoring {}={}: must be a finite, non-negative number", KEY_DEBT_HOURS, raw);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: {}", KEY_DEBT_HOURS, raw, e.getMessage());
        }
        return fallback;
    }
}

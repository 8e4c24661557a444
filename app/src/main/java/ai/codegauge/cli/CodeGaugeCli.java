package ai.codegauge.cli;

import ai.codegauge.analyzer.AnalyzerConfig;
import ai.codegauge.analyzer.Languages;
import ai.codegauge.analyzer.MetricsLanguage;
import ai.codegauge.analyzer.SourceFile;
import ai.codegauge.analyzer.TreeSitterMetricsAnalyzer;
import ai.codegauge.exception.ScanException;
import ai.codegauge.scan.ProjectScanner;
import ai.codegauge.util.CodeGaugeSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "codegauge",
        mixinStandardHelpOptions = true,
        version = "codegauge 0.1.0",
        description = "Structural complexity metrics for source files.",
        subcommands = {CodeGaugeCli.Analyze.class, CodeGaugeCli.Scan.class})
public final class CodeGaugeCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CodeGaugeCli.class);

    static final int EXIT_IO_ERROR = 1;

    static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Spec
    @SuppressWarnings("NullAway.Init")
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CodeGaugeCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /** Options shared by the subcommands. */
    static class CommonOptions {
        @CommandLine.Option(
                names = "--config",
                description = "Settings file (default: ./" + CodeGaugeSettings.FILE_NAME + " if present).")
        @Nullable
        Path configFile;

        @CommandLine.Option(
                names = "--language",
                defaultValue = "PYTHON",
                description = "Source language of the input (default: ${DEFAULT-VALUE}).")
        String language = "PYTHON";

        CodeGaugeSettings loadSettings() throws IOException {
            var file = configFile != null ? configFile : Path.of(CodeGaugeSettings.FILE_NAME);
            if (configFile != null && !Files.exists(configFile)) {
                throw new IOException("Settings file not found: " + configFile);
            }
            return CodeGaugeSettings.load(file);
        }

        MetricsLanguage resolveLanguage() {
            return Languages.valueOf(language)
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + language));
        }

        TreeSitterMetricsAnalyzer createAnalyzer(CodeGaugeSettings settings) {
            return new TreeSitterMetricsAnalyzer(new AnalyzerConfig(resolveLanguage(), settings.debtHoursPerPoint()));
        }
    }

    @CommandLine.Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze a single file.")
    static final class Analyze implements Callable<Integer> {
        @CommandLine.Spec
        @SuppressWarnings("NullAway.Init")
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common = new CommonOptions();

        @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Source file to analyze.")
        @SuppressWarnings("NullAway.Init")
        Path file;

        @Override
        public Integer call() {
            var out = spec.commandLine().getOut();
            var err = spec.commandLine().getErr();
            try {
                var settings = common.loadSettings();
                var analyzer = common.createAnalyzer(settings);
                var abs = file.toAbsolutePath().normalize();
                SourceFile source = () -> abs;
                if (!analyzer.supports(source)) {
                    var language = analyzer.getConfig().language();
                    logger.warn("{} does not look like a {} file; analyzing anyway", file, language.name());
                }
                var result = analyzer.analyze(source.read());
                out.println(MAPPER.writeValueAsString(result));
                out.flush();
                return 0;
            } catch (IOException e) {
                logger.error("Failed to analyze {}", file, e);
                err.println("Cannot read " + file + ": " + e.getMessage());
                return EXIT_IO_ERROR;
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return CommandLine.ExitCode.USAGE;
            }
        }
    }

    @CommandLine.Command(name = "scan", mixinStandardHelpOptions = true, description = "Scan a directory tree.")
    static final class Scan implements Callable<Integer> {
        @CommandLine.Spec
        @SuppressWarnings("NullAway.Init")
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Mixin
        CommonOptions common = new CommonOptions();

        @CommandLine.Parameters(index = "0", paramLabel = "DIR", description = "Root directory to scan.")
        @SuppressWarnings("NullAway.Init")
        Path root;

        @CommandLine.Option(names = "--threads", description = "Worker threads (default: from settings).")
        @Nullable
        Integer threads;

        @Override
        public Integer call() {
            var out = spec.commandLine().getOut();
            var err = spec.commandLine().getErr();
            try {
                var settings = common.loadSettings();
                if (threads != null) {
                    settings = settings.withThreads(threads);
                }
                var scanner = new ProjectScanner(common.createAnalyzer(settings), settings);
                var report = scanner.scan(root);
                out.println(MAPPER.writeValueAsString(report));
                out.flush();
                return 0;
            } catch (IOException | ScanException e) {
                logger.error("Failed to scan {}", root, e);
                err.println("Cannot scan " + root + ": " + e.getMessage());
                return EXIT_IO_ERROR;
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return CommandLine.ExitCode.USAGE;
            }
        }
    }
}

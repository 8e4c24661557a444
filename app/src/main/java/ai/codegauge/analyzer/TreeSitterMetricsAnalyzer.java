package ai.codegauge.analyzer;

import ai.codegauge.util.MetricRounding;
import ai.codegauge.util.TextCanonicalizer;
import com.google.common.base.CharMatcher;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tree-sitter backed {@link MetricsAnalyzer}.
 *
 * <p>Each call parses the text exactly once and runs every walker over that same tree; walkers share no state with one
 * another or with other calls. The instance itself only holds immutable configuration and a {@link TreeBuilder} with
 * per-thread parsers, so it may be used from many threads at once.
 */
public final class TreeSitterMetricsAnalyzer implements MetricsAnalyzer {
    private static final Logger logger = LogManager.getLogger(TreeSitterMetricsAnalyzer.class);

    private final AnalyzerConfig config;
    private final TreeBuilder treeBuilder;
    private final MetricsSyntaxProfile profile;
    private final CognitiveComplexityWalker cognitiveWalker;
    private final HalsteadWalker halsteadWalker;
    private final LineScanner lineScanner;
    private final DocstringExtractor docstringExtractor;
    private final MaintainabilityComposer maintainabilityComposer;

    public TreeSitterMetricsAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.treeBuilder = new TreeBuilder(config.language());
        this.profile = config.language().getSyntaxProfile();
        this.cognitiveWalker = new CognitiveComplexityWalker(profile);
        this.halsteadWalker = new HalsteadWalker(profile);
        this.lineScanner = new LineScanner(profile.lineCommentPrefix());
        this.docstringExtractor = new DocstringExtractor(profile);
        this.maintainabilityComposer = new MaintainabilityComposer(config.debtHoursPerPoint());
    }

    public TreeSitterMetricsAnalyzer(MetricsLanguage language) {
        this(AnalyzerConfig.defaults(language));
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    @Override
    public Set<String> getExtensions() {
        return Set.copyOf(config.language().getExtensions());
    }

    @Override
    public AnalysisResult analyze(String source) {
        var text = TextCanonicalizer.stripUtf8Bom(source);
        // Unicode whitespace (NBSP, NEL, ...) counts as blank too
        if (CharMatcher.whitespace().matchesAllOf(text)) {
            return AnalysisResult.EMPTY;
        }

        long start = System.nanoTime();
        var parsed = treeBuilder.parse(text);
        var root = parsed.root();

        var stats = TreeStatistics.collect(root, profile);
        int cognitiveComplexity = cognitiveWalker.compute(root);
        double halsteadVolume = halsteadWalker.compute(parsed).volume();
        int linesOfCode = lineScanner.countLinesOfCode(text);
        double maintainabilityIndex =
                MaintainabilityComposer.maintainabilityIndex(halsteadVolume, stats.controlFlowCount(), linesOfCode);
        double debtHours = maintainabilityComposer.sqaleDebtHours(cognitiveComplexity);
        var description = docstringExtractor.extract(parsed).orElse(null);

        if (root.hasError()) {
            logger.debug("Source contains syntax errors; metrics are computed over the recovered tree");
        }
        logger.trace("Analyzed {} nodes in {} us", stats.nodeCount(), (System.nanoTime() - start) / 1_000);

        return new AnalysisResult(
                stats.nodeCount(),
                stats.controlFlowCount(),
                cognitiveComplexity,
                MetricRounding.round2(halsteadVolume),
                maintainabilityIndex,
                debtHours,
                linesOfCode,
                description);
    }
}

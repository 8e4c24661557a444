package ai.codegauge.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSParser;

/**
 * Turns source text into a tree-sitter syntax tree.
 *
 * <p>Native parsers are not reentrant, so each thread gets its own {@link TSParser}; a single builder can be shared by
 * any number of worker threads. Grammars are error tolerant: malformed input yields a tree containing ERROR nodes,
 * never an exception.
 */
public final class TreeBuilder {
    private static final Logger logger = LogManager.getLogger(TreeBuilder.class);

    private final MetricsLanguage language;
    private final ThreadLocal<TSParser> threadLocalParser;

    public TreeBuilder(MetricsLanguage language) {
        this.language = language;
        this.threadLocalParser = ThreadLocal.withInitial(() -> {
            var parser = new TSParser();
            if (!parser.setLanguage(language.createTSLanguage())) {
                logger.error("Failed to set language on TSParser for {}", language.name());
                throw new IllegalStateException("Incompatible tree-sitter grammar for " + language.name());
            }
            return parser;
        });
    }

    ParsedSource parse(String source) {
        long start = System.nanoTime();
        var tree = threadLocalParser.get().parseString(null, source);
        if (logger.isTraceEnabled()) {
            logger.trace(
                    "Parsed {} chars of {} in {} us",
                    source.length(),
                    language.name(),
                    (System.nanoTime() - start) / 1_000);
        }
        return new ParsedSource(tree, source);
    }
}

package ai.codegauge.analyzer;

import java.util.List;
import java.util.Optional;
import org.treesitter.TSNode;

/**
 * Extracts the module summary: the string literal forming the first top-level statement.
 *
 * <p>Comments before it are skipped. Any other first statement, or an expression statement that is not a lone string
 * literal, means the module has no summary; later statements are never considered.
 */
final class DocstringExtractor {
    // Longest delimiters first: stripping '"' off '"""x"""' would leave '""x""'
    private static final List<String> QUOTE_DELIMITERS = List.of("\"\"\"", "'''", "\"", "'");

    private final MetricsSyntaxProfile profile;

    DocstringExtractor(MetricsSyntaxProfile profile) {
        this.profile = profile;
    }

    Optional<String> extract(ParsedSource parsed) {
        var root = parsed.root();
        for (int i = 0; i < root.getNamedChildCount(); i++) {
            var statement = root.getNamedChild(i);
            if (statement == null || statement.isNull()) {
                continue;
            }
            if (profile.commentKind().equals(statement.getType())) {
                continue;
            }
            if (!profile.expressionStatementKind().equals(statement.getType())) {
                return Optional.empty();
            }
            return loneStringLiteral(statement).map(literal -> stripQuotes(parsed.textOf(literal)));
        }
        return Optional.empty();
    }

    private Optional<TSNode> loneStringLiteral(TSNode statement) {
        TSNode literal = null;
        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            var child = statement.getNamedChild(i);
            if (child == null || child.isNull() || profile.commentKind().equals(child.getType())) {
                continue;
            }
            if (literal != null || !profile.stringKind().equals(child.getType())) {
                return Optional.empty();
            }
            literal = child;
        }
        return Optional.ofNullable(literal);
    }

    static String stripQuotes(String text) {
        for (var delimiter : QUOTE_DELIMITERS) {
            if (text.length() >= 2 * delimiter.length() && text.startsWith(delimiter) && text.endsWith(delimiter)) {
                return text.substring(delimiter.length(), text.length() - delimiter.length()).strip();
            }
        }
        return text.strip();
    }
}

package ai.codegauge.analyzer.python;

import static ai.codegauge.analyzer.python.PythonTreeSitterNodeTypes.*;

import ai.codegauge.analyzer.MetricsLanguage;
import ai.codegauge.analyzer.MetricsSyntaxProfile;
import java.util.List;
import java.util.Set;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterPython;

public final class PythonLanguage implements MetricsLanguage {
    private static final List<String> EXTENSIONS = List.of("py");

    // Keywords that count as Halstead operators when they show up as leaf tokens
    private static final Set<String> OPERATOR_KEYWORDS = Set.of(
            "if", "else", "elif", "for", "while", "try", "except", "finally", "with", "return", "yield", "raise",
            "break", "continue", "pass", "import", "from", "as", "def", "class", "lambda", "and", "or", "not", "in",
            "is", "await", "async", "match", "case");

    private static final MetricsSyntaxProfile PY_SYNTAX_PROFILE = new MetricsSyntaxProfile(
            Set.of(
                    IF_STATEMENT,
                    FOR_STATEMENT,
                    WHILE_STATEMENT,
                    TRY_STATEMENT,
                    EXCEPT_CLAUSE,
                    WITH_STATEMENT,
                    MATCH_STATEMENT,
                    ELSE_CLAUSE, // counted at the depth of the statement it belongs to
                    ELIF_CLAUSE),
            Set.of(
                    BINARY_OPERATOR,
                    UNARY_OPERATOR,
                    COMPARISON_OPERATOR,
                    BOOLEAN_OPERATOR,
                    AUGMENTED_ASSIGNMENT,
                    ASSIGNMENT,
                    NOT_OPERATOR),
            OPERATOR_KEYWORDS,
            Set.of(IDENTIFIER, INTEGER, FLOAT, STRING, TRUE, FALSE, NONE),
            Set.of(FUNCTION_DEFINITION, CLASS_DEFINITION, MODULE),
            BLOCK,
            "#",
            COMMENT,
            EXPRESSION_STATEMENT,
            STRING);

    @Override
    public List<String> getExtensions() {
        return EXTENSIONS;
    }

    @Override
    public String name() {
        return "Python";
    }

    @Override
    public String internalName() {
        return "PYTHON";
    }

    @Override
    public String toString() {
        return name();
    }

    @Override
    public TSLanguage createTSLanguage() {
        return new TreeSitterPython();
    }

    @Override
    public MetricsSyntaxProfile getSyntaxProfile() {
        return PY_SYNTAX_PROFILE;
    }
}

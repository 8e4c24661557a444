package ai.codegauge.analyzer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.treesitter.TSNode;

/**
 * Collects Halstead operators and operands in one pre-order pass.
 *
 * <p>Operators are keyed by node kind, or by keyword text for anonymous keyword tokens. Operands are keyed by their
 * source text, so two occurrences of {@code x} are one distinct operand while {@code x} and {@code y} are two.
 */
final class HalsteadWalker {
    private final MetricsSyntaxProfile profile;

    HalsteadWalker(MetricsSyntaxProfile profile) {
        this.profile = profile;
    }

    HalsteadMetrics compute(ParsedSource parsed) {
        var root = parsed.root();
        if (root.isNull()) {
            return HalsteadMetrics.EMPTY;
        }
        var tokens = new Tokens();
        walk(root, parsed, tokens);

        return new HalsteadMetrics(
                tokens.operators.size(),
                tokens.operands.size(),
                new HashSet<>(tokens.operators).size(),
                new HashSet<>(tokens.operands).size());
    }

    private void walk(TSNode node, ParsedSource parsed, Tokens tokens) {
        switch (profile.classify(node)) {
            case OPERATOR, OPERATOR_KEYWORD -> tokens.operators.add(node.getType());
            case OPERAND -> {
                var text = parsed.textOf(node);
                tokens.operands.add(text.isEmpty() ? node.getType() : text);
            }
            default -> {}
        }

        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (child != null && !child.isNull()) {
                walk(child, parsed, tokens);
            }
        }
    }

    /** Accumulator owned by a single {@link #compute} call. */
    private static final class Tokens {
        final List<String> operators = new ArrayList<>();
        final List<String> operands = new ArrayList<>();
    }
}

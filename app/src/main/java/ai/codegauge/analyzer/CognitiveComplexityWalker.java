package ai.codegauge.analyzer;

import org.treesitter.TSNode;

/**
 * Cognitive complexity: every control-flow node adds {@code 1 + nesting depth}.
 *
 * <p>Depth grows by one when descending into a statement body. The body of a function, class or module instead starts
 * again at depth 0, even when the definition itself sits inside a conditional or loop. Alternate branches (else, elif,
 * except) are children of their statement rather than of its body and are therefore counted at the statement's own
 * depth.
 *
 * <p>Depth is passed down the call and each call returns the subtotal of its subtree, so sibling subtrees never observe
 * each other's nesting.
 */
final class CognitiveComplexityWalker {
    private final MetricsSyntaxProfile profile;

    CognitiveComplexityWalker(MetricsSyntaxProfile profile) {
        this.profile = profile;
    }

    int compute(TSNode root) {
        if (root.isNull()) {
            return 0;
        }
        return walk(root, profile.classify(root), 0);
    }

    private int walk(TSNode node, NodeRole role, int nestingDepth) {
        int complexity = role == NodeRole.CONTROL_FLOW ? 1 + nestingDepth : 0;

        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            var childRole = profile.classify(child);
            int childDepth = nestingDepth;
            if (childRole == NodeRole.BODY) {
                childDepth = role == NodeRole.ENCAPSULATION ? 0 : nestingDepth + 1;
            }
            complexity += walk(child, childRole, childDepth);
        }
        return complexity;
    }
}

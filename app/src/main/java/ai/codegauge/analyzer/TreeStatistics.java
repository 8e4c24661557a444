package ai.codegauge.analyzer;

import org.treesitter.TSNode;
import org.treesitter.TSTreeCursor;

/**
 * Node count and cyclomatic proxy (number of control-flow nodes), gathered in one cursor pass over every node, named
 * and anonymous, ERROR nodes included.
 */
record TreeStatistics(int nodeCount, int controlFlowCount) {

    static TreeStatistics collect(TSNode root, MetricsSyntaxProfile profile) {
        var cursor = new TSTreeCursor(root);
        int nodeCount = 0;
        int controlFlowCount = 0;

        while (true) {
            nodeCount++;
            if (profile.classify(cursor.currentNode()) == NodeRole.CONTROL_FLOW) {
                controlFlowCount++;
            }

            if (cursor.gotoFirstChild() || cursor.gotoNextSibling()) {
                continue;
            }

            // climb until an ancestor has an unvisited sibling; the cursor cannot leave the root
            boolean advanced = false;
            while (cursor.gotoParent()) {
                if (cursor.gotoNextSibling()) {
                    advanced = true;
                    break;
                }
            }
            if (!advanced) {
                return new TreeStatistics(nodeCount, controlFlowCount);
            }
        }
    }
}

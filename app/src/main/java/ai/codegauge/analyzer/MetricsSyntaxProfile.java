package ai.codegauge.analyzer;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.treesitter.TSNode;

/**
 * Language specific node tables used by the metric walkers.
 *
 * <p>Named node kinds are mapped to a {@link NodeRole} once, at construction; overlapping tables are rejected so that a
 * kind can never play two roles. Anonymous leaf tokens are only ever {@link NodeRole#OPERATOR_KEYWORD} or
 * {@link NodeRole#OTHER}.
 */
public final class MetricsSyntaxProfile {
    private final Set<String> operatorKeywords;
    private final String lineCommentPrefix;
    private final String commentKind;
    private final String expressionStatementKind;
    private final String stringKind;
    private final Map<String, NodeRole> rolesByKind;

    /**
     * @param controlFlowKinds kinds that add to both cyclomatic and cognitive complexity
     * @param operatorKinds expression kinds counted as Halstead operators
     * @param operatorKeywords keyword tokens counted as Halstead operators when they appear as anonymous leaves
     * @param operandKinds identifier and literal kinds counted as Halstead operands, keyed by their text
     * @param encapsulationKinds kinds whose body does not add nesting
     * @param bodyKind kind of an indented/braced statement body
     * @param lineCommentPrefix single-line comment marker
     * @param commentKind kind of a comment node
     * @param expressionStatementKind kind of a bare expression statement
     * @param stringKind kind of a string literal
     */
    public MetricsSyntaxProfile(
            Set<String> controlFlowKinds,
            Set<String> operatorKinds,
            Set<String> operatorKeywords,
            Set<String> operandKinds,
            Set<String> encapsulationKinds,
            String bodyKind,
            String lineCommentPrefix,
            String commentKind,
            String expressionStatementKind,
            String stringKind) {
        if (lineCommentPrefix.isEmpty()) {
            throw new IllegalArgumentException("lineCommentPrefix must not be empty");
        }
        this.operatorKeywords = Set.copyOf(operatorKeywords);
        this.lineCommentPrefix = lineCommentPrefix;
        this.commentKind = commentKind;
        this.expressionStatementKind = expressionStatementKind;
        this.stringKind = stringKind;

        var tables = new EnumMap<NodeRole, Set<String>>(NodeRole.class);
        tables.put(NodeRole.CONTROL_FLOW, controlFlowKinds);
        tables.put(NodeRole.OPERATOR, operatorKinds);
        tables.put(NodeRole.OPERAND, operandKinds);
        tables.put(NodeRole.ENCAPSULATION, encapsulationKinds);
        tables.put(NodeRole.BODY, Set.of(bodyKind));

        var roles = new HashMap<String, NodeRole>();
        tables.forEach((role, kinds) -> {
            for (var kind : kinds) {
                var previous = roles.put(kind, role);
                if (previous != null) {
                    throw new IllegalArgumentException(
                            "Node kind '%s' is both %s and %s".formatted(kind, previous, role));
                }
            }
        });
        this.rolesByKind = Map.copyOf(roles);
    }

    /** Resolves the role of a node kind. Anonymous tokens only ever match the keyword table. */
    public NodeRole classify(String kind, boolean named) {
        if (!named) {
            return operatorKeywords.contains(kind) ? NodeRole.OPERATOR_KEYWORD : NodeRole.OTHER;
        }
        return rolesByKind.getOrDefault(kind, NodeRole.OTHER);
    }

    public NodeRole classify(TSNode node) {
        return classify(node.getType(), node.isNamed());
    }

    public String lineCommentPrefix() {
        return lineCommentPrefix;
    }

    public String commentKind() {
        return commentKind;
    }

    public String expressionStatementKind() {
        return expressionStatementKind;
    }

    public String stringKind() {
        return stringKind;
    }
}

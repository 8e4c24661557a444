package ai.codegauge.analyzer;

/**
 * Semantic role of a syntax tree node as far as the metric walkers are concerned. Every node kind resolves to exactly
 * one role through {@link MetricsSyntaxProfile#classify(String, boolean)}.
 */
public enum NodeRole {
    /** Conditional, loop, exception handling, context management, pattern match and their alternate branches. */
    CONTROL_FLOW,
    /** Binary, unary, comparison, boolean and assignment expressions. */
    OPERATOR,
    /** Reserved keyword appearing as an anonymous leaf token. */
    OPERATOR_KEYWORD,
    /** Identifier or literal. */
    OPERAND,
    /** Function, type or module: nesting resets inside its body. */
    ENCAPSULATION,
    /** Indented or braced statement body. */
    BODY,
    OTHER
}

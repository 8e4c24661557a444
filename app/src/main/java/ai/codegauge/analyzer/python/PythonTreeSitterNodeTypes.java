package ai.codegauge.analyzer.python;

/** Constants for Python TreeSitter node type names. */
public final class PythonTreeSitterNodeTypes {

    // ===== ENCAPSULATION =====
    public static final String MODULE = "module";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String FUNCTION_DEFINITION = "function_definition";

    // Indented statement body
    public static final String BLOCK = "block";

    // ===== CONTROL FLOW =====
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELIF_CLAUSE = "elif_clause";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String MATCH_STATEMENT = "match_statement";

    // ===== OPERATORS =====
    public static final String BINARY_OPERATOR = "binary_operator";
    public static final String UNARY_OPERATOR = "unary_operator";
    public static final String COMPARISON_OPERATOR = "comparison_operator";
    public static final String BOOLEAN_OPERATOR = "boolean_operator";
    public static final String NOT_OPERATOR = "not_operator";
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";

    // ===== OPERANDS =====
    public static final String IDENTIFIER = "identifier";
    public static final String INTEGER = "integer";
    public static final String FLOAT = "float";
    public static final String STRING = "string";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NONE = "none";

    // Statements
    public static final String EXPRESSION_STATEMENT = "expression_statement";

    // Extras
    public static final String COMMENT = "comment";

    private PythonTreeSitterNodeTypes() {}
}

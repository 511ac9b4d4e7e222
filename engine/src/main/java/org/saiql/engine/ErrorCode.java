package org.saiql.engine;

/**
 * Machine-checkable reason codes carried by every compilation failure.
 *
 * <p>Each code belongs to the stage that raises it, so callers can tell a
 * malformed query apart from a schema problem or a backend limitation
 * without parsing messages.
 */
public enum ErrorCode {
    // Lexer
    LEX_ERROR(Stage.LEXER),

    // Parser
    SYNTAX_ERROR(Stage.PARSER),

    // Validator / IR builder
    UNKNOWN_TABLE(Stage.VALIDATOR),
    UNKNOWN_COLUMN(Stage.VALIDATOR),
    UNKNOWN_FUNCTION(Stage.VALIDATOR),
    AMBIGUOUS_COLUMN(Stage.VALIDATOR),
    DUPLICATE_ALIAS(Stage.VALIDATOR),
    COLUMN_COUNT_MISMATCH(Stage.VALIDATOR),
    TYPE_MISMATCH(Stage.VALIDATOR),
    MISSING_JOIN_CONDITION(Stage.VALIDATOR),
    MISSING_ORDER_KEY(Stage.VALIDATOR),
    INVALID_AGGREGATE(Stage.VALIDATOR),
    FIREWALL_REJECTED(Stage.VALIDATOR),
    UNSUPPORTED_QUERY_SHAPE(Stage.VALIDATOR),

    // Type registry / code generator
    UNSUPPORTED_TYPE(Stage.CODEGEN),
    UNSUPPORTED_FEATURE(Stage.CODEGEN),

    // Migration planner
    MIGRATION_ERROR(Stage.MIGRATION);

    /**
     * The pipeline stage that reports a code.
     */
    public enum Stage {
        LEXER, PARSER, VALIDATOR, OPTIMIZER, CODEGEN, MIGRATION
    }

    private final Stage stage;

    ErrorCode(Stage stage) {
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}

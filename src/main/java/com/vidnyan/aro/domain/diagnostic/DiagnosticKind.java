package com.vidnyan.aro.domain.diagnostic;

/**
 * Classification of every finding the pipeline can report.
 */
public enum DiagnosticKind {

    // Lexical, fatal to the compile
    UNTERMINATED_STRING(Stage.LEXER, Severity.ERROR),
    INVALID_ESCAPE_SEQUENCE(Stage.LEXER, Severity.ERROR),
    INVALID_UNICODE_SCALAR(Stage.LEXER, Severity.ERROR),
    INVALID_NUMBER(Stage.LEXER, Severity.ERROR),
    UNEXPECTED_CHARACTER(Stage.LEXER, Severity.ERROR),

    // Syntax, recovered per statement or feature set
    UNEXPECTED_TOKEN(Stage.PARSER, Severity.ERROR),
    UNEXPECTED_END_OF_FILE(Stage.PARSER, Severity.ERROR),
    MISSING_FEATURE_SET_NAME(Stage.PARSER, Severity.ERROR),
    MISSING_BUSINESS_ACTIVITY(Stage.PARSER, Severity.ERROR),
    INVALID_STATEMENT(Stage.PARSER, Severity.ERROR),
    INVALID_QUALIFIED_NOUN(Stage.PARSER, Severity.ERROR),
    EMPTY_FEATURE_SET(Stage.PARSER, Severity.ERROR),

    // Semantic errors
    UNDEFINED_VARIABLE(Stage.ANALYZER, Severity.ERROR),
    DUPLICATE_FEATURE_SET(Stage.ANALYZER, Severity.ERROR),
    CANNOT_REBIND_VARIABLE(Stage.ANALYZER, Severity.ERROR),
    CIRCULAR_EVENT_CHAIN(Stage.ANALYZER, Severity.ERROR),
    CHECK_FAILURE(Stage.ANALYZER, Severity.ERROR),

    // Semantic warnings
    UNUSED_VARIABLE(Stage.ANALYZER, Severity.WARNING),
    UNREACHABLE_CODE(Stage.ANALYZER, Severity.WARNING),
    MISSING_TERMINAL_RETURN(Stage.ANALYZER, Severity.WARNING),
    ORPHANED_EVENT(Stage.ANALYZER, Severity.WARNING),
    USED_BEFORE_DEFINITION(Stage.ANALYZER, Severity.WARNING),
    UNPUBLISHED_DEPENDENCY(Stage.ANALYZER, Severity.WARNING);

    public enum Stage {
        LEXER,
        PARSER,
        ANALYZER
    }

    private final Stage stage;
    private final Severity defaultSeverity;

    DiagnosticKind(Stage stage, Severity defaultSeverity) {
        this.stage = stage;
        this.defaultSeverity = defaultSeverity;
    }

    public Stage stage() {
        return stage;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}

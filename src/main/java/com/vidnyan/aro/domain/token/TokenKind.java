package com.vidnyan.aro.domain.token;

/**
 * Kinds of tokens produced by the lexer.
 */
public enum TokenKind {

    // Delimiters
    LEFT_PAREN(Category.DELIMITER),
    RIGHT_PAREN(Category.DELIMITER),
    LEFT_BRACE(Category.DELIMITER),
    RIGHT_BRACE(Category.DELIMITER),
    LEFT_BRACKET(Category.DELIMITER),
    RIGHT_BRACKET(Category.DELIMITER),
    LEFT_ANGLE(Category.DELIMITER),
    RIGHT_ANGLE(Category.DELIMITER),
    COLON(Category.DELIMITER),
    DOUBLE_COLON(Category.DELIMITER),
    DOT(Category.DELIMITER),
    COMMA(Category.DELIMITER),
    SEMICOLON(Category.DELIMITER),
    AT_SIGN(Category.DELIMITER),
    QUESTION(Category.DELIMITER),

    // Operators
    PLUS(Category.OPERATOR),
    MINUS(Category.OPERATOR),
    STAR(Category.OPERATOR),
    SLASH(Category.OPERATOR),
    PERCENT(Category.OPERATOR),
    PLUS_PLUS(Category.OPERATOR),
    EQUALS(Category.OPERATOR),
    EQUAL_EQUAL(Category.OPERATOR),
    NOT_EQUAL(Category.OPERATOR),
    LESS_EQUAL(Category.OPERATOR),
    GREATER_EQUAL(Category.OPERATOR),
    ARROW(Category.OPERATOR),
    FAT_ARROW(Category.OPERATOR),

    // Words
    KEYWORD(Category.KEYWORD),
    ARTICLE(Category.ARTICLE),
    PREPOSITION(Category.PREPOSITION),
    IDENTIFIER(Category.IDENTIFIER),

    // Literals
    STRING_LITERAL(Category.LITERAL),
    STRING_SEGMENT(Category.LITERAL),
    INTERPOLATION_START(Category.LITERAL),
    INTERPOLATION_END(Category.LITERAL),
    INTEGER_LITERAL(Category.LITERAL),
    FLOAT_LITERAL(Category.LITERAL),
    BOOLEAN_LITERAL(Category.LITERAL),
    NULL_LITERAL(Category.LITERAL),
    REGEX_LITERAL(Category.LITERAL),

    EOF(Category.END);

    public enum Category {
        DELIMITER,
        OPERATOR,
        KEYWORD,
        ARTICLE,
        PREPOSITION,
        IDENTIFIER,
        LITERAL,
        END
    }

    private final Category category;

    TokenKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }
}

package com.vidnyan.aro.domain.token;

import com.vidnyan.aro.domain.model.SourceSpan;

/**
 * A lexical token.
 * The lexeme is the exact source slice the token was read from; the value carries the
 * decoded payload (keyword, string contents, number, regex).
 */
public record Token(
    TokenKind kind,
    String lexeme,
    SourceSpan span,
    Object value
) {

    /**
     * Decoded regex literal.
     */
    public record RegexValue(String pattern, String flags) {}

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean is(Keyword keyword) {
        return kind == TokenKind.KEYWORD && value == keyword;
    }

    public boolean is(Preposition preposition) {
        return kind == TokenKind.PREPOSITION && value == preposition;
    }

    public Keyword keyword() {
        return kind == TokenKind.KEYWORD ? (Keyword) value : null;
    }

    public Article article() {
        return kind == TokenKind.ARTICLE ? (Article) value : null;
    }

    public Preposition preposition() {
        return kind == TokenKind.PREPOSITION ? (Preposition) value : null;
    }

    /**
     * Decoded contents of a string literal or segment.
     */
    public String text() {
        return value instanceof String s ? s : lexeme;
    }

    /**
     * True for tokens that may name something: identifiers and all reserved words.
     */
    public boolean isWord() {
        return switch (kind) {
            case IDENTIFIER, KEYWORD, ARTICLE, PREPOSITION, BOOLEAN_LITERAL, NULL_LITERAL -> true;
            default -> false;
        };
    }

    /**
     * Readable form for error messages.
     */
    public String describe() {
        return switch (kind) {
            case EOF -> "end of file";
            case STRING_LITERAL -> "string \"" + text() + "\"";
            case IDENTIFIER -> "identifier '" + lexeme + "'";
            case KEYWORD -> "keyword '" + lexeme + "'";
            default -> "'" + lexeme + "'";
        };
    }

    @Override
    public String toString() {
        return kind + "(" + lexeme + ")@" + span.start().format();
    }
}

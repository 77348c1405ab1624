package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.ast.QualifiedNoun;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.token.Token;
import com.vidnyan.aro.domain.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Names: hyphenated compounds, multi-word labels and qualified nouns.
 */
final class NounParser {

    private final TokenCursor cursor;

    NounParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * {@code base (":" specifier (("." | " ") specifier)*)?}, without the angle brackets.
     */
    QualifiedNoun parseQualifiedNoun() {
        Token start = cursor.peek();
        if (!start.isWord()) {
            throw new ParseException(DiagnosticKind.INVALID_QUALIFIED_NOUN,
                    "Invalid qualified noun: expected a name, but got " + start.describe(),
                    start.span().start());
        }
        String base = parseCompoundIdentifier();
        List<String> specifiers = new ArrayList<>();
        if (cursor.match(TokenKind.COLON)) {
            if (!isSpecifierStart(cursor.peek())) {
                throw new ParseException(DiagnosticKind.INVALID_QUALIFIED_NOUN,
                        "Invalid qualified noun '" + base + "': expected a specifier after ':'",
                        cursor.peek().span().start());
            }
            while (isSpecifierStart(cursor.peek())) {
                specifiers.add(parseSpecifier());
                if (cursor.match(TokenKind.DOT) && !isSpecifierStart(cursor.peek())) {
                    throw new ParseException(DiagnosticKind.INVALID_QUALIFIED_NOUN,
                            "Invalid qualified noun '" + base + "': expected a specifier after '.'",
                            cursor.peek().span().start());
                }
            }
        }
        return new QualifiedNoun(base, specifiers, start.span().merged(cursor.previous().span()));
    }

    /**
     * {@code word ("-" word)*}. Only hyphens glued to both neighbours join.
     */
    String parseCompoundIdentifier() {
        Token first = cursor.peek();
        if (!first.isWord()) {
            throw cursor.unexpected("identifier");
        }
        cursor.advance();
        StringBuilder name = new StringBuilder(first.lexeme());
        while (true) {
            Token previous = cursor.previous();
            Token next = cursor.peek();
            if (next.is(TokenKind.MINUS) && previous.span().touches(next.span())
                    && next.span().touches(cursor.peek(1).span())
                    && (cursor.peek(1).isWord() || cursor.peek(1).is(TokenKind.INTEGER_LITERAL))) {
                cursor.advance();
                name.append('-').append(cursor.advance().lexeme());
            } else if (isGluedNegativeNumber(previous, next)) {
                // "step-2" lexes as step, -2
                name.append(cursor.advance().lexeme());
            } else {
                return name.toString();
            }
        }
    }

    /**
     * Space separated compound identifiers joined with single spaces, e.g. {@code Application-Start Entry Point}.
     * Returns an empty string when no word is present.
     */
    String parseIdentifierSequence() {
        List<String> parts = new ArrayList<>();
        while (cursor.peek().isWord()) {
            parts.add(parseCompoundIdentifier());
        }
        return String.join(" ", parts);
    }

    private String parseSpecifier() {
        Token token = cursor.peek();
        if (token.is(TokenKind.INTEGER_LITERAL)) {
            cursor.advance();
            return token.lexeme();
        }
        return parseCompoundIdentifier();
    }

    private static boolean isSpecifierStart(Token token) {
        return token.isWord() || token.is(TokenKind.INTEGER_LITERAL);
    }

    private static boolean isGluedNegativeNumber(Token previous, Token next) {
        return next.is(TokenKind.INTEGER_LITERAL)
                && next.lexeme().startsWith("-")
                && previous.span().touches(next.span());
    }
}

package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.token.Keyword;
import com.vidnyan.aro.domain.token.Token;
import com.vidnyan.aro.domain.token.TokenKind;

import java.util.List;

/**
 * Position in a token list, shared by the statement and expression parsers.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private int current;

    TokenCursor(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
    }

    Token peek() {
        return tokens.get(current);
    }

    Token peek(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }

    int position() {
        return current;
    }

    boolean hasPrevious() {
        return current > 0;
    }

    Token advance() {
        Token token = peek();
        if (!isAtEnd()) {
            current++;
        }
        return token;
    }

    boolean isAtEnd() {
        return peek().kind() == TokenKind.EOF;
    }

    boolean check(TokenKind kind) {
        return peek().kind() == kind;
    }

    boolean check(Keyword keyword) {
        return peek().is(keyword);
    }

    boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    boolean match(Keyword keyword) {
        if (check(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    void skipArticle() {
        match(TokenKind.ARTICLE);
    }

    Token expect(TokenKind kind, String expected) {
        if (check(kind)) {
            return advance();
        }
        throw unexpected(expected);
    }

    Token expect(Keyword keyword) {
        if (check(keyword)) {
            return advance();
        }
        throw unexpected("'" + keyword.word() + "'");
    }

    /**
     * Error for the current token, phrased as {@code Expected X, but got Y}.
     */
    ParseException unexpected(String expected) {
        Token token = peek();
        DiagnosticKind kind = token.kind() == TokenKind.EOF
                ? DiagnosticKind.UNEXPECTED_END_OF_FILE
                : DiagnosticKind.UNEXPECTED_TOKEN;
        return new ParseException(kind, "Expected " + expected + ", but got " + token.describe(),
                token.span().start());
    }

    /**
     * A dot glued to the previous token and to a following word is member access, not a terminator.
     */
    boolean atMemberDot() {
        if (!check(TokenKind.DOT) || !hasPrevious()) {
            return false;
        }
        Token dot = peek();
        Token next = peek(1);
        return previous().span().touches(dot.span())
                && dot.span().touches(next.span())
                && next.isWord();
    }

    /**
     * True when the tokens at {@code offset} read {@code ( words :}, the start of a feature set.
     */
    boolean atFeatureSetHeader(int offset) {
        if (peek(offset).kind() != TokenKind.LEFT_PAREN) {
            return false;
        }
        int i = offset + 1;
        int words = 0;
        while (true) {
            Token token = peek(i);
            if (token.isWord() || token.kind() == TokenKind.INTEGER_LITERAL) {
                words++;
            } else if (token.kind() != TokenKind.MINUS) {
                break;
            }
            i++;
        }
        return words > 0 && peek(i).kind() == TokenKind.COLON;
    }
}

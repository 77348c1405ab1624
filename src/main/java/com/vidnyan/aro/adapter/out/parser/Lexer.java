package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.model.SourceLocation;
import com.vidnyan.aro.domain.model.SourceSpan;
import com.vidnyan.aro.domain.token.ReservedWords;
import com.vidnyan.aro.domain.token.Token;
import com.vidnyan.aro.domain.token.TokenKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Converts source text into tokens terminated by {@link TokenKind#EOF}.
 * <p>
 * Every token's lexeme is the exact slice of source it covers, so concatenating lexemes
 * reproduces the source without whitespace and comments. Interpolated strings are emitted as
 * {@code STRING_SEGMENT} tokens alternating with token runs wrapped in
 * {@code INTERPOLATION_START}/{@code INTERPOLATION_END}. The first segment includes the opening
 * quote and the last one the closing quote.
 * <p>
 * One instance per source; not reusable.
 */
public final class Lexer {

    private static final String REGEX_FLAGS = "ismg";

    // A slash after one of these is division, never the start of a regex.
    private static final Set<TokenKind> OPERAND_END = EnumSet.of(
            TokenKind.IDENTIFIER, TokenKind.DOT, TokenKind.RIGHT_ANGLE, TokenKind.RIGHT_PAREN,
            TokenKind.RIGHT_BRACKET, TokenKind.INTEGER_LITERAL, TokenKind.FLOAT_LITERAL,
            TokenKind.STRING_LITERAL, TokenKind.BOOLEAN_LITERAL, TokenKind.NULL_LITERAL);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int column = 1;

    private int tokenStart;
    private SourceLocation tokenStartLocation;

    public Lexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /**
     * Tokenize the whole source.
     *
     * @throws LexerException on the first lexical error
     */
    public List<Token> tokenize() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            scanToken();
        }
        SourceLocation end = location();
        tokens.add(new Token(TokenKind.EOF, "", SourceSpan.at(end), null));
        return List.copyOf(tokens);
    }

    // --- Dispatch ---

    private void scanToken() {
        beginToken();
        char c = advance();
        switch (c) {
            case '(' -> add(TokenKind.LEFT_PAREN);
            case ')' -> add(TokenKind.RIGHT_PAREN);
            case '{' -> add(TokenKind.LEFT_BRACE);
            case '}' -> add(TokenKind.RIGHT_BRACE);
            case '[' -> add(TokenKind.LEFT_BRACKET);
            case ']' -> add(TokenKind.RIGHT_BRACKET);
            case ',' -> add(TokenKind.COMMA);
            case ';' -> add(TokenKind.SEMICOLON);
            case '@' -> add(TokenKind.AT_SIGN);
            case '?' -> add(TokenKind.QUESTION);
            case '*' -> add(TokenKind.STAR);
            case '%' -> add(TokenKind.PERCENT);
            case '.' -> add(TokenKind.DOT);
            case ':' -> add(match(':') ? TokenKind.DOUBLE_COLON : TokenKind.COLON);
            case '<' -> add(match('=') ? TokenKind.LESS_EQUAL : TokenKind.LEFT_ANGLE);
            case '>' -> add(match('=') ? TokenKind.GREATER_EQUAL : TokenKind.RIGHT_ANGLE);
            case '+' -> add(match('+') ? TokenKind.PLUS_PLUS : TokenKind.PLUS);
            case '-' -> {
                if (match('>')) {
                    add(TokenKind.ARROW);
                } else if (isDigit(peek())) {
                    advance();
                    scanNumber(true);
                } else {
                    add(TokenKind.MINUS);
                }
            }
            case '=' -> {
                if (match('=')) {
                    add(TokenKind.EQUAL_EQUAL);
                } else if (match('>')) {
                    add(TokenKind.FAT_ARROW);
                } else {
                    add(TokenKind.EQUALS);
                }
            }
            case '!' -> {
                if (!match('=')) {
                    throw unexpectedCharacter(c);
                }
                add(TokenKind.NOT_EQUAL);
            }
            case '/' -> {
                if (!scanRegex()) {
                    add(TokenKind.SLASH);
                }
            }
            case '"' -> scanDoubleQuoted();
            case '\'' -> scanSingleQuoted();
            default -> {
                if (isDigit(c)) {
                    scanNumber(false);
                } else if (isIdentifierStart(c)) {
                    scanIdentifier();
                } else {
                    throw unexpectedCharacter(c);
                }
            }
        }
    }

    // --- Words ---

    private void scanIdentifier() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String lexeme = currentLexeme();
        ReservedWords.Entry reserved = ReservedWords.lookup(lexeme);
        if (reserved != null) {
            add(reserved.kind(), reserved.value());
        } else {
            add(TokenKind.IDENTIFIER, lexeme);
        }
    }

    // --- Numbers ---

    private void scanNumber(boolean negative) {
        String text = currentLexeme();
        char first = text.charAt(text.length() - 1); // leading digit, after any '-'
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            scanRadixInteger(16, negative);
            return;
        }
        if (first == '0' && (peek() == 'b' || peek() == 'B')) {
            advance();
            scanRadixInteger(2, negative);
            return;
        }

        boolean isFloat = false;
        consumeDigits(10);
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            consumeDigitGroup(10);
        }
        if ((peek() == 'e' || peek() == 'E') && exponentFollows()) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            consumeDigitGroup(10);
        }

        String digits = currentLexeme().replace("_", "");
        try {
            if (isFloat) {
                add(TokenKind.FLOAT_LITERAL, Double.parseDouble(digits));
            } else {
                add(TokenKind.INTEGER_LITERAL, Long.parseLong(digits));
            }
        } catch (NumberFormatException e) {
            throw invalidNumber();
        }
    }

    private void scanRadixInteger(int radix, boolean negative) {
        if (digitValue(peek(), radix) < 0) {
            throw invalidNumber();
        }
        consumeDigitGroup(radix);
        String lexeme = currentLexeme();
        String digits = lexeme.substring(negative ? 3 : 2).replace("_", "");
        try {
            long value = Long.parseLong(digits, radix);
            add(TokenKind.INTEGER_LITERAL, negative ? -value : value);
        } catch (NumberFormatException e) {
            throw invalidNumber();
        }
    }

    /**
     * Continue a digit run whose first digit was already consumed.
     */
    private void consumeDigits(int radix) {
        while (true) {
            if (digitValue(peek(), radix) >= 0) {
                advance();
            } else if (peek() == '_') {
                if (digitValue(peekNext(), radix) < 0) {
                    advance();
                    throw invalidNumber();
                }
                advance();
            } else {
                break;
            }
        }
        if (isIdentifierStart(peek()) && peek() != 'e' && peek() != 'E') {
            advance();
            throw invalidNumber();
        }
    }

    private void consumeDigitGroup(int radix) {
        if (digitValue(peek(), radix) < 0) {
            throw invalidNumber();
        }
        advance();
        consumeDigits(radix);
    }

    private boolean exponentFollows() {
        char next = peekNext();
        if (isDigit(next)) {
            return true;
        }
        return (next == '+' || next == '-') && pos + 2 < source.length() && isDigit(source.charAt(pos + 2));
    }

    private static int digitValue(char c, int radix) {
        if (c == '\0') {
            return -1;
        }
        return Character.digit(c, radix);
    }

    // --- Strings ---

    private void scanDoubleQuoted() {
        SourceLocation stringStart = tokenStartLocation;
        StringBuilder value = new StringBuilder();
        boolean interpolated = false;

        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw new LexerException(DiagnosticKind.UNTERMINATED_STRING,
                        "Unterminated string literal", stringStart);
            }
            char c = advance();
            if (c == '"') {
                add(interpolated ? TokenKind.STRING_SEGMENT : TokenKind.STRING_LITERAL, value.toString());
                return;
            }
            if (c == '\\') {
                value.append(readEscape());
            } else if (c == '$' && peek() == '{') {
                interpolated = true;
                // segment up to the '$'
                pos--;
                column--;
                add(TokenKind.STRING_SEGMENT, value.toString());
                value.setLength(0);
                scanInterpolation(stringStart);
                beginToken();
            } else {
                value.append(c);
            }
        }
    }

    private void scanInterpolation(SourceLocation stringStart) {
        beginToken();
        advance();
        advance();
        add(TokenKind.INTERPOLATION_START);

        int depth = 0;
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                throw new LexerException(DiagnosticKind.UNTERMINATED_STRING,
                        "Unterminated string literal", stringStart);
            }
            char c = peek();
            if (c == '}' && depth == 0) {
                beginToken();
                advance();
                add(TokenKind.INTERPOLATION_END);
                return;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
            scanToken();
        }
    }

    private String readEscape() {
        SourceLocation escapeStart = location(-1);
        if (isAtEnd()) {
            throw new LexerException(DiagnosticKind.UNTERMINATED_STRING,
                    "Unterminated string literal", tokenStartLocation);
        }
        char c = advance();
        return switch (c) {
            case 'n' -> "\n";
            case 'r' -> "\r";
            case 't' -> "\t";
            case '0' -> "\0";
            case '\\' -> "\\";
            case '"' -> "\"";
            case '\'' -> "'";
            case '$' -> "$";
            case 'u' -> readUnicodeEscape(escapeStart);
            default -> throw new LexerException(DiagnosticKind.INVALID_ESCAPE_SEQUENCE,
                    "Invalid escape sequence '\\" + c + "'", escapeStart);
        };
    }

    private String readUnicodeEscape(SourceLocation escapeStart) {
        if (!match('{')) {
            throw new LexerException(DiagnosticKind.INVALID_ESCAPE_SEQUENCE,
                    "Invalid escape sequence '\\u'", escapeStart);
        }
        StringBuilder hex = new StringBuilder();
        while (!isAtEnd() && peek() != '}' && peek() != '"' && peek() != '\n') {
            hex.append(advance());
        }
        if (!match('}')) {
            throw invalidUnicode(hex.toString(), escapeStart);
        }
        if (hex.length() == 0 || hex.length() > 8) {
            throw invalidUnicode(hex.toString(), escapeStart);
        }
        int codePoint;
        try {
            codePoint = Integer.parseInt(hex.toString(), 16);
        } catch (NumberFormatException e) {
            throw invalidUnicode(hex.toString(), escapeStart);
        }
        if (!Character.isValidCodePoint(codePoint) || (codePoint >= 0xD800 && codePoint <= 0xDFFF)) {
            throw invalidUnicode(hex.toString(), escapeStart);
        }
        return new String(Character.toChars(codePoint));
    }

    private void scanSingleQuoted() {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw new LexerException(DiagnosticKind.UNTERMINATED_STRING,
                        "Unterminated string literal", tokenStartLocation);
            }
            char c = advance();
            if (c == '\'') {
                add(TokenKind.STRING_LITERAL, value.toString());
                return;
            }
            if (c == '\\' && peek() == '\'') {
                value.append(advance());
            } else {
                value.append(c);
            }
        }
    }

    // --- Regex ---

    /**
     * Try to read {@code /pattern/flags}. Restores the position and returns false when the slash
     * is division.
     */
    private boolean scanRegex() {
        if (isAtEnd() || Character.isWhitespace(peek())) {
            return false;
        }
        if (!tokens.isEmpty() && OPERAND_END.contains(tokens.get(tokens.size() - 1).kind())) {
            return false;
        }
        int savedPos = pos;
        int savedColumn = column;
        StringBuilder pattern = new StringBuilder();
        while (!isAtEnd() && peek() != '/' && peek() != '\n') {
            char c = advance();
            pattern.append(c);
            if (c == '\\' && !isAtEnd() && peek() != '\n') {
                pattern.append(advance());
            }
        }
        if (peek() != '/' || pattern.length() == 0) {
            pos = savedPos;
            column = savedColumn;
            return false;
        }
        advance();
        StringBuilder flags = new StringBuilder();
        while (!isAtEnd() && REGEX_FLAGS.indexOf(peek()) >= 0) {
            flags.append(advance());
        }
        add(TokenKind.REGEX_LITERAL, new Token.RegexValue(pattern.toString(), flags.toString()));
        return true;
    }

    // --- Trivia ---

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '(' && peekNext() == '*') {
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == ')')) {
                    advance();
                }
                if (!isAtEnd()) {
                    advance();
                    advance();
                }
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    // --- Cursor ---

    private void beginToken() {
        tokenStart = pos;
        tokenStartLocation = location();
    }

    private void add(TokenKind kind) {
        add(kind, null);
    }

    private void add(TokenKind kind, Object value) {
        SourceSpan span = new SourceSpan(tokenStartLocation, location());
        tokens.add(new Token(kind, currentLexeme(), span, value));
    }

    private String currentLexeme() {
        return source.substring(tokenStart, pos);
    }

    private SourceLocation location() {
        return new SourceLocation(line, column, pos);
    }

    private SourceLocation location(int delta) {
        return new SourceLocation(line, column + delta, pos + delta);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private LexerException unexpectedCharacter(char c) {
        return new LexerException(DiagnosticKind.UNEXPECTED_CHARACTER,
                "Unexpected character '" + c + "'", tokenStartLocation);
    }

    private LexerException invalidNumber() {
        return new LexerException(DiagnosticKind.INVALID_NUMBER,
                "Invalid number literal '" + currentLexeme() + "'", tokenStartLocation);
    }

    private LexerException invalidUnicode(String hex, SourceLocation at) {
        return new LexerException(DiagnosticKind.INVALID_UNICODE_SCALAR,
                "Invalid unicode escape sequence '\\u{" + hex + "}'", at);
    }
}

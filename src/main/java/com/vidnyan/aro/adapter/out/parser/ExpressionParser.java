package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.ast.BinaryOperator;
import com.vidnyan.aro.domain.ast.Expression;
import com.vidnyan.aro.domain.ast.LiteralValue;
import com.vidnyan.aro.domain.ast.QualifiedNoun;
import com.vidnyan.aro.domain.ast.UnaryOperator;
import com.vidnyan.aro.domain.model.SourceLocation;
import com.vidnyan.aro.domain.model.SourceSpan;
import com.vidnyan.aro.domain.token.Keyword;
import com.vidnyan.aro.domain.token.Token;
import com.vidnyan.aro.domain.token.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing expression parser.
 * <p>
 * Binding from loosest to tightest: {@code or}, {@code and}, comparison
 * ({@code == != < <= > >= contains matches}), additive ({@code + - ++}),
 * multiplicative ({@code * / %}), prefix ({@code - not}), postfix
 * (member access, subscript, {@code exists}, {@code is Type}).
 * In operator position {@code <} and {@code >} compare; in operand position {@code <} opens a
 * variable reference.
 */
final class ExpressionParser {

    private final TokenCursor cursor;
    private final NounParser nouns;

    ExpressionParser(TokenCursor cursor, NounParser nouns) {
        this.cursor = cursor;
        this.nouns = nouns;
    }

    Expression parseExpression() {
        return parseBinary(1);
    }

    private Expression parseBinary(int minPrecedence) {
        return parseInfix(parseUnary(), minPrecedence);
    }

    private Expression parseInfix(Expression left, int minPrecedence) {
        while (true) {
            Token token = cursor.peek();
            BinaryOperator operator = infixOperator(token);
            if (operator == null || operator.precedence() < minPrecedence) {
                return left;
            }
            cursor.advance();
            Expression right;
            if (isNegativeNumber(token)) {
                // "<a> -1" lexes the minus into the literal
                Expression magnitude = postfix(positiveLiteral(token));
                right = parseInfix(magnitude, operator.precedence() + 1);
            } else {
                right = parseBinary(operator.precedence() + 1);
            }
            left = new Expression.Binary(left, operator, right, left.span().merged(right.span()));
        }
    }

    private Expression parseUnary() {
        Token token = cursor.peek();
        if (token.is(TokenKind.MINUS)) {
            cursor.advance();
            Expression operand = parseUnary();
            return new Expression.Unary(UnaryOperator.NEGATE, operand, token.span().merged(operand.span()));
        }
        if (token.is(Keyword.NOT)) {
            cursor.advance();
            Expression operand = parseUnary();
            return new Expression.Unary(UnaryOperator.NOT, operand, token.span().merged(operand.span()));
        }
        return postfix(parsePrimary());
    }

    private Expression postfix(Expression expression) {
        while (true) {
            if (cursor.atMemberDot()) {
                cursor.advance();
                Token member = cursor.advance();
                expression = new Expression.MemberAccess(expression, member.lexeme(),
                        expression.span().merged(member.span()));
            } else if (cursor.check(TokenKind.LEFT_BRACKET)) {
                cursor.advance();
                Expression index = parseExpression();
                Token close = cursor.expect(TokenKind.RIGHT_BRACKET, "']'");
                expression = new Expression.Subscript(expression, index, expression.span().merged(close.span()));
            } else if (cursor.check(Keyword.EXISTS)) {
                Token exists = cursor.advance();
                expression = new Expression.Existence(expression, expression.span().merged(exists.span()));
            } else if (cursor.check(Keyword.IS)) {
                cursor.advance();
                expression = parseTypeCheck(expression);
            } else {
                return expression;
            }
        }
    }

    private Expression parseTypeCheck(Expression operand) {
        if (cursor.match(TokenKind.LEFT_ANGLE)) {
            String typeName = nouns.parseCompoundIdentifier();
            Token close = cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
            return new Expression.TypeCheck(operand, typeName, operand.span().merged(close.span()));
        }
        if (!cursor.peek().isWord()) {
            throw cursor.unexpected("type name");
        }
        Token type = cursor.advance();
        return new Expression.TypeCheck(operand, type.lexeme(), operand.span().merged(type.span()));
    }

    private Expression parsePrimary() {
        Token token = cursor.peek();
        switch (token.kind()) {
            case INTEGER_LITERAL:
                cursor.advance();
                return literal(LiteralValue.integer((Long) token.value()), token);
            case FLOAT_LITERAL:
                cursor.advance();
                return literal(LiteralValue.decimal((Double) token.value()), token);
            case STRING_LITERAL:
                cursor.advance();
                return literal(LiteralValue.string(token.text()), token);
            case BOOLEAN_LITERAL:
                cursor.advance();
                return literal(LiteralValue.bool((Boolean) token.value()), token);
            case NULL_LITERAL:
                cursor.advance();
                return literal(LiteralValue.NULL, token);
            case REGEX_LITERAL:
                cursor.advance();
                return literal(LiteralValue.regex(token.lexeme()), token);
            case STRING_SEGMENT:
                return parseInterpolated();
            case LEFT_ANGLE:
                return parseVariable();
            case LEFT_PAREN: {
                cursor.advance();
                Expression inner = parseExpression();
                Token close = cursor.expect(TokenKind.RIGHT_PAREN, "')'");
                return new Expression.Grouped(inner, token.span().merged(close.span()));
            }
            case LEFT_BRACKET:
                return parseArray();
            case LEFT_BRACE:
                return parseMap();
            default:
                throw cursor.unexpected("expression");
        }
    }

    Expression.VariableRef parseVariable() {
        Token open = cursor.expect(TokenKind.LEFT_ANGLE, "'<'");
        QualifiedNoun noun = nouns.parseQualifiedNoun();
        Token close = cursor.expect(TokenKind.RIGHT_ANGLE, "'>'");
        return new Expression.VariableRef(noun, open.span().merged(close.span()));
    }

    private Expression parseInterpolated() {
        Token first = cursor.peek();
        List<Expression> parts = new ArrayList<>();
        Token last = first;
        while (true) {
            Token segment = cursor.expect(TokenKind.STRING_SEGMENT, "string segment");
            last = segment;
            if (!segment.text().isEmpty()) {
                parts.add(literal(LiteralValue.string(segment.text()), segment));
            }
            if (!cursor.match(TokenKind.INTERPOLATION_START)) {
                break;
            }
            parts.add(parseExpression());
            cursor.expect(TokenKind.INTERPOLATION_END, "'}' closing interpolation");
        }
        return new Expression.InterpolatedString(parts, first.span().merged(last.span()));
    }

    private Expression parseArray() {
        Token open = cursor.advance();
        List<Expression> elements = new ArrayList<>();
        while (!cursor.check(TokenKind.RIGHT_BRACKET)) {
            elements.add(parseExpression());
            if (!cursor.match(TokenKind.COMMA)) {
                break;
            }
        }
        Token close = cursor.expect(TokenKind.RIGHT_BRACKET, "']'");
        return new Expression.ArrayLiteral(elements, open.span().merged(close.span()));
    }

    private Expression parseMap() {
        Token open = cursor.advance();
        List<Expression.MapEntry> entries = new ArrayList<>();
        while (!cursor.check(TokenKind.RIGHT_BRACE)) {
            Token key = cursor.peek();
            if (!key.isWord() && !key.is(TokenKind.STRING_LITERAL)) {
                throw cursor.unexpected("map key");
            }
            cursor.advance();
            cursor.expect(TokenKind.COLON, "':'");
            entries.add(new Expression.MapEntry(key.text(), parseExpression()));
            if (!cursor.match(TokenKind.COMMA)) {
                break;
            }
        }
        Token close = cursor.expect(TokenKind.RIGHT_BRACE, "'}'");
        return new Expression.MapLiteral(entries, open.span().merged(close.span()));
    }

    private static Expression literal(LiteralValue value, Token token) {
        return new Expression.Literal(value, token.span());
    }

    private static BinaryOperator infixOperator(Token token) {
        switch (token.kind()) {
            case EQUAL_EQUAL: return BinaryOperator.EQUAL;
            case NOT_EQUAL: return BinaryOperator.NOT_EQUAL;
            case LEFT_ANGLE: return BinaryOperator.LESS;
            case LESS_EQUAL: return BinaryOperator.LESS_EQUAL;
            case RIGHT_ANGLE: return BinaryOperator.GREATER;
            case GREATER_EQUAL: return BinaryOperator.GREATER_EQUAL;
            case PLUS: return BinaryOperator.ADD;
            case MINUS: return BinaryOperator.SUBTRACT;
            case PLUS_PLUS: return BinaryOperator.CONCAT;
            case STAR: return BinaryOperator.MULTIPLY;
            case SLASH: return BinaryOperator.DIVIDE;
            case PERCENT: return BinaryOperator.MODULO;
            case INTEGER_LITERAL:
            case FLOAT_LITERAL:
                return isNegativeNumber(token) ? BinaryOperator.SUBTRACT : null;
            case KEYWORD:
                switch (token.keyword()) {
                    case OR: return BinaryOperator.OR;
                    case AND: return BinaryOperator.AND;
                    case CONTAINS: return BinaryOperator.CONTAINS;
                    case MATCHES: return BinaryOperator.MATCHES;
                    default: return null;
                }
            default:
                return null;
        }
    }

    private static boolean isNegativeNumber(Token token) {
        return (token.is(TokenKind.INTEGER_LITERAL) || token.is(TokenKind.FLOAT_LITERAL))
                && token.lexeme().startsWith("-");
    }

    /**
     * The literal part of a folded negative number, with the minus split off.
     */
    private static Expression positiveLiteral(Token token) {
        SourceLocation start = token.span().start();
        SourceLocation afterMinus = new SourceLocation(start.line(), start.column() + 1, start.offset() + 1);
        SourceSpan span = new SourceSpan(afterMinus, token.span().end());
        LiteralValue value = token.is(TokenKind.INTEGER_LITERAL)
                ? LiteralValue.integer(-(Long) token.value())
                : LiteralValue.decimal(-(Double) token.value());
        return new Expression.Literal(value, span);
    }
}

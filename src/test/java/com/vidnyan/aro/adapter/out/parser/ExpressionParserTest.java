package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.ast.AstPrinter;
import com.vidnyan.aro.domain.ast.Expression;
import com.vidnyan.aro.domain.ast.LiteralValue;
import com.vidnyan.aro.domain.ast.UnaryOperator;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private static Expression parse(String source) {
        TokenCursor cursor = new TokenCursor(Lexer.tokenize(source));
        Expression expression = new ExpressionParser(cursor, new NounParser(cursor)).parseExpression();
        assertTrue(cursor.isAtEnd(), "unparsed input after expression: " + cursor.peek());
        return expression;
    }

    private static String print(String source) {
        return new AstPrinter().print(parse(source));
    }

    @Test
    void parse_MultiplicationShouldBindTighterThanAddition() {
        assertEquals("(1 + (2 * 3))", print("1 + 2 * 3"));
        assertEquals("((1 * 2) + 3)", print("1 * 2 + 3"));
    }

    @Test
    void parse_ParenthesesShouldOverridePrecedence() {
        assertEquals("(((1 + 2)) * 3)", print("(1 + 2) * 3"));
    }

    @Test
    void parse_SamePrecedenceShouldAssociateLeft() {
        assertEquals("((10 - 4) - 3)", print("10 - 4 - 3"));
        assertEquals("((<a> ++ \"-\") ++ <b>)", print("<a> ++ \"-\" ++ <b>"));
    }

    @Test
    void parse_LogicalOperatorsShouldBindLoosest() {
        assertEquals("(<a> or (<b> and (not <c>)))", print("<a> or <b> and not <c>"));
        assertEquals("((<a> == 1) and (<b> != 2))", print("<a> == 1 and <b> != 2"));
    }

    @Test
    void parse_AngleBracketsShouldCompareInOperatorPosition() {
        assertEquals("(<a> < <b>)", print("<a> < <b>"));
        assertEquals("((<count> + 1) >= 10)", print("<count> + 1 >= 10"));
    }

    @Test
    void parse_NegativeNumberShouldBeLiteral() {
        // Act
        Expression expression = parse("-42");

        // Assert
        Expression.Literal literal = assertInstanceOf(Expression.Literal.class, expression);
        assertEquals(LiteralValue.integer(-42), literal.value());
    }

    @Test
    void parse_MinusBeforeVariableShouldBeUnary() {
        // Act
        Expression expression = parse("-<x>");

        // Assert
        Expression.Unary unary = assertInstanceOf(Expression.Unary.class, expression);
        assertEquals(UnaryOperator.NEGATE, unary.operator());
        assertEquals("(-<x>)", new AstPrinter().print(expression));
    }

    @Test
    void parse_GluedNegativeNumberAfterOperandShouldSubtract() {
        assertEquals("(<a> - 1)", print("<a> -1"));
        assertEquals("(<a> - (1 * 2))", print("<a> - 1 * 2"));
        assertEquals("(<a> - (1 * 2))", print("<a> -1 * 2"));
    }

    @Test
    void parse_PostfixOperatorsShouldBindTightest() {
        assertEquals("<user>.address.city", print("<user>.address.city"));
        assertEquals("<items>[(<i> + 1)]", print("<items>[<i> + 1]"));
        assertEquals("(<user> exists)", print("<user> exists"));
        assertEquals("(<x> is String)", print("<x> is String"));
        assertEquals("(<x> is Number)", print("<x> is <Number>"));
        assertEquals("(not (<user>.email exists))", print("not <user>.email exists"));
    }

    @Test
    void parse_ShouldReadCollectionLiterals() {
        assertEquals("[1, 2, \"three\"]", print("[1, 2, \"three\"]"));
        assertEquals("{name: <n>, age: 3}", print("{name: <n>, \"age\": 3}"));
        assertEquals("[]", print("[]"));
    }

    @Test
    void parse_ShouldReadInterpolatedString() {
        // Act
        Expression expression = parse("\"Hello ${<user>.name}, you are ${<age> + 1}\"");

        // Assert
        Expression.InterpolatedString string = assertInstanceOf(Expression.InterpolatedString.class, expression);
        assertEquals(4, string.parts().size());
        assertEquals("\"Hello ${<user>.name}, you are ${(<age> + 1)}\"", new AstPrinter().print(expression));
    }

    @Test
    void parse_ShouldReadContainsAndMatches() {
        assertEquals("(<roles> contains \"admin\")", print("<roles> contains \"admin\""));
        assertEquals("(<email> matches /@example\\.com$/)", print("<email> matches /@example\\.com$/"));
    }

    @Test
    void parse_QualifiedNounShouldKeepSpecifiers() {
        // Act
        Expression expression = parse("<request: body.user-id>");

        // Assert
        Expression.VariableRef ref = assertInstanceOf(Expression.VariableRef.class, expression);
        assertEquals("request", ref.name());
        assertEquals(List.of("body", "user-id"), ref.noun().specifiers());
    }

    @Test
    void parse_DanglingOperatorShouldReportEndOfFile() {
        // Act
        ParseException e = assertThrows(ParseException.class, () -> parse("1 +"));

        // Assert
        assertEquals(DiagnosticKind.UNEXPECTED_END_OF_FILE, e.toDiagnostic().kind());
    }
}

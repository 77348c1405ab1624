package com.vidnyan.aro.domain.ast;

public interface ExpressionVisitor<R> {

    R visitLiteral(Expression.Literal literal);

    R visitArray(Expression.ArrayLiteral array);

    R visitMap(Expression.MapLiteral map);

    R visitVariable(Expression.VariableRef variable);

    R visitBinary(Expression.Binary binary);

    R visitUnary(Expression.Unary unary);

    R visitMemberAccess(Expression.MemberAccess access);

    R visitSubscript(Expression.Subscript subscript);

    R visitGrouped(Expression.Grouped grouped);

    R visitExistence(Expression.Existence existence);

    R visitTypeCheck(Expression.TypeCheck check);

    R visitInterpolated(Expression.InterpolatedString string);
}

package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * Expression tree. Every node carries the span it was parsed from.
 */
public interface Expression {

    SourceSpan span();

    <R> R accept(ExpressionVisitor<R> visitor);

    record Literal(LiteralValue value, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record ArrayLiteral(List<Expression> elements, SourceSpan span) implements Expression {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    record MapEntry(String key, Expression value) {}

    record MapLiteral(List<MapEntry> entries, SourceSpan span) implements Expression {
        public MapLiteral {
            entries = List.copyOf(entries);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitMap(this);
        }
    }

    /**
     * {@code <name: specifiers>} used as a value.
     */
    record VariableRef(QualifiedNoun noun, SourceSpan span) implements Expression {
        public String name() {
            return noun.base();
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    record Binary(Expression left, BinaryOperator operator, Expression right, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Unary(UnaryOperator operator, Expression operand, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record MemberAccess(Expression base, String member, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitMemberAccess(this);
        }
    }

    record Subscript(Expression base, Expression index, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    record Grouped(Expression inner, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitGrouped(this);
        }
    }

    /**
     * {@code <x> exists}.
     */
    record Existence(Expression operand, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitExistence(this);
        }
    }

    /**
     * {@code <x> is TypeName}.
     */
    record TypeCheck(Expression operand, String typeName, SourceSpan span) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitTypeCheck(this);
        }
    }

    /**
     * String with {@code ${...}} parts. Text parts are string literals.
     */
    record InterpolatedString(List<Expression> parts, SourceSpan span) implements Expression {
        public InterpolatedString {
            parts = List.copyOf(parts);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitInterpolated(this);
        }
    }
}

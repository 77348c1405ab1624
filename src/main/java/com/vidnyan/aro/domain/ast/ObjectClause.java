package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.token.Preposition;

/**
 * Preposition plus object of an ARO statement.
 * Exactly one of {@code noun} and {@code expression} is set.
 */
public record ObjectClause(
    Preposition preposition,
    QualifiedNoun noun,
    Expression expression
) {

    public static ObjectClause of(Preposition preposition, QualifiedNoun noun) {
        return new ObjectClause(preposition, noun, null);
    }

    public static ObjectClause ofExpression(Preposition preposition, Expression expression) {
        return new ObjectClause(preposition, null, expression);
    }

    public boolean hasNoun() {
        return noun != null;
    }

    public String describe() {
        return preposition.word() + " " + (noun != null ? noun.fullName() : "<expression>");
    }
}

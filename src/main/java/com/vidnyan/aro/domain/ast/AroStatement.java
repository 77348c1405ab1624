package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

/**
 * Action-Result-Object statement, e.g. {@code Extract the <user> from the <request>.}
 *
 * @param action           the verb
 * @param result           result noun, null when the result is a value ({@code Log "x" to <console>.})
 * @param resultExpression value used in place of a result noun, else null
 * @param object           preposition clause, null when omitted ({@code Emit <Done: event>.})
 * @param withValue        trailing {@code with <expr>} value, else null
 * @param guard            {@code when <expr>} condition, else null
 */
public record AroStatement(
    Action action,
    QualifiedNoun result,
    Expression resultExpression,
    ObjectClause object,
    Expression withValue,
    Expression guard,
    SourceSpan span
) implements Statement {

    public ActionRole role() {
        return action.role();
    }

    public boolean isGuarded() {
        return guard != null;
    }

    /**
     * An unguarded Return or Throw.
     */
    public boolean isTerminal() {
        return action.isTerminal() && guard == null;
    }

    /**
     * Event type named by an Emit statement, else null.
     */
    public String emittedEventType() {
        if (!action.is("emit") || result == null) {
            return null;
        }
        return result.base();
    }

    public QualifiedNoun objectNoun() {
        return object != null ? object.noun() : null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAro(this);
    }
}

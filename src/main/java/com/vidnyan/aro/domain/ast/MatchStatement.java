package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * {@code match <subject> { case ... { } otherwise { } }}.
 * Exactly one clause runs; there is no fallthrough.
 *
 * @param otherwise statements of the otherwise clause, null when absent
 */
public record MatchStatement(
    QualifiedNoun subject,
    List<CaseClause> cases,
    List<Statement> otherwise,
    SourceSpan span
) implements Statement {

    public MatchStatement {
        cases = List.copyOf(cases);
        otherwise = otherwise == null ? null : List.copyOf(otherwise);
    }

    public boolean hasOtherwise() {
        return otherwise != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitMatch(this);
    }
}

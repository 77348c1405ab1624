package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

public record CaseClause(
    Pattern pattern,
    Expression guard,
    List<Statement> body,
    SourceSpan span
) {

    public CaseClause {
        body = List.copyOf(body);
    }
}

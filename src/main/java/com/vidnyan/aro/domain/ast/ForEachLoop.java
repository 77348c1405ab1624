package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * {@code [parallel] for each <item> [at <index>] in <items> [where expr] [with <concurrency: N>] { }}.
 * Parallelism is metadata only.
 *
 * @param indexVariable null when no index is bound
 * @param filter        null when there is no where clause
 * @param concurrency   null when unbounded or sequential
 */
public record ForEachLoop(
    String itemVariable,
    String indexVariable,
    QualifiedNoun collection,
    Expression filter,
    boolean parallel,
    Integer concurrency,
    List<Statement> body,
    SourceSpan span
) implements Statement {

    public ForEachLoop {
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForEach(this);
    }
}

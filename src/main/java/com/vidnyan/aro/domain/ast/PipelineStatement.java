package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * Two or more ARO statements chained with {@code ->}.
 */
public record PipelineStatement(
    List<AroStatement> stages,
    SourceSpan span
) implements Statement {

    public PipelineStatement {
        stages = List.copyOf(stages);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPipeline(this);
    }
}

package com.vidnyan.aro.domain.ast;

public interface StatementVisitor<R> {

    R visitAro(AroStatement statement);

    R visitPublish(PublishStatement statement);

    R visitRequire(RequireStatement statement);

    R visitMatch(MatchStatement statement);

    R visitForEach(ForEachLoop loop);

    R visitPipeline(PipelineStatement pipeline);
}

package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

/**
 * {@code Publish as <external-name> <internal-variable>.}
 */
public record PublishStatement(
    String externalName,
    String internalVariable,
    SourceSpan span
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPublish(this);
    }
}

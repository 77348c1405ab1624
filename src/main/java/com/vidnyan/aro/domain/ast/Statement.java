package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

/**
 * A statement inside a feature set body.
 */
public interface Statement {

    SourceSpan span();

    <R> R accept(StatementVisitor<R> visitor);
}

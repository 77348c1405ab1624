package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * Root of the syntax tree. Immutable once built.
 */
public record Program(
    List<ImportDeclaration> imports,
    List<FeatureSet> featureSets,
    SourceSpan span
) {

    public Program {
        imports = List.copyOf(imports);
        featureSets = List.copyOf(featureSets);
    }

    public static Program empty() {
        return new Program(List.of(), List.of(), SourceSpan.EMPTY);
    }

    public boolean isEmpty() {
        return featureSets.isEmpty() && imports.isEmpty();
    }
}

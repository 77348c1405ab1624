package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

/**
 * {@code import ../path} declaration. Resolution happens outside the compiler.
 */
public record ImportDeclaration(
    String path,
    SourceSpan span
) {}

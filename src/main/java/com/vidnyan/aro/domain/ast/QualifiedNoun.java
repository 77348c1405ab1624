package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * A noun with optional specifiers, e.g. {@code <user: id.name>}.
 */
public record QualifiedNoun(
    String base,
    List<String> specifiers,
    SourceSpan span
) {

    public QualifiedNoun {
        specifiers = specifiers == null ? List.of() : List.copyOf(specifiers);
    }

    public static QualifiedNoun of(String base, SourceSpan span) {
        return new QualifiedNoun(base, List.of(), span);
    }

    public String fullName() {
        if (specifiers.isEmpty()) {
            return base;
        }
        return base + ": " + String.join(".", specifiers);
    }

    @Override
    public String toString() {
        return fullName();
    }
}

package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.model.SourceLocation;

/**
 * Fatal tokenization error. A corrupted token stream cannot be recovered locally,
 * so the whole compile stops at the first one.
 */
public class LexerException extends RuntimeException {

    private final DiagnosticKind kind;
    private final SourceLocation location;

    public LexerException(DiagnosticKind kind, String message, SourceLocation location) {
        super(message);
        this.kind = kind;
        this.location = location;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.builder(kind)
                .message(getMessage())
                .location(location)
                .build();
    }
}

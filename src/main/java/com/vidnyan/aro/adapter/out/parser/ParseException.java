package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import com.vidnyan.aro.domain.model.SourceLocation;

import java.util.List;

/**
 * Syntax error raised at the failure point and caught at statement or feature set level,
 * where the parser reports it and resynchronizes.
 */
public class ParseException extends RuntimeException {

    private final DiagnosticKind kind;
    private final SourceLocation location;
    private final List<String> hints;

    public ParseException(DiagnosticKind kind, String message, SourceLocation location, String... hints) {
        super(message);
        this.kind = kind;
        this.location = location;
        this.hints = List.of(hints);
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
                .hints(hints)
                .build();
    }
}

package com.vidnyan.aro.domain.diagnostic;

import com.vidnyan.aro.domain.model.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates diagnostics for a single compile call.
 * Not thread-safe; one instance per compilation.
 */
public final class DiagnosticCollector {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportAll(List<Diagnostic> batch) {
        diagnostics.addAll(batch);
    }

    public void error(DiagnosticKind kind, String message, SourceLocation location, String... hints) {
        report(new Diagnostic(kind, Severity.ERROR, message, location, List.of(hints)));
    }

    public void warning(DiagnosticKind kind, String message, SourceLocation location, String... hints) {
        report(new Diagnostic(kind, Severity.WARNING, message, location, List.of(hints)));
    }

    public void note(DiagnosticKind kind, String message, SourceLocation location) {
        report(new Diagnostic(kind, Severity.NOTE, message, location, List.of()));
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    public int size() {
        return diagnostics.size();
    }
}

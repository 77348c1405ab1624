package com.vidnyan.aro.domain.diagnostic;

import com.vidnyan.aro.domain.model.SourceLocation;

import java.util.List;

/**
 * A compiler finding.
 * Immutable value object; location is absent for program-wide findings.
 */
public record Diagnostic(
    DiagnosticKind kind,
    Severity severity,
    String message,
    SourceLocation location,
    List<String> hints
) {

    public Diagnostic {
        hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }

    /**
     * Format as {@code severity [line:column]: message} followed by one line per hint.
     */
    public String format() {
        StringBuilder sb = new StringBuilder(severity.label());
        if (location != null) {
            sb.append(" [").append(location.format()).append("]");
        }
        sb.append(": ").append(message);
        for (String hint : hints) {
            sb.append("\n  hint: ").append(hint);
        }
        return sb.toString();
    }

    /**
     * Builder for Diagnostic.
     */
    public static Builder builder(DiagnosticKind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final DiagnosticKind kind;
        private Severity severity;
        private String message;
        private SourceLocation location;
        private List<String> hints = List.of();

        private Builder(DiagnosticKind kind) {
            this.kind = kind;
            this.severity = kind.defaultSeverity();
        }

        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder message(String msg) { this.message = msg; return this; }
        public Builder message(String format, Object... args) { this.message = String.format(format, args); return this; }
        public Builder location(SourceLocation loc) { this.location = loc; return this; }
        public Builder hints(List<String> hintList) { this.hints = hintList; return this; }
        public Builder hints(String... hintList) { this.hints = List.of(hintList); return this; }

        public Diagnostic build() {
            return new Diagnostic(kind, severity, message, location, hints);
        }
    }
}

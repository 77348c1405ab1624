package com.vidnyan.aro.application.port.in;

import com.vidnyan.aro.domain.analysis.AnalyzedProgram;
import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.Severity;

import java.util.List;

/**
 * Primary use case: compile source text into an analyzed program.
 * This is the main entry point to the compiler.
 */
public interface CompileUseCase {

    /**
     * Run lexer, parser and semantic analysis. Never throws for bad input.
     * @param source UTF-8 source text of one merged compilation unit
     * @return program, analysis and every diagnostic found
     */
    CompilationResult compile(String source);

    /**
     * Compile and render a deterministic text report.
     */
    String compileWithReport(String source);

    /**
     * Compilation result.
     * When tokenization fails the program and analysis are empty and only the lexical error is reported.
     */
    record CompilationResult(
        Program program,
        AnalyzedProgram analyzedProgram,
        List<Diagnostic> diagnostics,
        CompilationStats stats
    ) {
        public CompilationResult {
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean isSuccess() {
            return !hasErrors();
        }

        public boolean hasErrors() {
            return diagnostics.stream().anyMatch(Diagnostic::isError);
        }

        public List<Diagnostic> errors() {
            return diagnostics.stream().filter(Diagnostic::isError).toList();
        }

        public List<Diagnostic> warnings() {
            return diagnostics.stream().filter(Diagnostic::isWarning).toList();
        }

        public int count(Severity severity) {
            return (int) diagnostics.stream()
                    .filter(d -> d.severity() == severity)
                    .count();
        }
    }

    /**
     * Compilation statistics.
     */
    record CompilationStats(
        int tokenCount,
        int featureSetCount,
        int statementCount,
        long totalDurationMs
    ) {}
}

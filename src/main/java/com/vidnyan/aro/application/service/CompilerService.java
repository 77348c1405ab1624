package com.vidnyan.aro.application.service;

import com.vidnyan.aro.application.port.in.CompileUseCase;
import com.vidnyan.aro.application.port.out.ReportRenderer;
import com.vidnyan.aro.application.port.out.SourceParser;
import com.vidnyan.aro.domain.analysis.AnalyzedProgram;
import com.vidnyan.aro.domain.diagnostic.DiagnosticCollector;
import com.vidnyan.aro.domain.diagnostic.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application service that sequences the compiler stages.
 * Implements the primary use case.
 * <p>
 * Every call owns its diagnostics collector and symbol registry, so one instance may serve
 * concurrent callers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompilerService implements CompileUseCase {

    private final SourceParser sourceParser;
    private final SemanticAnalyzer semanticAnalyzer;
    private final ReportRenderer reportRenderer;

    @Override
    public CompilationResult compile(String source) {
        Instant startTime = Instant.now();
        DiagnosticCollector diagnostics = new DiagnosticCollector();

        // Step 1: Tokenize and parse
        log.debug("Step 1: Parsing source ({} chars)...", source.length());
        SourceParser.ParsingResult parsingResult = sourceParser.parse(source, diagnostics);

        AnalyzedProgram analyzedProgram;
        if (!parsingResult.tokenized()) {
            log.info("Compilation stopped after a lexical error");
            analyzedProgram = AnalyzedProgram.empty();
        } else {
            log.debug("Parsed: {} feature sets, {} statements",
                    parsingResult.stats().featureSetCount(),
                    parsingResult.stats().statementCount());

            // Step 2: Semantic analysis
            log.debug("Step 2: Analyzing...");
            analyzedProgram = semanticAnalyzer.analyze(parsingResult.program(), diagnostics);
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        CompilationStats stats = new CompilationStats(
                parsingResult.stats().tokenCount(),
                parsingResult.stats().featureSetCount(),
                parsingResult.stats().statementCount(),
                totalDuration.toMillis()
        );
        CompilationResult result = new CompilationResult(
                parsingResult.program(), analyzedProgram, diagnostics.diagnostics(), stats);

        log.info("Compilation complete: {} errors, {} warnings in {}ms",
                result.count(Severity.ERROR), result.count(Severity.WARNING), stats.totalDurationMs());
        return result;
    }

    @Override
    public String compileWithReport(String source) {
        return reportRenderer.render(compile(source));
    }
}

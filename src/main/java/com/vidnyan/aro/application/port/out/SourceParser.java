package com.vidnyan.aro.application.port.out;

import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.diagnostic.DiagnosticCollector;

/**
 * Port for turning source text into a syntax tree.
 * Implemented by the lexer/parser adapter.
 */
public interface SourceParser {

    /**
     * Tokenize and parse. Syntax errors are reported to the collector; a lexical error ends parsing
     * and yields an empty program.
     */
    ParsingResult parse(String source, DiagnosticCollector diagnostics);

    /**
     * Parsing result.
     */
    record ParsingResult(
        Program program,
        boolean tokenized,
        ParsingStats stats
    ) {
        public static ParsingResult lexicalFailure(long durationMs) {
            return new ParsingResult(Program.empty(), false, new ParsingStats(0, 0, 0, durationMs));
        }
    }

    /**
     * Parsing statistics.
     */
    record ParsingStats(
        int tokenCount,
        int featureSetCount,
        int statementCount,
        long durationMs
    ) {}
}

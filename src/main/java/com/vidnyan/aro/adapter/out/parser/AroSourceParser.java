package com.vidnyan.aro.adapter.out.parser;

import com.vidnyan.aro.application.port.out.SourceParser;
import com.vidnyan.aro.domain.ast.AstWalker;
import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.diagnostic.DiagnosticCollector;
import com.vidnyan.aro.domain.token.Token;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Source parser backed by the hand-written lexer and recursive-descent parser.
 * Stateless; a fresh lexer and parser are created per call.
 */
@Slf4j
@Component
public class AroSourceParser implements SourceParser {

    @Override
    public ParsingResult parse(String source, DiagnosticCollector diagnostics) {
        long startTime = System.currentTimeMillis();

        List<Token> tokens;
        try {
            tokens = Lexer.tokenize(source);
        } catch (LexerException e) {
            log.warn("Tokenization failed at {}: {}", e.getLocation().format(), e.getMessage());
            diagnostics.report(e.toDiagnostic());
            return ParsingResult.lexicalFailure(System.currentTimeMillis() - startTime);
        }
        log.debug("Tokenized {} tokens", tokens.size());

        int errorsBefore = diagnostics.size();
        Program program = new Parser(tokens, diagnostics).parse();
        int syntaxErrors = diagnostics.size() - errorsBefore;
        if (syntaxErrors > 0) {
            log.debug("Parser recovered from {} syntax errors", syntaxErrors);
        }

        AtomicInteger statements = new AtomicInteger();
        for (FeatureSet featureSet : program.featureSets()) {
            AstWalker.walk(featureSet.statements(), s -> statements.incrementAndGet());
        }

        long duration = System.currentTimeMillis() - startTime;
        return new ParsingResult(program, true,
                new ParsingStats(tokens.size(), program.featureSets().size(), statements.get(), duration));
    }
}

package com.vidnyan.aro.adapter.out.check;

import com.vidnyan.aro.domain.ast.*;
import com.vidnyan.aro.domain.check.CheckContext;
import com.vidnyan.aro.domain.check.ProgramCheck;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags statements that follow a terminal statement in the same list.
 * One warning per list, nested lists included.
 */
@Component
@Order(20)
public class UnreachableCodeCheck implements ProgramCheck {

    @Override
    public List<Diagnostic> check(CheckContext context) {
        List<Diagnostic> findings = new ArrayList<>();
        for (FeatureSet featureSet : context.program().featureSets()) {
            checkBlock(featureSet.statements(), findings);
        }
        return findings;
    }

    private void checkBlock(List<Statement> statements, List<Diagnostic> findings) {
        boolean reported = false;
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            checkNested(statement, findings);
            if (!reported && i + 1 < statements.size() && Terminality.isTerminal(statement)) {
                Statement next = statements.get(i + 1);
                findings.add(Diagnostic.builder(DiagnosticKind.UNREACHABLE_CODE)
                        .message("Unreachable code after '%s' statement", Terminality.verbOf(statement))
                        .location(next.span().start())
                        .hints("Remove the statements after the terminal statement")
                        .build());
                reported = true;
            }
        }
    }

    private void checkNested(Statement statement, List<Diagnostic> findings) {
        if (statement instanceof MatchStatement match) {
            for (CaseClause clause : match.cases()) {
                checkBlock(clause.body(), findings);
            }
            if (match.hasOtherwise()) {
                checkBlock(match.otherwise(), findings);
            }
        } else if (statement instanceof ForEachLoop loop) {
            checkBlock(loop.body(), findings);
        }
    }
}

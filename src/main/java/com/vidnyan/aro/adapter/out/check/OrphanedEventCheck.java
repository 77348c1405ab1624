package com.vidnyan.aro.adapter.out.check;

import com.vidnyan.aro.domain.ast.AroStatement;
import com.vidnyan.aro.domain.ast.AstWalker;
import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.check.CheckContext;
import com.vidnyan.aro.domain.check.ProgramCheck;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Warns about Emit statements whose event type no feature set handles.
 */
@Component
@Order(40)
public class OrphanedEventCheck implements ProgramCheck {

    @Override
    public List<Diagnostic> check(CheckContext context) {
        Set<String> handled = new HashSet<>();
        context.program().featureSets().stream()
                .map(FeatureSet::handledEventType)
                .filter(Objects::nonNull)
                .forEach(handled::add);

        List<Diagnostic> findings = new ArrayList<>();
        for (FeatureSet featureSet : context.program().featureSets()) {
            for (AroStatement statement : AstWalker.aroStatements(featureSet.statements())) {
                String eventType = statement.emittedEventType();
                if (eventType == null || handled.contains(eventType)) {
                    continue;
                }
                findings.add(Diagnostic.builder(DiagnosticKind.ORPHANED_EVENT)
                        .message("Event '%s' is emitted but no handler exists", eventType)
                        .location(statement.span().start())
                        .hints("Add a feature set with business activity '" + eventType + " Handler'")
                        .build());
            }
        }
        return findings;
    }
}

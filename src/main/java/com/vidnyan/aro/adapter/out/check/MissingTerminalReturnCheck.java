package com.vidnyan.aro.adapter.out.check;

import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.check.CheckContext;
import com.vidnyan.aro.domain.check.ProgramCheck;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(30)
public class MissingTerminalReturnCheck implements ProgramCheck {

    @Override
    public List<Diagnostic> check(CheckContext context) {
        return context.program().featureSets().stream()
                .filter(fs -> !Terminality.endsBlock(fs.statements()))
                .map(this::missingReturn)
                .toList();
    }

    private Diagnostic missingReturn(FeatureSet featureSet) {
        return Diagnostic.builder(DiagnosticKind.MISSING_TERMINAL_RETURN)
                .message("Feature set '%s' has no Return or Throw statement at its end", featureSet.name())
                .location(featureSet.span().start())
                .hints("End the feature set with e.g. Return an <OK: status> for the <result>.")
                .build();
    }
}

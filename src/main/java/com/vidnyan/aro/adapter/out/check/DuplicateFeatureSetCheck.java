package com.vidnyan.aro.adapter.out.check;

import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.check.CheckContext;
import com.vidnyan.aro.domain.check.ProgramCheck;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.DiagnosticKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature set names must be unique across the program.
 * The first declaration wins; every later one is reported.
 */
@Slf4j
@Component
@Order(10)
public class DuplicateFeatureSetCheck implements ProgramCheck {

    @Override
    public List<Diagnostic> check(CheckContext context) {
        List<Diagnostic> findings = new ArrayList<>();
        Map<String, FeatureSet> firstByName = new HashMap<>();

        for (FeatureSet featureSet : context.program().featureSets()) {
            FeatureSet first = firstByName.putIfAbsent(featureSet.name(), featureSet);
            if (first == null) {
                continue;
            }
            log.debug("Duplicate feature set: {}", featureSet.name());
            findings.add(Diagnostic.builder(DiagnosticKind.DUPLICATE_FEATURE_SET)
                    .message("Duplicate feature set '%s'", featureSet.name())
                    .location(featureSet.span().start())
                    .hints("First defined at " + first.span().start().format(),
                            "Rename one of the feature sets")
                    .build());
        }
        return findings;
    }
}

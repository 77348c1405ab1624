package com.vidnyan.aro.domain.analysis;

import com.vidnyan.aro.domain.ast.Program;
import com.vidnyan.aro.domain.graph.EventGraph;
import com.vidnyan.aro.domain.symbol.GlobalSymbolRegistry;

import java.util.List;

/**
 * Analysis output for a whole program. The program itself is never modified.
 */
public record AnalyzedProgram(
    Program program,
    List<AnalyzedFeatureSet> featureSets,
    GlobalSymbolRegistry registry,
    EventGraph eventGraph
) {

    public AnalyzedProgram {
        featureSets = List.copyOf(featureSets);
    }

    public static AnalyzedProgram empty() {
        return new AnalyzedProgram(Program.empty(), List.of(), new GlobalSymbolRegistry(), EventGraph.empty());
    }

    public AnalyzedFeatureSet featureSet(String name) {
        return featureSets.stream()
                .filter(fs -> fs.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}

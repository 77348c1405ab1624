package com.vidnyan.aro.domain.analysis;

import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.symbol.Symbol;
import com.vidnyan.aro.domain.symbol.SymbolTable;

import java.util.List;
import java.util.Set;

/**
 * Analysis output for one feature set.
 *
 * @param symbolTable  top-level scope after the last statement
 * @param dataFlows    one entry per statement, nested statements included, in pre-order
 * @param dependencies names pulled in from outside the feature set
 * @param exports      names published to other feature sets
 */
public record AnalyzedFeatureSet(
    FeatureSet featureSet,
    SymbolTable symbolTable,
    List<DataFlowInfo> dataFlows,
    Set<String> dependencies,
    Set<String> exports
) {

    public AnalyzedFeatureSet {
        dataFlows = List.copyOf(dataFlows);
        dependencies = Set.copyOf(dependencies);
        exports = Set.copyOf(exports);
    }

    public String name() {
        return featureSet.name();
    }

    public Symbol symbol(String name) {
        return symbolTable.lookup(name);
    }
}

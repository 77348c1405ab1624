package com.vidnyan.aro.adapter.out.report;

import com.vidnyan.aro.CompilerProperties;
import com.vidnyan.aro.application.port.in.CompileUseCase.CompilationResult;
import com.vidnyan.aro.application.port.out.ReportRenderer;
import com.vidnyan.aro.domain.analysis.AnalyzedFeatureSet;
import com.vidnyan.aro.domain.analysis.DataFlowInfo;
import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.ast.ImportDeclaration;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.Severity;
import com.vidnyan.aro.domain.symbol.Symbol;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Human-readable compilation report.
 * Output depends only on the result, never on timing, so it can be compared against golden files.
 */
@Component
@Primary
@RequiredArgsConstructor
public class TextReportRenderer implements ReportRenderer {

    private final CompilerProperties properties;

    @Override
    public String format() {
        return "text";
    }

    @Override
    public String render(CompilationResult result) {
        String heavy = "═".repeat(properties.getReportWidth());
        String light = "─".repeat(properties.getReportWidth());
        StringBuilder report = new StringBuilder();

        report.append(heavy).append('\n');
        report.append("ARO Compilation Report\n");
        report.append(heavy).append("\n\n");

        report.append(result.isSuccess() ? "✅ Compilation successful\n" : "❌ Compilation failed\n");
        report.append("Errors: ").append(result.count(Severity.ERROR))
                .append(", Warnings: ").append(result.count(Severity.WARNING)).append("\n\n");

        section(report, light, "AST Summary");
        appendAstSummary(report, result);

        section(report, light, "Symbol Tables");
        for (AnalyzedFeatureSet analyzed : result.analyzedProgram().featureSets()) {
            appendSymbols(report, analyzed);
        }
        report.append('\n');

        section(report, light, "Data Flow Analysis");
        for (AnalyzedFeatureSet analyzed : result.analyzedProgram().featureSets()) {
            appendDataFlow(report, analyzed);
        }
        report.append('\n');

        section(report, light, "Diagnostics");
        appendDiagnostics(report, result.diagnostics());

        report.append('\n').append(heavy).append('\n');
        return report.toString();
    }

    private void section(StringBuilder report, String rule, String title) {
        report.append(rule).append('\n');
        report.append(title).append('\n');
        report.append(rule).append('\n');
    }

    private void appendAstSummary(StringBuilder report, CompilationResult result) {
        List<ImportDeclaration> imports = result.program().imports();
        if (!imports.isEmpty()) {
            report.append("Imports: ").append(imports.size()).append('\n');
            imports.forEach(i -> report.append("  ").append(i.path()).append('\n'));
        }
        List<FeatureSet> featureSets = result.program().featureSets();
        report.append("Feature Sets: ").append(featureSets.size()).append('\n');
        for (int i = 0; i < featureSets.size(); i++) {
            FeatureSet fs = featureSets.get(i);
            report.append("\n[").append(i + 1).append("] ").append(fs.name()).append('\n');
            report.append("    Business Activity: ").append(fs.businessActivity()).append('\n');
            report.append("    Statements: ").append(fs.statements().size()).append('\n');
        }
        report.append('\n');
    }

    private void appendSymbols(StringBuilder report, AnalyzedFeatureSet analyzed) {
        report.append('\n').append(analyzed.name()).append(":\n");
        Map<String, Symbol> sorted = new TreeMap<>(analyzed.symbolTable().symbols());
        if (sorted.isEmpty()) {
            report.append("  (no symbols)\n");
        }
        sorted.values().forEach(symbol -> report.append("  ").append(symbol.format()).append('\n'));
        if (!analyzed.dependencies().isEmpty()) {
            report.append("  Dependencies: ")
                    .append(String.join(", ", new TreeSet<>(analyzed.dependencies()))).append('\n');
        }
        if (!analyzed.exports().isEmpty()) {
            report.append("  Exports: ")
                    .append(String.join(", ", new TreeSet<>(analyzed.exports()))).append('\n');
        }
    }

    private void appendDataFlow(StringBuilder report, AnalyzedFeatureSet analyzed) {
        report.append('\n').append(analyzed.name()).append(":\n");
        List<DataFlowInfo> flows = analyzed.dataFlows();
        for (int i = 0; i < flows.size(); i++) {
            DataFlowInfo flow = flows.get(i);
            report.append("  [").append(i + 1).append("] <").append(flow.label()).append(">\n");
            report.append("      Inputs:  ").append(String.join(", ", flow.inputs())).append('\n');
            report.append("      Outputs: ").append(String.join(", ", flow.outputs())).append('\n');
            if (!flow.sideEffects().isEmpty()) {
                report.append("      Effects: ").append(String.join(", ", flow.sideEffects())).append('\n');
            }
        }
    }

    private void appendDiagnostics(StringBuilder report, List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            report.append("(none)\n");
            return;
        }
        for (Diagnostic diagnostic : diagnostics) {
            String icon = switch (diagnostic.severity()) {
                case ERROR -> "🔴";
                case WARNING -> "🟡";
                case NOTE -> "🔵";
            };
            report.append(icon).append(' ').append(diagnostic.format()).append('\n');
        }
    }
}

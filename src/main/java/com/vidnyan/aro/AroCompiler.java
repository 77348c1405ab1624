package com.vidnyan.aro;

import com.vidnyan.aro.adapter.out.check.*;
import com.vidnyan.aro.adapter.out.parser.AroSourceParser;
import com.vidnyan.aro.adapter.out.report.JsonReportRenderer;
import com.vidnyan.aro.adapter.out.report.TextReportRenderer;
import com.vidnyan.aro.application.port.in.CompileUseCase;
import com.vidnyan.aro.application.port.out.ReportRenderer;
import com.vidnyan.aro.application.service.CompilerService;
import com.vidnyan.aro.application.service.SemanticAnalyzer;
import com.vidnyan.aro.config.CompilerConfiguration;
import com.vidnyan.aro.domain.check.ProgramCheck;

import java.util.List;

/**
 * Wiring for use without a Spring context, e.g. from tests or other tools.
 */
public final class AroCompiler {

    private AroCompiler() {
    }

    public static CompileUseCase create() {
        return create(CompilerProperties.defaults());
    }

    public static CompileUseCase create(CompilerProperties properties) {
        return new CompilerService(
                new AroSourceParser(),
                new SemanticAnalyzer(properties, defaultChecks()),
                new TextReportRenderer(properties));
    }

    /**
     * Checks in the order the Spring context runs them.
     */
    public static List<ProgramCheck> defaultChecks() {
        return List.of(
                new DuplicateFeatureSetCheck(),
                new UnreachableCodeCheck(),
                new MissingTerminalReturnCheck(),
                new OrphanedEventCheck(),
                new CircularEventChainCheck());
    }

    public static ReportRenderer jsonRenderer() {
        return new JsonReportRenderer(CompilerConfiguration.createObjectMapper());
    }
}

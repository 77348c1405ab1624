package com.vidnyan.aro.adapter.out.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.aro.application.port.in.CompileUseCase.CompilationResult;
import com.vidnyan.aro.application.port.out.ReportRenderer;
import com.vidnyan.aro.domain.ast.FeatureSet;
import com.vidnyan.aro.domain.diagnostic.Diagnostic;
import com.vidnyan.aro.domain.diagnostic.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Machine-readable report for editors and CI tooling.
 * Diagnostics use the shape {@code {severity, message, location?, hints[]}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper objectMapper;

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String render(CompilationResult result) {
        ReportDto dto = new ReportDto(
                result.isSuccess(),
                result.count(Severity.ERROR),
                result.count(Severity.WARNING),
                result.program().featureSets().stream().map(FeatureSet::name).toList(),
                result.diagnostics().stream().map(JsonReportRenderer::toDto).toList()
        );
        try {
            return objectMapper.writeValueAsString(dto);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize report: {}", e.getMessage());
            throw new UncheckedIOException("Failed to serialize report", e);
        }
    }

    private static DiagnosticDto toDto(Diagnostic diagnostic) {
        LocationDto location = diagnostic.location() == null
                ? null
                : new LocationDto(diagnostic.location().line(), diagnostic.location().column());
        return new DiagnosticDto(
                diagnostic.severity().label(),
                diagnostic.kind().name(),
                diagnostic.message(),
                location,
                diagnostic.hints());
    }

    public record ReportDto(
        boolean success,
        int errorCount,
        int warningCount,
        List<String> featureSets,
        List<DiagnosticDto> diagnostics
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DiagnosticDto(
        String severity,
        String kind,
        String message,
        LocationDto location,
        List<String> hints
    ) {}

    public record LocationDto(int line, int column) {}
}

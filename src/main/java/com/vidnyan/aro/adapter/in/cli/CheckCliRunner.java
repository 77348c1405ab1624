package com.vidnyan.aro.adapter.in.cli;

import com.vidnyan.aro.application.port.in.CompileUseCase;
import com.vidnyan.aro.application.port.in.CompileUseCase.CompilationResult;
import com.vidnyan.aro.application.port.out.ReportRenderer;
import com.vidnyan.aro.domain.diagnostic.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for checking a single source file.
 * Runs when aro.check.path property is set; exits with 1 when the file has errors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckCliRunner implements CommandLineRunner {

    private final CompileUseCase compileUseCase;
    private final List<ReportRenderer> renderers;
    private final ConfigurableApplicationContext context;

    @Value("${aro.check.path:}")
    private String sourcePath;

    @Value("${aro.check.format:text}")
    private String format;

    @Override
    public void run(String... args) {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set aro.check.path property.");
            return;
        }

        int exitCode = 2;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║                  ARO - Compiler Front End                    ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Checking: {}", truncatePath(sourcePath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            exitCode = check(Path.of(sourcePath), format);
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    /**
     * Compile one file and log the rendered report.
     *
     * @return 0 when the file compiled, 1 when it has errors, 2 when it could not be read
     */
    public int check(Path path, String reportFormat) {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", path, e.getMessage());
            return 2;
        }

        CompilationResult result = compileUseCase.compile(source);
        ReportRenderer renderer = findRenderer(reportFormat);
        log.info("\n{}", renderer.render(result));
        log.info("{}: {} errors, {} warnings",
                path.getFileName(), result.count(Severity.ERROR), result.count(Severity.WARNING));
        return result.isSuccess() ? 0 : 1;
    }

    private ReportRenderer findRenderer(String reportFormat) {
        return renderers.stream()
                .filter(r -> r.format().equalsIgnoreCase(reportFormat))
                .findFirst()
                .orElseGet(() -> {
                    log.warn("Unknown report format '{}', using text", reportFormat);
                    return renderers.stream()
                            .filter(r -> r.format().equals("text"))
                            .findFirst()
                            .orElse(renderers.get(0));
                });
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}

package com.vidnyan.aro.application.port.out;

import com.vidnyan.aro.application.port.in.CompileUseCase.CompilationResult;

/**
 * Port for rendering a compilation result for people or tools.
 */
public interface ReportRenderer {

    /**
     * Format key, e.g. {@code text} or {@code json}.
     */
    String format();

    String render(CompilationResult result);
}

package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.List;

/**
 * A named unit of behavior: {@code (Name: Business Activity) { statements }}.
 */
public record FeatureSet(
    String name,
    String businessActivity,
    List<Statement> statements,
    SourceSpan span
) {

    private static final String HANDLER_SUFFIX = " Handler";

    public FeatureSet {
        statements = List.copyOf(statements);
    }

    /**
     * Event type this feature set handles, or null when it is not an event handler.
     * A business activity of {@code "UserCreated Handler"} handles {@code UserCreated}.
     */
    public String handledEventType() {
        if (!businessActivity.endsWith(HANDLER_SUFFIX)) {
            return null;
        }
        String type = businessActivity.substring(0, businessActivity.length() - HANDLER_SUFFIX.length()).trim();
        return type.isEmpty() ? null : type;
    }
}

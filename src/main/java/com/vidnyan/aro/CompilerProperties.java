package com.vidnyan.aro;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for the compiler.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "aro.compiler")
public class CompilerProperties {

    /**
     * Runtime-provided context names that resolve without a binding.
     * Compared case-insensitively.
     */
    private List<String> builtinContexts = new ArrayList<>();

    /**
     * Business activity fragments of handlers triggered by the runtime instead of an Emit.
     * Such handlers are not sources in the event graph.
     */
    private List<String> externalHandlerActivities = new ArrayList<>();

    /**
     * Names starting with this prefix may be rebound.
     */
    private String reservedPrefix = "_";

    /**
     * Width of the rules in the text report.
     */
    private int reportWidth = 63;

    @PostConstruct
    public void init() {
        if (builtinContexts.isEmpty()) {
            builtinContexts.addAll(List.of(
                    "request", "incoming-request", "context", "session", "pathparameters",
                    "queryparameters", "headers", "console", "application", "event", "events",
                    "env", "environment", "port", "host", "directory", "file"));
        }
        if (externalHandlerActivities.isEmpty()) {
            externalHandlerActivities.addAll(List.of(
                    "Socket Event Handler", "File Event Handler", "Application-End"));
        }
    }

    /**
     * Defaults without a Spring context.
     */
    public static CompilerProperties defaults() {
        CompilerProperties properties = new CompilerProperties();
        properties.init();
        return properties;
    }

    public boolean isBuiltinContext(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return builtinContexts.stream().anyMatch(b -> b.toLowerCase(Locale.ROOT).equals(lower));
    }

    public boolean isExternallyTriggered(String businessActivity) {
        return externalHandlerActivities.stream().anyMatch(businessActivity::contains);
    }

    public boolean isReserved(String name) {
        return reservedPrefix != null && !reservedPrefix.isEmpty() && name.startsWith(reservedPrefix);
    }
}

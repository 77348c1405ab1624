package com.vidnyan.aro.domain.ast;

import java.util.Locale;
import java.util.Set;

/**
 * Semantic role of an action verb. Drives data flow, never execution.
 */
public enum ActionRole {
    /** Pulls data in from the object (extract, parse, fetch, ...). */
    REQUEST,
    /** Computes a new value locally. */
    OWN,
    /** Sends data out (return, throw, emit, ...). */
    RESPONSE,
    /** Makes a binding visible to other feature sets. */
    EXPORT;

    private static final Set<String> REQUEST_VERBS =
            Set.of("extract", "parse", "retrieve", "fetch", "read", "receive", "get", "load");
    private static final Set<String> RESPONSE_VERBS =
            Set.of("return", "throw", "send", "emit", "respond", "output", "write", "log", "print", "notify");
    private static final Set<String> EXPORT_VERBS =
            Set.of("publish", "export", "expose", "share");

    public static ActionRole classify(String verb) {
        String lower = verb.toLowerCase(Locale.ROOT);
        if (REQUEST_VERBS.contains(lower)) return REQUEST;
        if (RESPONSE_VERBS.contains(lower)) return RESPONSE;
        if (EXPORT_VERBS.contains(lower)) return EXPORT;
        return OWN;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package com.vidnyan.aro.domain.ast;

import com.vidnyan.aro.domain.model.SourceSpan;

import java.util.Locale;

/**
 * The verb heading an ARO statement.
 */
public record Action(
    String verb,
    SourceSpan span
) {

    public ActionRole role() {
        return ActionRole.classify(verb);
    }

    public boolean is(String name) {
        return verb.equalsIgnoreCase(name);
    }

    /**
     * Return and Throw end the enclosing statement list.
     */
    public boolean isTerminal() {
        return is("return") || is("throw");
    }

    public String lowercase() {
        return verb.toLowerCase(Locale.ROOT);
    }
}

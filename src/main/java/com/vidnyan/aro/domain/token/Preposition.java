package com.vidnyan.aro.domain.token;

import java.util.Locale;

/**
 * Prepositions that link an action result to its object.
 * {@code for} and {@code at} are lexed as keywords and mapped here by the parser.
 */
public enum Preposition {
    FROM,
    AGAINST,
    TO,
    INTO,
    VIA,
    WITH,
    ON,
    BY,
    FOR,
    AT;

    public String word() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * True for prepositions that read data from the object.
     */
    public boolean isSource() {
        return this == FROM || this == VIA || this == AGAINST;
    }
}

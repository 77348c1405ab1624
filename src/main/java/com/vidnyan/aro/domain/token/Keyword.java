package com.vidnyan.aro.domain.token;

import java.util.Locale;

/**
 * Reserved words of the language.
 * Matched case-insensitively; the token keeps the original spelling.
 */
public enum Keyword {
    PUBLISH,
    REQUIRE,
    IMPORT,
    AS,
    IF,
    THEN,
    ELSE,
    WHEN,
    MATCH,
    CASE,
    OTHERWISE,
    WHERE,
    FOR,
    EACH,
    IN,
    AT,
    PARALLEL,
    CONCURRENCY,
    TYPE,
    ENUM,
    PROTOCOL,
    ERROR,
    GUARD,
    DEFER,
    ASSERT,
    PRECONDITION,
    AND,
    OR,
    NOT,
    IS,
    EXISTS,
    DEFINED,
    EMPTY,
    CONTAINS,
    MATCHES;

    public String word() {
        return name().toLowerCase(Locale.ROOT);
    }
}

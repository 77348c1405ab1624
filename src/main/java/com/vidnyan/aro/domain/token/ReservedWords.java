package com.vidnyan.aro.domain.token;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Single case-insensitive lookup table for keywords, articles, prepositions and word literals.
 * Built once; lookups are a lowercase conversion plus one map lookup.
 */
public final class ReservedWords {

    /**
     * What a reserved word resolves to.
     */
    public record Entry(TokenKind kind, Object value) {}

    private static final Map<String, Entry> TABLE = new HashMap<>();

    static {
        for (Keyword keyword : Keyword.values()) {
            TABLE.put(keyword.word(), new Entry(TokenKind.KEYWORD, keyword));
        }
        for (Article article : Article.values()) {
            TABLE.put(article.word(), new Entry(TokenKind.ARTICLE, article));
        }
        for (Preposition preposition : Preposition.values()) {
            // for/at stay keywords
            TABLE.putIfAbsent(preposition.word(), new Entry(TokenKind.PREPOSITION, preposition));
        }
        TABLE.put("true", new Entry(TokenKind.BOOLEAN_LITERAL, Boolean.TRUE));
        TABLE.put("false", new Entry(TokenKind.BOOLEAN_LITERAL, Boolean.FALSE));
        TABLE.put("null", new Entry(TokenKind.NULL_LITERAL, null));
        TABLE.put("nil", new Entry(TokenKind.NULL_LITERAL, null));
        TABLE.put("none", new Entry(TokenKind.NULL_LITERAL, null));
    }

    private ReservedWords() {
    }

    /**
     * Resolve a word, or return null when it is a plain identifier.
     */
    public static Entry lookup(String word) {
        return TABLE.get(word.toLowerCase(Locale.ROOT));
    }
}

package com.vidnyan.aro.domain.symbol;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published names across all feature sets of one compilation.
 * Created fresh for every compile call and passed explicitly; never shared between calls.
 */
public final class GlobalSymbolRegistry {

    /**
     * A published symbol and the feature set that owns it.
     */
    public record Entry(String featureSet, Symbol symbol) {}

    private final Map<String, Entry> published = new LinkedHashMap<>();

    /**
     * Register a published symbol. The first registration of a name wins.
     */
    public void register(String featureSet, Symbol symbol) {
        published.putIfAbsent(symbol.name(), new Entry(featureSet, symbol));
    }

    public Entry lookup(String name) {
        return published.get(name);
    }

    public boolean isPublished(String name) {
        return published.containsKey(name);
    }

    public int size() {
        return published.size();
    }
}

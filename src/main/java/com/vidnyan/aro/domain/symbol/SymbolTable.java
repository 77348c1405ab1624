package com.vidnyan.aro.domain.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persistent scope. {@link #define} and {@link #updateVisibility} return a new table and leave
 * this one untouched, so branch scopes can be explored without rolling anything back.
 */
public final class SymbolTable {

    private final String scopeId;
    private final String scopeName;
    private final SymbolTable parent;
    private final Map<String, Symbol> symbols;

    private SymbolTable(String scopeId, String scopeName, SymbolTable parent, Map<String, Symbol> symbols) {
        this.scopeId = scopeId;
        this.scopeName = scopeName;
        this.parent = parent;
        this.symbols = Collections.unmodifiableMap(symbols);
    }

    public static SymbolTable root(String scopeId, String scopeName) {
        return new SymbolTable(scopeId, scopeName, null, new LinkedHashMap<>());
    }

    public SymbolTable createChild(String childId, String childName) {
        return new SymbolTable(childId, childName, this, new LinkedHashMap<>());
    }

    /**
     * New table with the symbol bound in this scope, replacing any local binding of the same name.
     */
    public SymbolTable define(Symbol symbol) {
        Map<String, Symbol> copy = new LinkedHashMap<>(symbols);
        copy.put(symbol.name(), symbol);
        return new SymbolTable(scopeId, scopeName, parent, copy);
    }

    /**
     * New table with the local symbol's visibility changed. Unchanged when the name is not local.
     */
    public SymbolTable updateVisibility(String name, Visibility visibility) {
        Symbol existing = symbols.get(name);
        if (existing == null) {
            return this;
        }
        return define(existing.withVisibility(visibility));
    }

    /**
     * Resolve through this scope and its ancestors.
     */
    public Symbol lookup(String name) {
        for (SymbolTable table = this; table != null; table = table.parent) {
            Symbol symbol = table.symbols.get(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    public Symbol lookupLocal(String name) {
        return symbols.get(name);
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public boolean containsLocal(String name) {
        return symbols.containsKey(name);
    }

    /**
     * Symbols bound in this scope, in definition order.
     */
    public Map<String, Symbol> symbols() {
        return symbols;
    }

    /**
     * Every visible symbol; inner bindings shadow outer ones.
     */
    public Map<String, Symbol> allSymbols() {
        Map<String, Symbol> all = parent == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parent.allSymbols());
        all.putAll(symbols);
        return Collections.unmodifiableMap(all);
    }

    public List<Symbol> publishedSymbols() {
        List<Symbol> published = new ArrayList<>();
        for (Symbol symbol : symbols.values()) {
            if (symbol.visibility() == Visibility.PUBLISHED) {
                published.add(symbol);
            }
        }
        return published;
    }

    public String scopeId() {
        return scopeId;
    }

    public String scopeName() {
        return scopeName;
    }

    public SymbolTable parent() {
        return parent;
    }
}

package com.vidnyan.aro.domain.symbol;

/**
 * Where a symbol gets its value from.
 *
 * @param reference the object a value was extracted from, or the aliased symbol; null otherwise
 */
public record SymbolSource(
    Kind kind,
    String reference
) {

    public enum Kind {
        EXTRACTED,
        COMPUTED,
        PARAMETER,
        ALIAS
    }

    public static final SymbolSource COMPUTED = new SymbolSource(Kind.COMPUTED, null);
    public static final SymbolSource PARAMETER = new SymbolSource(Kind.PARAMETER, null);

    public static SymbolSource extracted(String from) {
        return new SymbolSource(Kind.EXTRACTED, from);
    }

    public static SymbolSource alias(String of) {
        return new SymbolSource(Kind.ALIAS, of);
    }

    public String describe() {
        return switch (kind) {
            case EXTRACTED -> "extracted from " + reference;
            case COMPUTED -> "computed";
            case PARAMETER -> "parameter";
            case ALIAS -> "alias of " + reference;
        };
    }
}

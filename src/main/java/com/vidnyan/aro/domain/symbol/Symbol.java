package com.vidnyan.aro.domain.symbol;

import com.vidnyan.aro.domain.model.SourceSpan;

/**
 * A named binding.
 *
 * @param dataType null when no type could be inferred
 */
public record Symbol(
    String name,
    SourceSpan definedAt,
    Visibility visibility,
    SymbolSource source,
    DataType dataType
) {

    public Symbol withVisibility(Visibility newVisibility) {
        return new Symbol(name, definedAt, newVisibility, source, dataType);
    }

    /**
     * {@code name: visibility (Type) [source: ...]}.
     */
    public String format() {
        StringBuilder sb = new StringBuilder(name).append(": ").append(visibility.label());
        if (dataType != null) {
            sb.append(" (").append(dataType.name()).append(')');
        }
        return sb.append(" [source: ").append(source.describe()).append(']').toString();
    }
}

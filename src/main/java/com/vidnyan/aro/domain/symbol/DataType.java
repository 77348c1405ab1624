package com.vidnyan.aro.domain.symbol;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Inferred type of a symbol, named after the first specifier of the bound noun.
 */
public record DataType(String name) {

    public static final DataType IDENTIFIER = new DataType("Identifier");
    public static final DataType HASH = new DataType("Hash");
    public static final DataType RECORD = new DataType("Record");
    public static final DataType STATUS = new DataType("Status");
    public static final DataType BOOLEAN = new DataType("Boolean");
    public static final DataType ERROR = new DataType("Error");

    private static final Map<String, DataType> KNOWN = Map.of(
            "identifier", IDENTIFIER,
            "id", IDENTIFIER,
            "hash", HASH,
            "checksum", HASH,
            "record", RECORD,
            "status", STATUS,
            "result", BOOLEAN,
            "error", ERROR);

    /**
     * Infer a type from noun specifiers; null when there are none.
     */
    public static DataType infer(List<String> specifiers) {
        if (specifiers == null || specifiers.isEmpty()) {
            return null;
        }
        String first = specifiers.get(0);
        DataType known = KNOWN.get(first.toLowerCase(Locale.ROOT));
        if (known != null) {
            return known;
        }
        return new DataType(Character.toUpperCase(first.charAt(0)) + first.substring(1));
    }

    @Override
    public String toString() {
        return name;
    }
}

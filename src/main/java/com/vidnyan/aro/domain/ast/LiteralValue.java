package com.vidnyan.aro.domain.ast;

/**
 * A constant value.
 */
public record LiteralValue(
    Kind kind,
    Object value
) {

    public enum Kind {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        NULL,
        REGEX
    }

    public static final LiteralValue NULL = new LiteralValue(Kind.NULL, null);

    public static LiteralValue string(String value) {
        return new LiteralValue(Kind.STRING, value);
    }

    public static LiteralValue integer(long value) {
        return new LiteralValue(Kind.INTEGER, value);
    }

    public static LiteralValue decimal(double value) {
        return new LiteralValue(Kind.FLOAT, value);
    }

    public static LiteralValue bool(boolean value) {
        return new LiteralValue(Kind.BOOLEAN, value);
    }

    /**
     * Regex literal, stored in its {@code /pattern/flags} source form.
     */
    public static LiteralValue regex(String literal) {
        return new LiteralValue(Kind.REGEX, literal);
    }

    public String render() {
        return switch (kind) {
            case STRING -> "\"" + value + "\"";
            case NULL -> "null";
            default -> String.valueOf(value);
        };
    }
}

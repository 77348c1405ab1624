package com.vidnyan.aro.domain.model;

/**
 * Position in the source text.
 * Lines and columns are 1-based, offset is the 0-based character index.
 */
public record SourceLocation(
    int line,
    int column,
    int offset
) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    /**
     * Create a location at the given line and column.
     */
    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isBefore(SourceLocation other) {
        return offset < other.offset;
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return format();
    }
}

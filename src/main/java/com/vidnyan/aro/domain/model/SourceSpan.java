package com.vidnyan.aro.domain.model;

/**
 * Contiguous range of source text. The end location is exclusive.
 */
public record SourceSpan(
    SourceLocation start,
    SourceLocation end
) {

    public static final SourceSpan EMPTY = new SourceSpan(SourceLocation.START, SourceLocation.START);

    /**
     * Create a zero-width span at a location.
     */
    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Smallest span covering both this span and the other one.
     */
    public SourceSpan merged(SourceSpan other) {
        SourceLocation first = start.isBefore(other.start) ? start : other.start;
        SourceLocation last = other.end.isBefore(end) ? end : other.end;
        return new SourceSpan(first, last);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    /**
     * True when this span ends exactly where the other begins.
     */
    public boolean touches(SourceSpan other) {
        return end.offset() == other.start.offset();
    }

    public String format() {
        return start.format();
    }

    @Override
    public String toString() {
        return start.format() + "-" + end.format();
    }
}

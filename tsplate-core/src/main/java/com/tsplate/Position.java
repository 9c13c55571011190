package com.tsplate;

/**
 * Half-open character range {@code [start, end)} over a template source, plus the
 * 0-based line on which it starts.
 *
 * <p>Positions are only used for diagnostics and source maps. Line and column
 * information for an arbitrary offset is computed on demand by {@link #locate(String)}.</p>
 */
public record Position(
    int start,
    int end,
    int lineStart
) {
    public Position {
        if (start < 0) {
            throw new IllegalArgumentException("Position start must not be negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("Position end " + end + " is before start " + start);
        }
    }

    /**
     * Creates a single character range starting at {@code start}.
     */
    public static Position at(int start, int lineStart) {
        return new Position(start, start + 1, lineStart);
    }

    public int length() {
        return end - start;
    }

    /**
     * Resolves line and column of both ends of this range by scanning {@code code}.
     */
    public SourceLocation locate(String code) {
        return new SourceLocation(SourceLocation.Point.of(code, start), SourceLocation.Point.of(code, end));
    }
}

package com.tsplate;

/**
 * Line/column view of a {@link Position}, resolved against the source text.
 */
public record SourceLocation(Point start, Point end) {

    /**
     * A resolved offset. Lines are 0-based. The column counts characters since the
     * last newline, so the first character of a line has column 1 and the newline
     * that opens a line has column 0.
     */
    public record Point(int index, int line, int column) {

        static Point of(String code, int index) {
            int line = 0;
            int lastNewline = -1;
            int limit = Math.min(index, code.length() - 1);
            for (int i = 0; i <= limit; i++) {
                if (code.charAt(i) == '\n') {
                    line++;
                    lastNewline = i;
                }
            }
            return new Point(index, line, index - lastNewline);
        }
    }
}
